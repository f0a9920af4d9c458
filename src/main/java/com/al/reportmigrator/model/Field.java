package com.al.reportmigrator.model;

import com.al.reportmigrator.model.enums.SourceKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A positioned object inside a section. Coordinates and size are in twips,
 * relative to the owning section.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Field {

    private String name;

    /**
     * Column reference, formula or parameter name, special field name or literal text.
     */
    private String source;

    private SourceKind sourceKind;

    private double x;

    private double y;

    private double width;

    private double height;

    private FontSpec font;

    private FormatSpec format;

    private String suppressCondition;

    @Builder.Default
    private List<ConditionalFormat> conditionalFormats = new ArrayList<>();
}
