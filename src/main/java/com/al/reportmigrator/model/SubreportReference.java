package com.al.reportmigrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A report embedded in the parent. Coordinates and size are in twips.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubreportReference {

    private String name;

    private String filePath;

    private double x;

    private double y;

    private double width;

    private double height;

    @Builder.Default
    private List<SubreportLink> links = new ArrayList<>();

    private String suppressCondition;

    /**
     * Rendered only when the reader asks for it.
     */
    private boolean onDemand;
}
