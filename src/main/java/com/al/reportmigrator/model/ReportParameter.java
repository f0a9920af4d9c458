package com.al.reportmigrator.model;

import com.al.reportmigrator.model.enums.ValueType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportParameter {

    private String name;

    @Builder.Default
    private ValueType valueType = ValueType.STRING;

    private String defaultValue;

    private String promptText;

    private boolean allowMultiple;

    /**
     * Static pick list offered to the user.
     */
    @Builder.Default
    private List<String> listOfValues = new ArrayList<>();
}
