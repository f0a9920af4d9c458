package com.al.reportmigrator.model.target;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TargetParameter {

    String sourceName;

    String name;

    String dataType;

    int width;

    String initialValue;

    /**
     * Static list-of-values query, null when the parameter has no pick list.
     */
    String listOfValues;

    String promptText;

    boolean allowMultiple;

    @Singular
    List<String> warnings;
}
