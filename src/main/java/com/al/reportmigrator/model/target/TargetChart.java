package com.al.reportmigrator.model.target;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TargetChart {

    String sourceName;

    String name;

    String graphType;

    double x;

    double y;

    double width;

    double height;

    String categoryColumn;

    @Singular
    List<String> valueColumns;

    String groupColumn;

    String title;

    String legendPosition;

    boolean threeDimensional;

    @Singular
    List<String> warnings;
}
