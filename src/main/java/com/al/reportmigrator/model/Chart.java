package com.al.reportmigrator.model;

import com.al.reportmigrator.model.enums.ChartType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Chart object. Coordinates and size are in twips.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Chart {

    private String name;

    @Builder.Default
    private ChartType chartType = ChartType.BAR;

    private double x;

    private double y;

    private double width;

    private double height;

    /**
     * Field supplying the category axis labels.
     */
    private String categoryField;

    @Builder.Default
    private List<ChartSeries> series = new ArrayList<>();

    private String groupField;

    private String title;

    @Builder.Default
    private String legendPosition = "right";

    private boolean threeDimensional;
}
