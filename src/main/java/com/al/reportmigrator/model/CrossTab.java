package com.al.reportmigrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Cross-tab grid. Coordinates and size are in twips.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CrossTab {

    private String name;

    private double x;

    private double y;

    private double width;

    private double height;

    @Builder.Default
    private List<String> rowFields = new ArrayList<>();

    @Builder.Default
    private List<String> columnFields = new ArrayList<>();

    @Builder.Default
    private List<CrossTabCell> summaryCells = new ArrayList<>();

    @Builder.Default
    private boolean showRowTotals = true;

    @Builder.Default
    private boolean showColumnTotals = true;

    @Builder.Default
    private boolean showGrandTotal = true;
}
