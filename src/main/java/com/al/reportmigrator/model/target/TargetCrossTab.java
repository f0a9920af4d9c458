package com.al.reportmigrator.model.target;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Cross-tab described as a matrix layout: row and column dimensions plus
 * the aggregated cells.
 */
@Value
@Builder
public class TargetCrossTab {

    String sourceName;

    String name;

    double x;

    double y;

    double width;

    double height;

    @Singular
    List<String> rowColumns;

    @Singular
    List<String> columnColumns;

    @Singular
    List<Summary> summaries;

    boolean showRowTotals;

    boolean showColumnTotals;

    boolean showGrandTotal;

    @Singular
    List<String> warnings;

    @Value
    public static class Summary {

        String name;

        String column;

        String function;

        String format;
    }
}
