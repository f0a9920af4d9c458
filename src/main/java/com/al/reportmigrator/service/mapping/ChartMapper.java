package com.al.reportmigrator.service.mapping;

import com.al.reportmigrator.config.ConversionProperties;
import com.al.reportmigrator.model.Chart;
import com.al.reportmigrator.model.ChartSeries;
import com.al.reportmigrator.model.enums.ChartType;
import com.al.reportmigrator.model.target.TargetChart;
import com.al.reportmigrator.util.TargetNames;
import com.al.reportmigrator.util.UnitConverter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Maps charts onto graph definitions bound to report columns.
 */
@Component
@RequiredArgsConstructor
public class ChartMapper {

    static final String PREFIX = "CH_";

    private final ConversionProperties properties;

    public TargetChart map(Chart chart) {
        if (chart.getName() == null || chart.getName().isBlank()) {
            throw new IllegalArgumentException("Chart without a name");
        }
        ChartType type = chart.getChartType() == null ? ChartType.UNKNOWN : chart.getChartType();
        TargetChart.TargetChartBuilder builder = TargetChart.builder()
                .sourceName(chart.getName())
                .name(TargetNames.objectName(PREFIX, chart.getName()))
                .graphType(type.getGraphType())
                .x(convert(chart.getX()))
                .y(convert(chart.getY()))
                .width(convert(chart.getWidth()))
                .height(convert(chart.getHeight()))
                .categoryColumn(column(chart.getCategoryField()))
                .groupColumn(column(chart.getGroupField()))
                .title(chart.getTitle())
                .legendPosition(chart.getLegendPosition())
                .threeDimensional(chart.isThreeDimensional());

        if (chart.getSeries() != null) {
            for (ChartSeries series : chart.getSeries()) {
                if (series.getFieldName() != null && !series.getFieldName().isBlank()) {
                    builder.valueColumn(TargetNames.columnName(series.getFieldName()));
                }
            }
        }
        if (type == ChartType.UNKNOWN) {
            builder.warning("Unknown chart style; drawn as " + type.getGraphType());
        }
        if (chart.isThreeDimensional()) {
            builder.warning("3D chart style may need manual adjustment");
        }
        return builder.build();
    }

    private String column(String field) {
        return field == null || field.isBlank() ? null : TargetNames.columnName(field);
    }

    private double convert(double twips) {
        return UnitConverter.fromTwips(twips, properties.getCoordinateUnit());
    }
}
