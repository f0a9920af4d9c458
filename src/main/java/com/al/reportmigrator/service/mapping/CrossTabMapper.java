package com.al.reportmigrator.service.mapping;

import com.al.reportmigrator.config.ConversionProperties;
import com.al.reportmigrator.model.CrossTab;
import com.al.reportmigrator.model.CrossTabCell;
import com.al.reportmigrator.model.enums.SummaryFunction;
import com.al.reportmigrator.model.target.TargetCrossTab;
import com.al.reportmigrator.util.TargetNames;
import com.al.reportmigrator.util.UnitConverter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps cross-tabs onto matrix layout definitions. The matrix itself has no
 * automatic counterpart, so every mapped cross-tab carries a warning.
 */
@Component
@RequiredArgsConstructor
public class CrossTabMapper {

    static final String PREFIX = "CT_";

    private final ConversionProperties properties;

    public TargetCrossTab map(CrossTab crossTab) {
        if (crossTab.getName() == null || crossTab.getName().isBlank()) {
            throw new IllegalArgumentException("Cross-tab without a name");
        }
        TargetCrossTab.TargetCrossTabBuilder builder = TargetCrossTab.builder()
                .sourceName(crossTab.getName())
                .name(TargetNames.objectName(PREFIX, crossTab.getName()))
                .x(convert(crossTab.getX()))
                .y(convert(crossTab.getY()))
                .width(convert(crossTab.getWidth()))
                .height(convert(crossTab.getHeight()))
                .showRowTotals(crossTab.isShowRowTotals())
                .showColumnTotals(crossTab.isShowColumnTotals())
                .showGrandTotal(crossTab.isShowGrandTotal());

        columns(crossTab.getRowFields()).forEach(builder::rowColumn);
        columns(crossTab.getColumnFields()).forEach(builder::columnColumn);
        if (crossTab.getSummaryCells() != null) {
            for (CrossTabCell cell : crossTab.getSummaryCells()) {
                SummaryFunction function = cell.getSummary() == null ? SummaryFunction.SUM : cell.getSummary();
                builder.summary(new TargetCrossTab.Summary(cell.getName(),
                        TargetNames.columnName(cell.getFieldName()), function.getSqlName(), cell.getFormatString()));
            }
        }
        builder.warning("Cross-tab requires a matrix layout; build it manually");
        return builder.build();
    }

    private static List<String> columns(List<String> fields) {
        return fields == null ? List.of() : fields.stream().map(TargetNames::columnName).collect(Collectors.toList());
    }

    private double convert(double twips) {
        return UnitConverter.fromTwips(twips, properties.getCoordinateUnit());
    }
}
