package com.al.reportmigrator.dto;

import com.al.reportmigrator.model.enums.ConversionStatus;
import com.al.reportmigrator.model.target.LayoutResult;
import com.al.reportmigrator.model.target.TargetChart;
import com.al.reportmigrator.model.target.TargetConnection;
import com.al.reportmigrator.model.target.TargetCrossTab;
import com.al.reportmigrator.model.target.TargetSubreport;
import com.al.reportmigrator.model.target.ProgramUnit;
import com.al.reportmigrator.model.target.TargetParameter;
import com.al.reportmigrator.model.target.TargetQuery;
import com.al.reportmigrator.model.target.TranslatedExpression;
import com.al.reportmigrator.model.target.Trigger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything produced for one report, ready for the target code generator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransformedReport {

    private String name;

    private String sourcePath;

    @Builder.Default
    private List<TargetConnection> connections = new ArrayList<>();

    @Builder.Default
    private List<TargetQuery> queries = new ArrayList<>();

    @Builder.Default
    private List<TargetParameter> parameters = new ArrayList<>();

    @Builder.Default
    private List<TranslatedExpression> formulas = new ArrayList<>();

    private LayoutResult layout;

    @Builder.Default
    private List<TargetSubreport> subreports = new ArrayList<>();

    @Builder.Default
    private List<TargetChart> charts = new ArrayList<>();

    @Builder.Default
    private List<TargetCrossTab> crossTabs = new ArrayList<>();

    /**
     * Every trigger generated by the layout, then subreport suppress triggers.
     */
    @Builder.Default
    private List<Trigger> triggers = new ArrayList<>();

    /**
     * Formula functions first, then triggers.
     */
    @Builder.Default
    private List<ProgramUnit> programUnits = new ArrayList<>();

    private ConversionStatistics statistics;

    @Builder.Default
    private List<ConversionIssue> issues = new ArrayList<>();

    private long processingTimeMs;

    public ConversionStatus getStatus() {
        return statistics == null ? ConversionStatus.FAILED : statistics.getStatus();
    }
}
