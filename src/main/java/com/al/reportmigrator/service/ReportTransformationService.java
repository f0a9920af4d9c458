package com.al.reportmigrator.service;

import com.al.reportmigrator.config.ConversionProperties;
import com.al.reportmigrator.config.LayoutProperties;
import com.al.reportmigrator.dto.ConversionIssue;
import com.al.reportmigrator.dto.ConversionStatistics;
import com.al.reportmigrator.dto.TransformedReport;
import com.al.reportmigrator.model.Chart;
import com.al.reportmigrator.model.CrossTab;
import com.al.reportmigrator.model.DataSource;
import com.al.reportmigrator.model.Formula;
import com.al.reportmigrator.model.Group;
import com.al.reportmigrator.model.QueryDefinition;
import com.al.reportmigrator.model.ReportDefinition;
import com.al.reportmigrator.model.ReportParameter;
import com.al.reportmigrator.model.Section;
import com.al.reportmigrator.model.SubreportReference;
import com.al.reportmigrator.model.enums.ConversionOutcome;
import com.al.reportmigrator.model.enums.FrameKind;
import com.al.reportmigrator.model.enums.PageOrientation;
import com.al.reportmigrator.model.enums.ProgramUnitKind;
import com.al.reportmigrator.model.enums.SectionRole;
import com.al.reportmigrator.model.target.Frame;
import com.al.reportmigrator.model.target.LayoutResult;
import com.al.reportmigrator.model.target.ProgramUnit;
import com.al.reportmigrator.model.target.TargetChart;
import com.al.reportmigrator.model.target.TargetConnection;
import com.al.reportmigrator.model.target.TargetCrossTab;
import com.al.reportmigrator.model.target.TargetParameter;
import com.al.reportmigrator.model.target.TargetQuery;
import com.al.reportmigrator.model.target.TargetSubreport;
import com.al.reportmigrator.model.target.TranslatedExpression;
import com.al.reportmigrator.model.target.Trigger;
import com.al.reportmigrator.service.expression.ExpressionTranslator;
import com.al.reportmigrator.service.expression.FormatTriggerTranslator;
import com.al.reportmigrator.service.expression.TriggerNameSequence;
import com.al.reportmigrator.service.layout.LayoutSynthesizer;
import com.al.reportmigrator.service.layout.SourceBindings;
import com.al.reportmigrator.service.mapping.ChartMapper;
import com.al.reportmigrator.service.mapping.ConnectionMapper;
import com.al.reportmigrator.service.mapping.CrossTabMapper;
import com.al.reportmigrator.service.mapping.ParameterMapper;
import com.al.reportmigrator.service.mapping.QueryMapper;
import com.al.reportmigrator.service.mapping.SubreportMapper;
import com.al.reportmigrator.util.UnitConverter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts one parsed report: connections, queries, parameters, formulas,
 * layout, then subreports, charts and cross-tabs.
 * <p>
 * Every element is counted exactly once in the report's statistics. A
 * failure in one element is recorded as an issue and never aborts the rest
 * of the report.
 */
@Slf4j
@Service
public class ReportTransformationService {

    private final ConnectionMapper connectionMapper;
    private final QueryMapper queryMapper;
    private final ParameterMapper parameterMapper;
    private final ExpressionTranslator expressionTranslator;
    private final FormatTriggerTranslator triggerTranslator;
    private final LayoutSynthesizer layoutSynthesizer;
    private final SubreportMapper subreportMapper;
    private final ChartMapper chartMapper;
    private final CrossTabMapper crossTabMapper;
    private final ConversionProperties conversionProperties;
    private final LayoutProperties layoutProperties;
    private final MeterRegistry meterRegistry;

    @Autowired
    public ReportTransformationService(ConnectionMapper connectionMapper,
            QueryMapper queryMapper,
            ParameterMapper parameterMapper,
            ExpressionTranslator expressionTranslator,
            FormatTriggerTranslator triggerTranslator,
            LayoutSynthesizer layoutSynthesizer,
            SubreportMapper subreportMapper,
            ChartMapper chartMapper,
            CrossTabMapper crossTabMapper,
            ConversionProperties conversionProperties,
            LayoutProperties layoutProperties,
            MeterRegistry meterRegistry) {
        this.connectionMapper = connectionMapper;
        this.queryMapper = queryMapper;
        this.parameterMapper = parameterMapper;
        this.expressionTranslator = expressionTranslator;
        this.triggerTranslator = triggerTranslator;
        this.layoutSynthesizer = layoutSynthesizer;
        this.subreportMapper = subreportMapper;
        this.chartMapper = chartMapper;
        this.crossTabMapper = crossTabMapper;
        this.conversionProperties = conversionProperties;
        this.layoutProperties = layoutProperties;
        this.meterRegistry = meterRegistry;
    }

    public TransformedReport transform(ReportDefinition report) {
        if (report == null) {
            throw new IllegalArgumentException("Report definition is required");
        }
        long startTime = System.currentTimeMillis();
        Timer.Sample sample = Timer.start(meterRegistry);
        log.info("Transforming report '{}': {} data sources, {} queries, {} parameters, {} formulas, "
                + "{} sections, {} groups", report.getName(), size(report.getDataSources()),
                size(report.getQueries()), size(report.getParameters()), size(report.getFormulas()),
                size(report.getSections()), size(report.getGroups()));

        ConversionStatistics statistics = new ConversionStatistics();
        List<ConversionIssue> issues = new ArrayList<>();

        List<TargetConnection> connections = mapConnections(report.getDataSources(), statistics, issues);
        List<TargetQuery> queries = mapQueries(report.getQueries(), statistics, issues);
        List<TargetParameter> parameters = mapParameters(report.getParameters(), statistics, issues);
        List<TranslatedExpression> formulas = translateFormulas(report.getFormulas(), statistics, issues);

        Map<String, String> formulaNames = new HashMap<>();
        for (TranslatedExpression formula : formulas) {
            formulaNames.put(formula.getSourceName(), formula.getTargetName());
        }
        TriggerNameSequence sequence = new TriggerNameSequence();
        LayoutResult layout = synthesizeLayout(report, new SourceBindings(formulaNames), sequence, statistics,
                issues);

        List<Trigger> triggers = new ArrayList<>();
        if (layout != null) {
            triggers.addAll(layout.getTriggers());
        }
        List<TargetSubreport> subreports = mapSubreports(report.getSubreports(), sequence, triggers, statistics,
                issues);
        List<TargetChart> charts = mapCharts(report.getCharts(), statistics, issues);
        List<TargetCrossTab> crossTabs = mapCrossTabs(report.getCrossTabs(), statistics, issues);
        recordUnsupportedFeatures(report.getUnsupportedFeatures(), statistics, issues);

        List<ProgramUnit> programUnits = new ArrayList<>();
        for (TranslatedExpression formula : formulas) {
            if (formula.getTargetCode() != null && !formula.getTargetCode().isEmpty()) {
                programUnits.add(ProgramUnit.builder()
                        .name(formula.getTargetName())
                        .kind(ProgramUnitKind.FORMULA_FUNCTION)
                        .code(formula.getTargetCode())
                        .build());
            }
        }
        for (Trigger trigger : triggers) {
            if (trigger.getTargetCode() == null || trigger.getTargetCode().isEmpty()) {
                continue;
            }
            programUnits.add(ProgramUnit.builder()
                    .name(trigger.getName())
                    .kind(ProgramUnitKind.FORMAT_TRIGGER)
                    .code(trigger.getTargetCode())
                    .build());
        }

        TransformedReport result = TransformedReport.builder()
                .name(report.getName())
                .sourcePath(report.getSourcePath())
                .connections(connections)
                .queries(queries)
                .parameters(parameters)
                .formulas(formulas)
                .layout(layout)
                .subreports(subreports)
                .charts(charts)
                .crossTabs(crossTabs)
                .triggers(triggers)
                .programUnits(programUnits)
                .statistics(statistics)
                .issues(issues)
                .processingTimeMs(System.currentTimeMillis() - startTime)
                .build();

        String status = result.getStatus().name().toLowerCase();
        meterRegistry.counter("report.conversion.count", "status", status).increment();
        meterRegistry.counter("report.conversion.elements", "outcome", "converted")
                .increment(statistics.getConverted());
        meterRegistry.counter("report.conversion.elements", "outcome", "warning")
                .increment(statistics.getConvertedWithWarning());
        meterRegistry.counter("report.conversion.elements", "outcome", "failed")
                .increment(statistics.getFailed());
        sample.stop(meterRegistry.timer("report.conversion.time"));

        log.info("Report '{}' transformed: status {}, {}% complete ({} converted, {} with warnings, {} failed)",
                report.getName(), result.getStatus(), statistics.getCompletionPercentage(),
                statistics.getConverted(), statistics.getConvertedWithWarning(), statistics.getFailed());
        return result;
    }

    /**
     * Page size in the target unit. Landscape reports whose declared size is
     * portrait-shaped get width and height swapped.
     */
    public double[] pageSize(ReportDefinition report) {
        double width = report.getPageWidth() != null ? report.getPageWidth()
                : layoutProperties.getDefaultPageWidthTwips();
        double height = report.getPageHeight() != null ? report.getPageHeight()
                : layoutProperties.getDefaultPageHeightTwips();
        if (report.getOrientation() == PageOrientation.LANDSCAPE && width < height) {
            double swap = width;
            width = height;
            height = swap;
        }
        return new double[] {
                UnitConverter.fromTwips(width, conversionProperties.getCoordinateUnit()),
                UnitConverter.fromTwips(height, conversionProperties.getCoordinateUnit())
        };
    }

    private List<TargetConnection> mapConnections(List<DataSource> sources, ConversionStatistics statistics,
            List<ConversionIssue> issues) {
        List<TargetConnection> connections = new ArrayList<>();
        for (DataSource source : nonNull(sources)) {
            try {
                TargetConnection connection = connectionMapper.map(source);
                connections.add(connection);
                statistics.record(outcomeOf(connection.getWarnings()));
                connection.getWarnings().forEach(
                        w -> issues.add(ConversionIssue.warning("CONNECTION", connection.getSourceName(), w)));
            } catch (IllegalArgumentException e) {
                log.warn("Data source '{}' not converted: {}", source.getName(), e.getMessage());
                statistics.record(ConversionOutcome.FAILED);
                issues.add(ConversionIssue.error("CONNECTION", source.getName(), e.getMessage()));
            }
        }
        return connections;
    }

    private List<TargetQuery> mapQueries(List<QueryDefinition> definitions, ConversionStatistics statistics,
            List<ConversionIssue> issues) {
        List<TargetQuery> queries = new ArrayList<>();
        for (QueryDefinition definition : nonNull(definitions)) {
            try {
                TargetQuery query = queryMapper.map(definition);
                queries.add(query);
                statistics.record(outcomeOf(query.getWarnings()));
                query.getWarnings().forEach(w -> issues.add(ConversionIssue.warning("QUERY", query.getName(), w)));
            } catch (IllegalArgumentException e) {
                log.warn("Query '{}' not converted: {}", definition.getName(), e.getMessage());
                statistics.record(ConversionOutcome.FAILED);
                issues.add(ConversionIssue.error("QUERY", definition.getName(), e.getMessage()));
            }
        }
        return queries;
    }

    private List<TargetParameter> mapParameters(List<ReportParameter> definitions, ConversionStatistics statistics,
            List<ConversionIssue> issues) {
        List<TargetParameter> parameters = new ArrayList<>();
        for (ReportParameter definition : nonNull(definitions)) {
            try {
                TargetParameter parameter = parameterMapper.map(definition);
                parameters.add(parameter);
                statistics.record(outcomeOf(parameter.getWarnings()));
                parameter.getWarnings().forEach(
                        w -> issues.add(ConversionIssue.warning("PARAMETER", parameter.getSourceName(), w)));
            } catch (IllegalArgumentException e) {
                log.warn("Parameter '{}' not converted: {}", definition.getName(), e.getMessage());
                statistics.record(ConversionOutcome.FAILED);
                issues.add(ConversionIssue.error("PARAMETER", definition.getName(), e.getMessage()));
            }
        }
        return parameters;
    }

    private List<TranslatedExpression> translateFormulas(List<Formula> formulas, ConversionStatistics statistics,
            List<ConversionIssue> issues) {
        List<TranslatedExpression> results = expressionTranslator.translateAll(nonNull(formulas));
        for (TranslatedExpression translated : results) {
            statistics.record(translated.getOutcome());
            String joined = String.join("; ", translated.getWarnings());
            if (translated.isPlaceholder()) {
                issues.add(ConversionIssue.placeholder("FORMULA", translated.getSourceName(), joined));
            } else if (!translated.isSuccess()) {
                issues.add(ConversionIssue.error("FORMULA", translated.getSourceName(), joined));
            } else {
                translated.getWarnings().forEach(
                        w -> issues.add(ConversionIssue.warning("FORMULA", translated.getSourceName(), w)));
            }
        }
        return results;
    }

    private LayoutResult synthesizeLayout(ReportDefinition report, SourceBindings bindings,
            TriggerNameSequence sequence, ConversionStatistics statistics, List<ConversionIssue> issues) {
        List<Section> sections = nonNull(report.getSections());
        List<Group> groups = nonNull(report.getGroups());
        double[] page = pageSize(report);
        LayoutResult layout;
        try {
            layout = layoutSynthesizer.synthesize(sections, groups, page[0], page[1], triggerTranslator,
                    sequence, bindings);
        } catch (RuntimeException e) {
            log.error("Layout synthesis failed for report '{}'", report.getName(), e);
            for (int i = 0; i < sections.size() + groups.size(); i++) {
                statistics.record(ConversionOutcome.FAILED);
            }
            issues.add(ConversionIssue.error("LAYOUT", report.getName(), "Layout synthesis failed: " + e.getMessage()));
            return null;
        }

        for (Trigger trigger : layout.getTriggers()) {
            statistics.record(trigger.getOutcome());
            if (trigger.isPlaceholder()) {
                issues.add(ConversionIssue.placeholder("TRIGGER", trigger.getName(),
                        String.join("; ", trigger.getWarnings())));
            }
        }
        for (String owner : layout.getFailedTriggers()) {
            statistics.record(ConversionOutcome.FAILED);
            issues.add(ConversionIssue.error("TRIGGER", owner, "Trigger not generated"));
        }
        layout.getWarnings().forEach(w -> issues.add(ConversionIssue.warning("LAYOUT", report.getName(), w)));

        recordSections(sections, layout, statistics, issues);
        recordGroups(groups, layout, statistics, issues);
        return layout;
    }

    /**
     * Subreport suppress triggers share the layout's name sequence and are
     * counted as elements of their own, like layout triggers.
     */
    private List<TargetSubreport> mapSubreports(List<SubreportReference> references, TriggerNameSequence sequence,
            List<Trigger> triggers, ConversionStatistics statistics, List<ConversionIssue> issues) {
        List<TargetSubreport> subreports = new ArrayList<>();
        for (SubreportReference reference : nonNull(references)) {
            SubreportMapper.Mapped mapped;
            try {
                mapped = subreportMapper.map(reference, sequence);
            } catch (IllegalArgumentException e) {
                log.warn("Subreport '{}' not converted: {}", reference.getName(), e.getMessage());
                statistics.record(ConversionOutcome.FAILED);
                issues.add(ConversionIssue.error("SUBREPORT", reference.getName(), e.getMessage()));
                continue;
            }
            TargetSubreport subreport = mapped.getSubreport();
            subreports.add(subreport);
            statistics.record(outcomeOf(subreport.getWarnings()));
            subreport.getWarnings().forEach(
                    w -> issues.add(ConversionIssue.warning("SUBREPORT", subreport.getSourceName(), w)));
            if (!subreport.getParameterLinks().isEmpty()) {
                issues.add(ConversionIssue.information("SUBREPORT", subreport.getSourceName(),
                        subreport.getParameterLinks().size()
                                + " parameter link(s); verify the parent-child relationship"));
            }

            Trigger trigger = mapped.getTrigger();
            if (trigger != null) {
                triggers.add(trigger);
                statistics.record(trigger.getOutcome());
                if (trigger.isPlaceholder()) {
                    issues.add(ConversionIssue.placeholder("TRIGGER", trigger.getName(),
                            String.join("; ", trigger.getWarnings())));
                }
            } else if (mapped.isTriggerFailed()) {
                statistics.record(ConversionOutcome.FAILED);
                issues.add(ConversionIssue.error("TRIGGER", subreport.getName(), "Trigger not generated"));
            }
        }
        return subreports;
    }

    private List<TargetChart> mapCharts(List<Chart> definitions, ConversionStatistics statistics,
            List<ConversionIssue> issues) {
        List<TargetChart> charts = new ArrayList<>();
        for (Chart definition : nonNull(definitions)) {
            try {
                TargetChart chart = chartMapper.map(definition);
                charts.add(chart);
                statistics.record(outcomeOf(chart.getWarnings()));
                chart.getWarnings().forEach(
                        w -> issues.add(ConversionIssue.warning("CHART", chart.getSourceName(), w)));
                issues.add(ConversionIssue.information("CHART", chart.getSourceName(),
                        "Mapped to graph type " + chart.getGraphType() + "; implement with a graph object"));
            } catch (IllegalArgumentException e) {
                log.warn("Chart '{}' not converted: {}", definition.getName(), e.getMessage());
                statistics.record(ConversionOutcome.FAILED);
                issues.add(ConversionIssue.error("CHART", definition.getName(), e.getMessage()));
            }
        }
        return charts;
    }

    private List<TargetCrossTab> mapCrossTabs(List<CrossTab> definitions, ConversionStatistics statistics,
            List<ConversionIssue> issues) {
        List<TargetCrossTab> crossTabs = new ArrayList<>();
        for (CrossTab definition : nonNull(definitions)) {
            try {
                TargetCrossTab crossTab = crossTabMapper.map(definition);
                crossTabs.add(crossTab);
                statistics.record(outcomeOf(crossTab.getWarnings()));
                crossTab.getWarnings().forEach(
                        w -> issues.add(ConversionIssue.warning("CROSSTAB", crossTab.getSourceName(), w)));
            } catch (IllegalArgumentException e) {
                log.warn("Cross-tab '{}' not converted: {}", definition.getName(), e.getMessage());
                statistics.record(ConversionOutcome.FAILED);
                issues.add(ConversionIssue.error("CROSSTAB", definition.getName(), e.getMessage()));
            }
        }
        return crossTabs;
    }

    /**
     * Each distinct unsupported feature counts as one failed element.
     */
    private void recordUnsupportedFeatures(List<String> features, ConversionStatistics statistics,
            List<ConversionIssue> issues) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String feature : nonNull(features)) {
            if (feature != null && !feature.isBlank()) {
                distinct.add(feature.trim());
            }
        }
        for (String feature : distinct) {
            log.warn("Unsupported feature not converted: {}", feature);
            statistics.record(ConversionOutcome.FAILED);
            issues.add(ConversionIssue.error("FEATURE", feature, "Unsupported feature: " + feature));
        }
    }

    /**
     * A section with its own frame is converted; an extra detail section
     * merged into the detail frame converted with a warning; a group band
     * with no matching group is counted as failed.
     */
    private void recordSections(List<Section> sections, LayoutResult layout, ConversionStatistics statistics,
            List<ConversionIssue> issues) {
        Map<String, Integer> placed = new LinkedHashMap<>();
        for (Frame frame : layout.getMarginFrame().collect(f -> f.getSourceSection() != null)) {
            placed.merge(frame.getSourceSection(), 1, Integer::sum);
        }
        for (Section section : sections) {
            Integer remaining = section.getName() == null ? null : placed.get(section.getName());
            if (remaining != null && remaining > 0) {
                placed.put(section.getName(), remaining - 1);
                statistics.record(ConversionOutcome.CONVERTED);
            } else if (section.resolveRole() == SectionRole.DETAIL) {
                statistics.record(ConversionOutcome.CONVERTED_WITH_WARNING);
            } else {
                statistics.record(ConversionOutcome.FAILED);
                issues.add(ConversionIssue.error("SECTION", section.getName(),
                        "Section has no matching group and was left out of the layout"));
            }
        }
    }

    private void recordGroups(List<Group> groups, LayoutResult layout, ConversionStatistics statistics,
            List<ConversionIssue> issues) {
        Set<String> bound = new HashSet<>();
        for (Frame frame : layout.getMarginFrame().collect(f -> f.getKind() == FrameKind.REPEATING)) {
            bound.add(frame.getSourceGroup());
        }
        for (Group group : groups) {
            if (bound.contains(group.getName())) {
                statistics.record(ConversionOutcome.CONVERTED);
            } else {
                statistics.record(ConversionOutcome.FAILED);
                issues.add(ConversionIssue.error("GROUP", group.getName(), "No repeating frame generated"));
            }
        }
    }

    private static ConversionOutcome outcomeOf(List<String> warnings) {
        return warnings.isEmpty() ? ConversionOutcome.CONVERTED : ConversionOutcome.CONVERTED_WITH_WARNING;
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list == null ? List.of() : list;
    }

    private static int size(List<?> list) {
        return list == null ? 0 : list.size();
    }
}
