package com.al.reportmigrator.model;

import com.al.reportmigrator.model.enums.PageOrientation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed source report: the object graph handed over by the extraction step.
 * Page dimensions are in twips.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportDefinition {

    private String name;

    /**
     * Original file the definition was extracted from, informational only.
     */
    private String sourcePath;

    /**
     * Page width in twips; null means US Letter.
     */
    private Double pageWidth;

    /**
     * Page height in twips; null means US Letter.
     */
    private Double pageHeight;

    @Builder.Default
    private PageOrientation orientation = PageOrientation.PORTRAIT;

    @Builder.Default
    private List<DataSource> dataSources = new ArrayList<>();

    @Builder.Default
    private List<QueryDefinition> queries = new ArrayList<>();

    @Builder.Default
    private List<ReportParameter> parameters = new ArrayList<>();

    @Builder.Default
    private List<Formula> formulas = new ArrayList<>();

    @Builder.Default
    private List<Section> sections = new ArrayList<>();

    /**
     * Grouping rules, outermost first.
     */
    @Builder.Default
    private List<Group> groups = new ArrayList<>();

    @Builder.Default
    private List<SubreportReference> subreports = new ArrayList<>();

    @Builder.Default
    private List<Chart> charts = new ArrayList<>();

    @Builder.Default
    private List<CrossTab> crossTabs = new ArrayList<>();

    /**
     * Source features the extraction step recognised but could not model,
     * e.g. "OLE object" or "hyperlink".
     */
    @Builder.Default
    private List<String> unsupportedFeatures = new ArrayList<>();
}
