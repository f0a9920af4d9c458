package com.al.reportmigrator.model.enums;

/**
 * Source chart styles with the graph type each one becomes.
 */
public enum ChartType {
    BAR("BAR_VERT_CLUST"),
    LINE("LINE"),
    PIE("PIE"),
    AREA("AREA_VERT_ABS"),
    SCATTER("SCATTER"),
    DOUGHNUT("PIE_RING"),
    BUBBLE("BUBBLE"),
    STOCK("STOCK_CANDLE"),
    GAUGE("GAUGE"),
    FUNNEL("FUNNEL"),
    RADAR("RADAR"),
    UNKNOWN("BAR_VERT_CLUST");

    private final String graphType;

    ChartType(String graphType) {
        this.graphType = graphType;
    }

    public String getGraphType() {
        return graphType;
    }
}
