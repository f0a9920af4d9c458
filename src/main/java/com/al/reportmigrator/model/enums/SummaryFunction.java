package com.al.reportmigrator.model.enums;

/**
 * Aggregation applied to a cross-tab cell.
 */
public enum SummaryFunction {
    SUM("SUM"),
    COUNT("COUNT"),
    AVG("AVG"),
    MIN("MIN"),
    MAX("MAX"),
    COUNT_DISTINCT("COUNT(DISTINCT)");

    private final String sqlName;

    SummaryFunction(String sqlName) {
        this.sqlName = sqlName;
    }

    public String getSqlName() {
        return sqlName;
    }
}
