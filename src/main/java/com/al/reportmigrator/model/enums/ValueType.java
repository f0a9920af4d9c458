package com.al.reportmigrator.model.enums;

import java.util.Locale;

/**
 * Closed set of value types a source report can declare for columns,
 * formulas and parameters.
 */
public enum ValueType {
    STRING,
    NUMBER,
    CURRENCY,
    DATE,
    TIME,
    DATETIME,
    BOOLEAN,
    MEMO,
    BLOB,
    UNKNOWN;

    /**
     * Parse a type tag as written by report exporters, e.g. "string",
     * "xsd:decimal", "Int32s", "DateTimeField". Unrecognised tags map to
     * {@link #UNKNOWN}.
     */
    public static ValueType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return UNKNOWN;
        }
        String t = tag.trim().toLowerCase(Locale.ROOT);
        int colon = t.indexOf(':');
        if (colon >= 0) {
            t = t.substring(colon + 1);
        }
        t = t.replaceAll("[^a-z0-9]", "");
        if (t.endsWith("field") && t.length() > "field".length()) {
            t = t.substring(0, t.length() - "field".length());
        }

        switch (t) {
            case "string":
            case "text":
            case "char":
            case "varchar":
                return STRING;
            case "number":
            case "numeric":
            case "decimal":
            case "double":
            case "float":
            case "int":
            case "integer":
            case "long":
            case "int8s":
            case "int8u":
            case "int16s":
            case "int16u":
            case "int32s":
            case "int32u":
                return NUMBER;
            case "currency":
            case "money":
                return CURRENCY;
            case "date":
                return DATE;
            case "time":
                return TIME;
            case "datetime":
            case "timestamp":
                return DATETIME;
            case "boolean":
            case "bool":
                return BOOLEAN;
            case "memo":
            case "clob":
            case "persistentmemo":
                return MEMO;
            case "blob":
            case "binary":
            case "bitmap":
                return BLOB;
            default:
                return UNKNOWN;
        }
    }
}
