package com.al.reportmigrator.model.enums;

/**
 * What a layout field displays.
 */
public enum SourceKind {
    COLUMN,
    FORMULA,
    PARAMETER,
    SPECIAL,
    LITERAL
}
