package com.al.reportmigrator.model.enums;

public enum SortDirection {
    ASCENDING,
    DESCENDING
}
