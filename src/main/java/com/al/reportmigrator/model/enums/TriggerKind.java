package com.al.reportmigrator.model.enums;

public enum TriggerKind {
    SUPPRESS,
    CONDITIONAL_FORMAT
}
