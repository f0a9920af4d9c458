package com.al.reportmigrator.model.enums;

public enum ConversionStatus {
    SUCCESS,
    PARTIAL,
    FAILED
}
