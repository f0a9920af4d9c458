package com.al.reportmigrator.model.enums;

/**
 * Outcome of converting one report element. Every element lands in exactly one
 * of these buckets.
 */
public enum ConversionOutcome {
    CONVERTED,
    CONVERTED_WITH_WARNING,
    FAILED
}
