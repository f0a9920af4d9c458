package com.al.reportmigrator.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A problem found while converting one element of a report.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversionIssue {

    /**
     * Kind of element: CONNECTION, QUERY, PARAMETER, FORMULA, TRIGGER, LAYOUT,
     * SECTION, GROUP, SUBREPORT, CHART, CROSSTAB, FEATURE
     */
    private String elementType;

    /**
     * Source name of the element (formula name, field name, ...)
     */
    private String element;

    /**
     * Error code for programmatic handling
     */
    private String code;

    /**
     * Human-readable message
     */
    private String message;

    private Severity severity;

    public enum Severity {
        ERROR,
        WARNING,
        INFORMATION
    }

    public static ConversionIssue error(String elementType, String element, String message) {
        return ConversionIssue.builder()
                .elementType(elementType)
                .element(element)
                .message(message)
                .severity(Severity.ERROR)
                .code("CONVERSION_FAILED")
                .build();
    }

    public static ConversionIssue placeholder(String elementType, String element, String message) {
        return ConversionIssue.builder()
                .elementType(elementType)
                .element(element)
                .message(message)
                .severity(Severity.WARNING)
                .code("MANUAL_CONVERSION_REQUIRED")
                .build();
    }

    public static ConversionIssue warning(String elementType, String element, String message) {
        return ConversionIssue.builder()
                .elementType(elementType)
                .element(element)
                .message(message)
                .severity(Severity.WARNING)
                .code("WARNING")
                .build();
    }

    public static ConversionIssue information(String elementType, String element, String message) {
        return ConversionIssue.builder()
                .elementType(elementType)
                .element(element)
                .message(message)
                .severity(Severity.INFORMATION)
                .code("NOTE")
                .build();
    }
}
