package com.al.reportmigrator.exception;

import lombok.Getter;

/**
 * Thrown when an expression cannot be translated and the configured policy
 * asks for a hard failure.
 */
@Getter
public class UnsupportedExpressionException extends RuntimeException {

    private final String sourceName;

    public UnsupportedExpressionException(String sourceName, String message) {
        super(String.format("Cannot translate '%s': %s", sourceName, message));
        this.sourceName = sourceName;
    }

    public UnsupportedExpressionException(String sourceName, String message, Throwable cause) {
        super(String.format("Cannot translate '%s': %s", sourceName, message), cause);
        this.sourceName = sourceName;
    }
}
