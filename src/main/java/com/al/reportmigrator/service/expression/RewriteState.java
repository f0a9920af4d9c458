package com.al.reportmigrator.service.expression;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Immutable intermediate value threaded through the rewrite passes. Each pass
 * returns a new state carrying the rewritten text plus everything it learned.
 */
@Value
@Builder(toBuilder = true)
public class RewriteState {

    /**
     * The untouched input text.
     */
    String source;

    String text;

    @Singular
    List<String> warnings;

    /**
     * Constructs that need manual follow-up: unknown or unmappable functions,
     * arity mismatches, unrecognised intervals.
     */
    @Singular
    List<String> issues;

    @Singular
    Set<String> referencedColumns;

    @Singular
    Set<String> referencedFormulas;

    @Singular
    Set<String> referencedParameters;

    public static RewriteState of(String source) {
        return RewriteState.builder().source(source).text(source).build();
    }

    public RewriteState withText(String newText) {
        return toBuilder().text(newText).build();
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}
