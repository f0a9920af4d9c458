package com.al.reportmigrator.model.target;

import com.al.reportmigrator.model.enums.ConversionOutcome;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of translating one formula or condition.
 */
@Value
@Builder
public class TranslatedExpression {

    String sourceName;

    String targetName;

    /**
     * Complete function declaration; empty when the translation was skipped.
     */
    String targetCode;

    /**
     * The rewritten expression alone, without the function wrapper.
     */
    String targetExpression;

    String targetReturnType;

    boolean success;

    /**
     * A stub function was emitted in place of a real translation.
     */
    boolean placeholder;

    ConversionOutcome outcome;

    @Singular
    List<String> warnings;

    @Singular
    List<String> referencedColumns;

    @Singular
    List<String> referencedFormulas;

    @Singular
    List<String> referencedParameters;
}
