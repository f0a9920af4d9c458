package com.al.reportmigrator.model.target;

import com.al.reportmigrator.model.enums.ConversionOutcome;
import com.al.reportmigrator.model.enums.TriggerKind;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Generated boolean function implementing a suppress or conditional-format
 * rule. The function returns TRUE when the rule fires.
 */
@Value
@Builder
public class Trigger {

    String name;

    String targetCode;

    TriggerKind kind;

    String originalCondition;

    /**
     * Element the trigger was generated for (field or section name).
     */
    String owner;

    /**
     * False when the condition could not be translated and no function body
     * was produced.
     */
    boolean success;

    boolean placeholder;

    ConversionOutcome outcome;

    @Singular
    List<String> warnings;
}
