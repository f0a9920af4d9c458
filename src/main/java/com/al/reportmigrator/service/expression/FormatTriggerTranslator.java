package com.al.reportmigrator.service.expression;

import com.al.reportmigrator.config.ConversionProperties;
import com.al.reportmigrator.model.enums.TriggerKind;
import com.al.reportmigrator.model.target.TranslatedExpression;
import com.al.reportmigrator.model.target.Trigger;
import com.al.reportmigrator.util.TargetNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Builds format triggers from suppress conditions, suppress flags and
 * conditional-format rules. Every trigger returns TRUE when its rule fires,
 * i.e. when the owner should be suppressed or the format applied.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FormatTriggerTranslator {

    private final ExpressionTranslator expressionTranslator;
    private final ConversionProperties properties;

    public Trigger suppressTrigger(String condition, String owner, TriggerNameSequence sequence) {
        String name = triggerName("SUPPRESS_COND", owner, sequence);
        TranslatedExpression translated = expressionTranslator.translateCondition(owner, name, condition,
                List.of("Suppress when: " + oneLine(condition)));
        return toTrigger(translated, TriggerKind.SUPPRESS, condition, owner);
    }

    /**
     * Trigger for the suppress-if-zero and suppress-if-blank flags, or empty
     * when neither flag is set.
     */
    public Optional<Trigger> suppressFlagsTrigger(String boundName, boolean suppressIfZero,
                                                  boolean suppressIfBlank, String owner,
                                                  TriggerNameSequence sequence) {
        if (!suppressIfZero && !suppressIfBlank) {
            return Optional.empty();
        }
        String reference = "{" + boundName + "}";
        String zeroCheck = reference + " = 0";
        String blankCheck = "(IsNull(" + reference + ") or IsNull(Trim(ToText(" + reference + "))))";
        String condition;
        if (suppressIfZero && suppressIfBlank) {
            condition = zeroCheck + " or " + blankCheck;
        } else {
            condition = suppressIfZero ? zeroCheck : blankCheck;
        }
        String name = triggerName("SUPPRESS", owner, sequence);
        TranslatedExpression translated = expressionTranslator.translateCondition(owner, name, condition,
                List.of("Suppress flags:" + (suppressIfZero ? " zero" : "") + (suppressIfBlank ? " blank" : "")));
        return Optional.of(toTrigger(translated, TriggerKind.SUPPRESS, condition, owner));
    }

    /**
     * Trigger for a conditional-format rule. The target applies formatting
     * from inside the trigger body, so the generated function only decides
     * whether the rule applies; the formatting itself is documented in a
     * header comment and flagged for review.
     */
    public Trigger conditionalFormatTrigger(String condition, String property, String value, String owner,
                                            TriggerNameSequence sequence) {
        String name = triggerName("FORMAT", owner, sequence);
        String applies = property + (value == null ? "" : " = " + value);
        TranslatedExpression translated = expressionTranslator.translateCondition(owner, name, condition,
                List.of("Apply " + applies + " when: " + oneLine(condition)));
        Trigger trigger = toTrigger(translated, TriggerKind.CONDITIONAL_FORMAT, condition, owner);
        return Trigger.builder()
                .name(trigger.getName())
                .targetCode(trigger.getTargetCode())
                .kind(trigger.getKind())
                .originalCondition(trigger.getOriginalCondition())
                .owner(trigger.getOwner())
                .success(trigger.isSuccess())
                .placeholder(trigger.isPlaceholder())
                .outcome(trigger.getOutcome())
                .warnings(trigger.getWarnings())
                .warning("Conditional format '" + applies + "' must be applied manually in the trigger body")
                .build();
    }

    private String triggerName(String kind, String owner, TriggerNameSequence sequence) {
        String prefix = properties.getTriggerPrefix().toUpperCase(Locale.ROOT);
        int n = sequence.next();
        if (owner == null || owner.isBlank()) {
            return prefix + kind + "_" + n;
        }
        return prefix + kind + "_" + TargetNames.sanitize(owner).toUpperCase(Locale.ROOT) + "_" + n;
    }

    private static Trigger toTrigger(TranslatedExpression translated, TriggerKind kind, String condition,
                                     String owner) {
        log.debug("Generated trigger {} for {}", translated.getTargetName(), owner);
        return Trigger.builder()
                .name(translated.getTargetName())
                .targetCode(translated.getTargetCode())
                .kind(kind)
                .originalCondition(condition)
                .owner(owner)
                .success(translated.isSuccess())
                .placeholder(translated.isPlaceholder())
                .outcome(translated.getOutcome())
                .warnings(translated.getWarnings())
                .build();
    }

    private static String oneLine(String text) {
        return text == null ? "" : text.replaceAll("\\s+", " ").trim();
    }
}
