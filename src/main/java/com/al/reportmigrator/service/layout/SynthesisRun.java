package com.al.reportmigrator.service.layout;

import com.al.reportmigrator.exception.UnsupportedExpressionException;
import com.al.reportmigrator.model.target.Trigger;
import com.al.reportmigrator.service.expression.FormatTriggerTranslator;
import com.al.reportmigrator.service.expression.TriggerNameSequence;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Mutable state of one synthesis call. Never shared between calls.
 */
@Getter
class SynthesisRun {

    private final FormatTriggerTranslator triggerTranslator;
    private final TriggerNameSequence sequence;
    private final SourceBindings bindings;
    private final NameRegistry frameNames = new NameRegistry();
    private final NameRegistry fieldNames = new NameRegistry();
    private final List<Trigger> triggers = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<String> failedTriggers = new ArrayList<>();

    SynthesisRun(FormatTriggerTranslator triggerTranslator, TriggerNameSequence sequence, SourceBindings bindings) {
        this.triggerTranslator = triggerTranslator;
        this.sequence = sequence;
        this.bindings = bindings == null ? SourceBindings.empty() : bindings;
    }

    void warn(String message) {
        warnings.add(message);
    }

    /**
     * Run a trigger build. A trigger that was skipped or refused under the
     * fail-hard policy is recorded as failed and neither kept nor attached;
     * the rest of the layout carries on without it.
     */
    Optional<Trigger> attempt(String owner, Supplier<Optional<Trigger>> build) {
        try {
            Optional<Trigger> trigger = build.get();
            if (trigger.isPresent() && !trigger.get().isSuccess()) {
                warn("Trigger for " + owner + " not generated: " + String.join("; ", trigger.get().getWarnings()));
                failedTriggers.add(owner);
                return Optional.empty();
            }
            trigger.ifPresent(triggers::add);
            return trigger;
        } catch (UnsupportedExpressionException e) {
            warn("Trigger for " + owner + " not generated: " + e.getMessage());
            failedTriggers.add(owner);
            return Optional.empty();
        }
    }
}
