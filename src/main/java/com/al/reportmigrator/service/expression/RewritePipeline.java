package com.al.reportmigrator.service.expression;

import com.al.reportmigrator.config.ConversionProperties;
import com.al.reportmigrator.service.expression.pass.CleanupPass;
import com.al.reportmigrator.service.expression.pass.ConditionalFlatteningPass;
import com.al.reportmigrator.service.expression.pass.EvaluationDirectivePass;
import com.al.reportmigrator.service.expression.pass.FieldReferencePass;
import com.al.reportmigrator.service.expression.pass.FormulaReferencePass;
import com.al.reportmigrator.service.expression.pass.FunctionCallPass;
import com.al.reportmigrator.service.expression.pass.OperatorPass;
import com.al.reportmigrator.service.expression.pass.ParameterReferencePass;
import com.al.reportmigrator.service.expression.pass.RewritePass;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Ordered list of rewrite passes. The order matters: references are bound
 * before operators so braces never reach the operator rules, and functions
 * are rewritten before conditionals so IIF arguments are already target text.
 */
@Slf4j
public class RewritePipeline {

    private final List<RewritePass> passes;

    public RewritePipeline(List<RewritePass> passes) {
        this.passes = List.copyOf(passes);
    }

    public static RewritePipeline standard(ConversionProperties properties) {
        return new RewritePipeline(List.of(
                new EvaluationDirectivePass(),
                new FieldReferencePass(),
                new FormulaReferencePass(properties.getFormulaPrefix()),
                new ParameterReferencePass(properties.getParameterPrefix()),
                new OperatorPass(),
                new FunctionCallPass(properties.getFormulaPrefix()),
                new ConditionalFlatteningPass(properties.getMaxConditionalDepth()),
                new CleanupPass()));
    }

    public RewriteState run(String source) {
        RewriteState state = RewriteState.of(source);
        for (RewritePass pass : passes) {
            state = pass.apply(state);
            log.trace("After {}: {}", pass.name(), state.getText());
        }
        return state;
    }

    public List<RewritePass> passes() {
        return passes;
    }
}
