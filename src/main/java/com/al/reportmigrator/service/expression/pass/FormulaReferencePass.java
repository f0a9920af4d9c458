package com.al.reportmigrator.service.expression.pass;

import com.al.reportmigrator.service.expression.RewriteState;
import com.al.reportmigrator.service.expression.SourceScanner;
import com.al.reportmigrator.util.TargetNames;

import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * {@Name} and @Name become zero-argument calls of the formula's generated
 * function, e.g. CF_ORDER_TOTAL().
 */
public class FormulaReferencePass implements RewritePass {

    private static final Pattern BRACED = Pattern.compile("\\{@([^}]+)\\}");
    private static final Pattern BARE = Pattern.compile("@(\\w+)");

    private final String prefix;

    public FormulaReferencePass(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public String name() {
        return "formula-references";
    }

    @Override
    public RewriteState apply(RewriteState state) {
        RewriteState.RewriteStateBuilder builder = state.toBuilder();
        String text = SourceScanner.replaceInCode(state.getText(), BRACED, match -> call(match, builder));
        text = SourceScanner.replaceInCode(text, BARE, match -> call(match, builder));
        return builder.text(text).build();
    }

    private String call(MatchResult match, RewriteState.RewriteStateBuilder builder) {
        String target = TargetNames.formulaName(prefix, match.group(1).trim());
        builder.referencedFormula(target);
        return target + "()";
    }
}
