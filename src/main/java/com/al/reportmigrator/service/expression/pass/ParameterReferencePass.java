package com.al.reportmigrator.service.expression.pass;

import com.al.reportmigrator.service.expression.RewriteState;
import com.al.reportmigrator.service.expression.SourceScanner;
import com.al.reportmigrator.util.TargetNames;

import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * {?Name} and ?Name become parameter bind variables, e.g. :P_START_DATE.
 */
public class ParameterReferencePass implements RewritePass {

    private static final Pattern BRACED = Pattern.compile("\\{\\?([^}]+)\\}");
    private static final Pattern BARE = Pattern.compile("\\?(\\w+)");

    private final String prefix;

    public ParameterReferencePass(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public String name() {
        return "parameter-references";
    }

    @Override
    public RewriteState apply(RewriteState state) {
        RewriteState.RewriteStateBuilder builder = state.toBuilder();
        String text = SourceScanner.replaceInCode(state.getText(), BRACED, match -> bind(match, builder));
        text = SourceScanner.replaceInCode(text, BARE, match -> bind(match, builder));
        return builder.text(text).build();
    }

    private String bind(MatchResult match, RewriteState.RewriteStateBuilder builder) {
        String target = TargetNames.parameterName(prefix, match.group(1).trim());
        builder.referencedParameter(target);
        return ":" + target;
    }
}
