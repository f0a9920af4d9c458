package com.al.reportmigrator.service.expression.pass;

import com.al.reportmigrator.service.expression.RewriteState;
import com.al.reportmigrator.service.expression.SourceScanner;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Removes evaluation-time directives. They only steer when the source engine
 * evaluates a formula and have no counterpart in a target expression.
 */
public class EvaluationDirectivePass implements RewritePass {

    private static final Map<String, Pattern> DIRECTIVES = new LinkedHashMap<>();

    static {
        DIRECTIVES.put("WhilePrintingRecords", directive("WhilePrintingRecords"));
        DIRECTIVES.put("WhileReadingRecords", directive("WhileReadingRecords"));
        DIRECTIVES.put("BeforeReadingRecords", directive("BeforeReadingRecords"));
        DIRECTIVES.put("EvaluateAfter",
                Pattern.compile("\\bEvaluateAfter\\b\\s*(\\([^)]*\\))?\\s*;?\\s*", Pattern.CASE_INSENSITIVE));
    }

    private static Pattern directive(String word) {
        return Pattern.compile("\\b" + word + "\\b\\s*;?\\s*", Pattern.CASE_INSENSITIVE);
    }

    @Override
    public String name() {
        return "evaluation-directives";
    }

    @Override
    public RewriteState apply(RewriteState state) {
        RewriteState.RewriteStateBuilder builder = state.toBuilder();
        String text = state.getText();
        for (Map.Entry<String, Pattern> entry : DIRECTIVES.entrySet()) {
            String rewritten = SourceScanner.replaceInCode(text, entry.getValue(), match -> "");
            if (!rewritten.equals(text)) {
                builder.warning("Directive '" + entry.getKey()
                        + "' removed; evaluation timing is handled by the target report engine");
                text = rewritten;
            }
        }
        return builder.text(text).build();
    }
}
