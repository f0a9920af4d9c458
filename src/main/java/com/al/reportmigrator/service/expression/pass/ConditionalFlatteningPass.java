package com.al.reportmigrator.service.expression.pass;

import com.al.reportmigrator.service.expression.RewriteState;
import com.al.reportmigrator.service.expression.SourceScanner;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * IIF(c, t, e) becomes CASE WHEN c THEN t ELSE e END. The rightmost call is
 * rewritten first, so nested calls are already CASE expressions when their
 * parent is reached; a CASE sitting alone in the else branch is merged into
 * the parent as an extra WHEN.
 */
public class ConditionalFlatteningPass implements RewritePass {

    private static final Pattern IIF = Pattern.compile("\\bIIF\\s*\\(", Pattern.CASE_INSENSITIVE);
    private static final Pattern CASE_OR_END = Pattern.compile("\\b(CASE|END)\\b", Pattern.CASE_INSENSITIVE);

    private final int maxIterations;

    public ConditionalFlatteningPass(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    @Override
    public String name() {
        return "conditional-flattening";
    }

    @Override
    public RewriteState apply(RewriteState state) {
        RewriteState.RewriteStateBuilder builder = state.toBuilder();
        String text = state.getText();
        int limit = text.length();
        int iterations = 0;
        while (iterations < maxIterations) {
            int start = lastCall(text, limit);
            if (start < 0) {
                break;
            }
            iterations++;
            int open = text.indexOf('(', start);
            int close = SourceScanner.findMatchingParen(text, open);
            if (close < 0) {
                break;
            }
            List<String> args = SourceScanner.splitTopLevel(text.substring(open + 1, close));
            if (args.size() != 3) {
                builder.warning("IIF expects 3 arguments, got " + args.size() + "; left unchanged");
                limit = start;
                continue;
            }
            String replacement = toCase(args.get(0), args.get(1), args.get(2));
            text = text.substring(0, start) + replacement + text.substring(close + 1);
            limit = start;
        }
        if (lastCall(text, limit) >= 0) {
            builder.warning("Conditional nesting deeper than " + maxIterations + " levels; remaining IIF calls left unchanged");
        }
        return builder.text(text).build();
    }

    private static int lastCall(String text, int limit) {
        boolean[] code = SourceScanner.codeMask(text);
        Matcher matcher = IIF.matcher(text);
        int last = -1;
        while (matcher.find() && matcher.start() < limit) {
            if (code[matcher.start()]) {
                last = matcher.start();
            }
        }
        return last;
    }

    private static String toCase(String condition, String whenTrue, String whenFalse) {
        String head = "CASE WHEN " + condition + " THEN " + whenTrue + " ";
        if (isSingleCase(whenFalse)) {
            return head + whenFalse.trim().substring(4).trim();
        }
        return head + "ELSE " + whenFalse + " END";
    }

    /**
     * True when the text is exactly one CASE ... END expression.
     */
    static boolean isSingleCase(String text) {
        String trimmed = text.trim();
        if (!trimmed.toUpperCase(Locale.ROOT).startsWith("CASE ")) {
            return false;
        }
        boolean[] code = SourceScanner.codeMask(trimmed);
        Matcher matcher = CASE_OR_END.matcher(trimmed);
        int depth = 0;
        while (matcher.find()) {
            if (!code[matcher.start()]) {
                continue;
            }
            depth += matcher.group(1).equalsIgnoreCase("CASE") ? 1 : -1;
            if (depth == 0) {
                return matcher.end() == trimmed.length();
            }
        }
        return false;
    }
}
