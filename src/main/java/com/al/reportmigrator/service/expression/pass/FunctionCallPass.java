package com.al.reportmigrator.service.expression.pass;

import com.al.reportmigrator.service.expression.RewriteState;
import com.al.reportmigrator.service.expression.SourceScanner;
import com.al.reportmigrator.service.expression.function.DateInterval;
import com.al.reportmigrator.service.expression.function.KeywordFunction;
import com.al.reportmigrator.service.expression.function.ReportFunction;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Rewrites function calls through the {@link ReportFunction} catalogue.
 * Arguments are rewritten first, innermost call outward, so nested calls and
 * parentheses inside literals are handled without a grammar. Bare keyword
 * functions are substituted through {@link KeywordFunction}.
 */
public class FunctionCallPass implements RewritePass {

    private static final Set<String> SQL_WORDS = Set.of(
            "AND", "OR", "NOT", "IN", "IS", "THEN", "ELSE", "WHEN", "CASE", "END",
            "LIKE", "BETWEEN", "EXISTS", "OVER", "DISTINCT", "NULL");

    private final String formulaPrefix;

    public FunctionCallPass(String formulaPrefix) {
        this.formulaPrefix = formulaPrefix == null ? "" : formulaPrefix.toUpperCase(Locale.ROOT);
    }

    @Override
    public String name() {
        return "function-calls";
    }

    @Override
    public RewriteState apply(RewriteState state) {
        RewriteState.RewriteStateBuilder builder = state.toBuilder();
        String text = rewrite(state.getText(), builder);
        return builder.text(text).build();
    }

    private String rewrite(String text, RewriteState.RewriteStateBuilder builder) {
        boolean[] code = SourceScanner.codeMask(text);
        int n = text.length();
        StringBuilder out = new StringBuilder(n);
        int i = 0;
        while (i < n) {
            char c = text.charAt(i);
            if (!code[i] || !isIdentifierStart(c) || (i > 0 && continuesToken(text.charAt(i - 1)))) {
                out.append(c);
                i++;
                continue;
            }
            int end = i;
            while (end < n && code[end] && isIdentifierPart(text.charAt(end))) {
                end++;
            }
            String identifier = text.substring(i, end);
            int open = end;
            while (open < n && code[open] && Character.isWhitespace(text.charAt(open))) {
                open++;
            }
            boolean call = open < n && code[open] && text.charAt(open) == '('
                    && !SQL_WORDS.contains(identifier.toUpperCase(Locale.ROOT))
                    && !isInfixOperator(identifier, out);
            if (!call) {
                out.append(bareIdentifier(identifier, builder));
                i = end;
                continue;
            }
            int close = SourceScanner.findMatchingParen(text, open);
            if (close < 0) {
                // structural check upstream rejects this; copy the rest unchanged
                out.append(text, i, n);
                break;
            }
            String args = rewrite(text.substring(open + 1, close), builder);
            out.append(convertCall(identifier, args, builder));
            i = close + 1;
        }
        return out.toString();
    }

    /**
     * {@code MOD} right after an operand is the infix operator, even when its
     * right operand is parenthesised.
     */
    private static boolean isInfixOperator(String identifier, CharSequence before) {
        if (!"MOD".equalsIgnoreCase(identifier)) {
            return false;
        }
        int k = before.length() - 1;
        while (k >= 0 && Character.isWhitespace(before.charAt(k))) {
            k--;
        }
        if (k < 0) {
            return false;
        }
        char last = before.charAt(k);
        return Character.isLetterOrDigit(last) || last == '_' || last == ')' || last == '\'' || last == '"';
    }

    private String bareIdentifier(String identifier, RewriteState.RewriteStateBuilder builder) {
        Optional<KeywordFunction> keyword = KeywordFunction.fromName(identifier);
        if (keyword.isEmpty()) {
            return identifier;
        }
        if (keyword.get().isApproximate()) {
            builder.warning("'" + identifier + "' has no row-level equivalent; replaced with "
                    + keyword.get().getTarget());
        }
        return keyword.get().getTarget();
    }

    private String convertCall(String identifier, String args, RewriteState.RewriteStateBuilder builder) {
        String passThrough = identifier + "(" + args + ")";
        if (!formulaPrefix.isEmpty() && identifier.toUpperCase(Locale.ROOT).startsWith(formulaPrefix)
                && args.isBlank()) {
            return passThrough;
        }

        Optional<ReportFunction> match = ReportFunction.fromName(identifier);
        if (match.isEmpty()) {
            if (args.isBlank() && KeywordFunction.fromName(identifier).isPresent()) {
                return bareIdentifier(identifier, builder);
            }
            flag(builder, "Unknown function '" + identifier + "' - passed through");
            return passThrough;
        }

        ReportFunction function = match.get();
        List<String> arguments = SourceScanner.splitTopLevel(args);
        switch (function.getKind()) {
            case CONDITIONAL:
                return "IIF(" + args + ")";
            case MANUAL:
                flag(builder, "Function '" + identifier + "' requires manual conversion");
                return passThrough;
            case RUNNING_TOTAL:
                builder.warning("RunningTotal approximated with SUM() OVER (ORDER BY ROWNUM); verify the reset scope");
                return "SUM(" + args + ") OVER (ORDER BY ROWNUM)";
            case DATE_PART:
            case DATE_ADD:
            case DATE_DIFF:
                return convertDateFunction(function, identifier, arguments, passThrough, builder);
            case TEMPLATE:
            default:
                return convertTemplate(function, identifier, arguments, passThrough, builder);
        }
    }

    private String convertTemplate(ReportFunction function, String identifier, List<String> arguments,
                                   String passThrough, RewriteState.RewriteStateBuilder builder) {
        if (!function.acceptsArity(arguments.size())) {
            String expected = function.getMinArity() == function.getMaxArity()
                    ? String.valueOf(function.getMinArity())
                    : function.getMinArity() + "-" + function.getMaxArity();
            flag(builder, "Function '" + identifier + "' expected " + expected
                    + " args, got " + arguments.size());
        }
        String template = function.templateFor(arguments.size());
        if (ReportFunction.placeholderCount(template) > arguments.size()) {
            builder.warning("Could not format function '" + identifier + "'");
            return passThrough;
        }
        return ReportFunction.fill(template, arguments);
    }

    private String convertDateFunction(ReportFunction function, String identifier, List<String> arguments,
                                       String passThrough, RewriteState.RewriteStateBuilder builder) {
        if (arguments.size() < function.getMinArity()) {
            flag(builder, identifier + " requires " + function.getMinArity() + " arguments");
            return passThrough;
        }
        Optional<DateInterval> interval = DateInterval.fromCode(arguments.get(0));
        if (interval.isEmpty()) {
            flag(builder, "Unknown " + identifier + " interval '" + SourceScanner.unquote(arguments.get(0)) + "'");
            return passThrough;
        }
        DateInterval resolved = interval.get();
        if (resolved.isApproximate()) {
            builder.warning(identifier + " interval '" + SourceScanner.unquote(arguments.get(0))
                    + "' is approximated as " + resolved.name());
        }
        List<String> rest = arguments.subList(1, arguments.size());
        switch (function.getKind()) {
            case DATE_ADD:
                return ReportFunction.fill(resolved.getDateAddTemplate(), rest);
            case DATE_DIFF:
                return ReportFunction.fill(resolved.getDateDiffTemplate(), rest);
            default:
                return ReportFunction.fill(resolved.getDatePartTemplate(), rest);
        }
    }

    private static void flag(RewriteState.RewriteStateBuilder builder, String message) {
        builder.warning(message).issue(message);
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean continuesToken(char previous) {
        return isIdentifierPart(previous) || previous == ':' || previous == '.';
    }
}
