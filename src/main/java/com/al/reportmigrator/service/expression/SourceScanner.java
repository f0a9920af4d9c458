package com.al.reportmigrator.service.expression;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical helpers shared by the rewrite passes. Formula text is split into
 * code, quoted literals ('...' or "...", a doubled quote escapes itself) and
 * line comments (// to end of line). Passes only ever rewrite code.
 *
 * @author Report Migrator Team
 * @version 1.0.0
 * @since 1.0.0
 */
public final class SourceScanner {

    private SourceScanner() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    public enum SegmentKind {
        CODE,
        LITERAL,
        COMMENT
    }

    @Value
    public static class Segment {
        SegmentKind kind;
        String text;
        /**
         * False only for a literal that runs to the end of the input.
         */
        boolean terminated;
    }

    public static List<Segment> segments(String text) {
        List<Segment> result = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return result;
        }
        int n = text.length();
        int codeStart = 0;
        int i = 0;
        while (i < n) {
            char c = text.charAt(i);
            if (c == '\'' || c == '"') {
                addCode(result, text, codeStart, i);
                int j = i + 1;
                boolean closed = false;
                while (j < n) {
                    if (text.charAt(j) == c) {
                        if (j + 1 < n && text.charAt(j + 1) == c) {
                            j += 2;
                            continue;
                        }
                        closed = true;
                        break;
                    }
                    j++;
                }
                int end = closed ? j + 1 : n;
                result.add(new Segment(SegmentKind.LITERAL, text.substring(i, end), closed));
                i = end;
                codeStart = i;
            } else if (c == '/' && i + 1 < n && text.charAt(i + 1) == '/') {
                addCode(result, text, codeStart, i);
                int end = text.indexOf('\n', i);
                end = end < 0 ? n : end;
                result.add(new Segment(SegmentKind.COMMENT, text.substring(i, end), true));
                i = end;
                codeStart = i;
            } else {
                i++;
            }
        }
        addCode(result, text, codeStart, n);
        return result;
    }

    private static void addCode(List<Segment> result, String text, int start, int end) {
        if (end > start) {
            result.add(new Segment(SegmentKind.CODE, text.substring(start, end), true));
        }
    }

    /**
     * Apply {@code rewriter} to every code segment, copying literals and
     * comments through unchanged.
     */
    public static String rewriteCode(String text, UnaryOperator<String> rewriter) {
        StringBuilder out = new StringBuilder(text.length());
        for (Segment segment : segments(text)) {
            out.append(segment.getKind() == SegmentKind.CODE ? rewriter.apply(segment.getText()) : segment.getText());
        }
        return out.toString();
    }

    /**
     * Replace every match of {@code pattern} inside code segments with the
     * text computed by {@code replacer}.
     */
    public static String replaceInCode(String text, Pattern pattern, Function<MatchResult, String> replacer) {
        return rewriteCode(text, code -> {
            Matcher matcher = pattern.matcher(code);
            StringBuilder out = new StringBuilder(code.length());
            while (matcher.find()) {
                matcher.appendReplacement(out, Matcher.quoteReplacement(replacer.apply(matcher.toMatchResult())));
            }
            matcher.appendTail(out);
            return out.toString();
        });
    }

    /**
     * Per character: true when the character belongs to code.
     */
    public static boolean[] codeMask(String text) {
        boolean[] mask = new boolean[text.length()];
        int pos = 0;
        for (Segment segment : segments(text)) {
            int len = segment.getText().length();
            if (segment.getKind() == SegmentKind.CODE) {
                for (int k = pos; k < pos + len; k++) {
                    mask[k] = true;
                }
            }
            pos += len;
        }
        return mask;
    }

    /**
     * Index of the parenthesis closing the one at {@code openIndex}, ignoring
     * parentheses inside literals and comments; -1 when it is never closed.
     */
    public static int findMatchingParen(String text, int openIndex) {
        boolean[] code = codeMask(text);
        int depth = 0;
        for (int i = openIndex; i < text.length(); i++) {
            if (!code[i]) {
                continue;
            }
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Split an argument list on commas that sit outside any nested
     * parentheses, brackets or literals. Arguments are trimmed; blank input
     * gives an empty list.
     */
    public static List<String> splitTopLevel(String args) {
        List<String> result = new ArrayList<>();
        if (args == null || args.isBlank()) {
            return result;
        }
        boolean[] code = codeMask(args);
        int depth = 0;
        int start = 0;
        for (int i = 0; i < args.length(); i++) {
            if (!code[i]) {
                continue;
            }
            char c = args.charAt(i);
            if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            } else if (c == ',' && depth == 0) {
                result.add(args.substring(start, i).trim());
                start = i + 1;
            }
        }
        result.add(args.substring(start).trim());
        return result;
    }

    /**
     * Describe the first structural defect that makes the text unsafe to
     * rewrite, if any.
     */
    public static Optional<String> structuralProblem(String text) {
        int depth = 0;
        for (Segment segment : segments(text)) {
            if (segment.getKind() == SegmentKind.LITERAL && !segment.isTerminated()) {
                return Optional.of("Unterminated string literal");
            }
            if (segment.getKind() != SegmentKind.CODE) {
                continue;
            }
            for (char c : segment.getText().toCharArray()) {
                if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                    if (depth < 0) {
                        return Optional.of("Unbalanced parentheses: unexpected ')'");
                    }
                }
            }
        }
        if (depth != 0) {
            return Optional.of("Unbalanced parentheses: " + depth + " unclosed '('");
        }
        return Optional.empty();
    }

    /**
     * Strip one pair of matching quotes from a literal argument.
     */
    public static String unquote(String literal) {
        String s = literal == null ? "" : literal.trim();
        if (s.length() >= 2 && (s.charAt(0) == '\'' || s.charAt(0) == '"') && s.charAt(s.length() - 1) == s.charAt(0)) {
            return s.substring(1, s.length() - 1);
        }
        return s;
    }
}
