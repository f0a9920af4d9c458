package com.al.reportmigrator.service.expression.pass;

import com.al.reportmigrator.service.expression.RewriteState;
import com.al.reportmigrator.service.expression.SourceScanner;

/**
 * Final normalisation: comments dropped, double-quoted literals converted to
 * single-quoted ones, runs of whitespace in code collapsed to one space.
 */
public class CleanupPass implements RewritePass {

    @Override
    public String name() {
        return "cleanup";
    }

    @Override
    public RewriteState apply(RewriteState state) {
        StringBuilder out = new StringBuilder();
        for (SourceScanner.Segment segment : SourceScanner.segments(state.getText())) {
            switch (segment.getKind()) {
                case COMMENT:
                    out.append(' ');
                    break;
                case LITERAL:
                    out.append(normalizeLiteral(segment.getText()));
                    break;
                default:
                    out.append(segment.getText());
            }
        }
        String text = SourceScanner.rewriteCode(out.toString(), code -> code.replaceAll("\\s+", " "));
        return state.withText(text.trim());
    }

    private static String normalizeLiteral(String literal) {
        if (literal.length() < 2 || literal.charAt(0) != '"') {
            return literal;
        }
        String body = literal.substring(1, literal.length() - 1)
                .replace("\"\"", "\"")
                .replace("'", "''");
        return "'" + body + "'";
    }
}
