package com.al.reportmigrator.service.expression;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A target function before rendering. The fallback value is what the
 * exception handler returns; a placeholder function documents the original
 * text instead of evaluating it.
 */
@Value
@Builder
public class GeneratedFunction {

    String name;

    String returnType;

    String expression;

    String fallbackValue;

    @Singular
    List<String> headerComments;

    boolean placeholder;

    String reason;

    String originalText;

    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("function ").append(name).append(" return ").append(returnType).append(" is\n");
        sb.append("begin\n");
        for (String comment : headerComments) {
            sb.append("  -- ").append(comment).append('\n');
        }
        if (placeholder) {
            sb.append("  -- Manual conversion required\n");
            if (originalText != null && !originalText.isBlank()) {
                sb.append("  -- Original:\n");
                for (String line : originalText.split("\\R")) {
                    sb.append("  --   ").append(line).append('\n');
                }
            }
            if (reason != null) {
                sb.append("  -- Reason: ").append(reason).append('\n');
            }
            sb.append("  return ").append(fallbackValue == null ? "NULL" : fallbackValue).append(";\n");
        } else if (expression == null || expression.isBlank()) {
            sb.append("  return NULL;\n");
        } else {
            sb.append("  return ").append(wrap(expression)).append(";\n");
            sb.append("exception\n");
            sb.append("  when others then\n");
            sb.append("    return ").append(fallbackValue).append(";\n");
        }
        sb.append("end ").append(name).append(';');
        return sb.toString();
    }

    private static String wrap(String expression) {
        String upper = expression.trim().toUpperCase();
        if (upper.equals("NULL") || upper.equals("TRUE") || upper.equals("FALSE")) {
            return upper;
        }
        return "(" + expression + ")";
    }
}
