package com.al.reportmigrator.service.expression.pass;

import com.al.reportmigrator.service.expression.RewriteState;
import com.al.reportmigrator.service.expression.SourceScanner;
import com.al.reportmigrator.util.TargetNames;

import java.util.regex.Pattern;

/**
 * {table.field} and {field} become bind variables named after the last dot
 * segment: {orders.amount} and {AMOUNT} both give :AMOUNT.
 */
public class FieldReferencePass implements RewritePass {

    // braces not opened by @ (formula) or ? (parameter)
    private static final Pattern FIELD_REFERENCE = Pattern.compile("\\{([^@?}][^}]*)\\}");

    @Override
    public String name() {
        return "field-references";
    }

    @Override
    public RewriteState apply(RewriteState state) {
        RewriteState.RewriteStateBuilder builder = state.toBuilder();
        String text = SourceScanner.replaceInCode(state.getText(), FIELD_REFERENCE, match -> {
            String column = TargetNames.columnName(match.group(1));
            builder.referencedColumn(column);
            return ":" + column;
        });
        return builder.text(text).build();
    }
}
