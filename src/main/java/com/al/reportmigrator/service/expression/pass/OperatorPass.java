package com.al.reportmigrator.service.expression.pass;

import com.al.reportmigrator.service.expression.RewriteState;
import com.al.reportmigrator.service.expression.SourceScanner;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Operators and keyword literals. Word operators match case-insensitively on
 * word boundaries; the concatenation symbol is left alone when doubled or
 * followed by '='.
 */
public class OperatorPass implements RewritePass {

    private static final Pattern NOT_EQUAL_NULL = Pattern.compile("(<>|!=)\\s*null\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern EQUAL_NULL = Pattern.compile("(?<![<>!=])=\\s*null\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern NOT_EQUAL = Pattern.compile("<>");
    private static final Pattern CONCAT = Pattern.compile("(?<![&=])&(?![&=])");
    private static final Pattern WORDS = Pattern.compile("\\b(and|or|not|mod|is|null|true|false)\\b",
            Pattern.CASE_INSENSITIVE);

    @Override
    public String name() {
        return "operators";
    }

    @Override
    public RewriteState apply(RewriteState state) {
        String text = state.getText();
        text = SourceScanner.replaceInCode(text, NOT_EQUAL_NULL, match -> "IS NOT NULL");
        text = SourceScanner.replaceInCode(text, EQUAL_NULL, match -> "IS NULL");
        text = SourceScanner.replaceInCode(text, NOT_EQUAL, match -> "!=");
        text = SourceScanner.replaceInCode(text, CONCAT, match -> " || ");
        text = SourceScanner.replaceInCode(text, WORDS, match -> match.group(1).toUpperCase(Locale.ROOT));
        return state.withText(text);
    }
}
