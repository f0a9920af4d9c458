package com.al.reportmigrator.service.expression.pass;

import com.al.reportmigrator.service.expression.RewriteState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class CleanupPassTest {

    private final CleanupPass pass = new CleanupPass();

    private String apply(String text) {
        return pass.apply(RewriteState.of(text)).getText();
    }

    @Test
    public void testCommentsDroppedAndWhitespaceCollapsed() {
        assertEquals("a + b", apply("a  +\n  b // note"));
    }

    @Test
    public void testDoubleQuotedLiteralConverted() {
        assertEquals("'It''s'", apply("\"It's\""));
        assertEquals("'say \"hi\"'", apply("\"say \"\"hi\"\"\""));
    }

    @Test
    public void testWhitespaceInsideLiteralKept() {
        assertEquals("'a   b' || x", apply("'a   b'   ||   x"));
    }
}
