package com.al.reportmigrator.service.expression.pass;

import com.al.reportmigrator.service.expression.RewriteState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConditionalFlatteningPassTest {

    private final ConditionalFlatteningPass pass = new ConditionalFlatteningPass(20);

    @Test
    public void testSingleCall() {
        RewriteState state = pass.apply(RewriteState.of("IIF(a, b, c)"));

        assertEquals("CASE WHEN a THEN b ELSE c END", state.getText());
        assertTrue(state.getWarnings().isEmpty());
    }

    @Test
    public void testElseChainMerged() {
        RewriteState state = pass.apply(RewriteState.of("IIF(a > 10, 'H', IIF(a > 5, 'M', 'L'))"));

        assertEquals("CASE WHEN a > 10 THEN 'H' WHEN a > 5 THEN 'M' ELSE 'L' END", state.getText());
    }

    @Test
    public void testThenBranchNested() {
        RewriteState state = pass.apply(RewriteState.of("IIF(a, IIF(b, 1, 2), 3)"));

        assertEquals("CASE WHEN a THEN CASE WHEN b THEN 1 ELSE 2 END ELSE 3 END", state.getText());
    }

    @Test
    public void testWrongArgumentCountLeftUnchanged() {
        RewriteState state = pass.apply(RewriteState.of("IIF(a, b)"));

        assertEquals("IIF(a, b)", state.getText());
        assertEquals("IIF expects 3 arguments, got 2; left unchanged", state.getWarnings().get(0));
    }

    @Test
    public void testDepthCap() {
        RewriteState state = new ConditionalFlatteningPass(1).apply(RewriteState.of("IIF(a, 1, IIF(b, 2, 3))"));

        assertEquals("IIF(a, 1, CASE WHEN b THEN 2 ELSE 3 END)", state.getText());
        assertEquals(1, state.getWarnings().size());
        assertTrue(state.getWarnings().get(0).startsWith("Conditional nesting deeper than 1"));
    }

    @Test
    public void testCallInsideLiteralIgnored() {
        RewriteState state = pass.apply(RewriteState.of("'IIF(x, y, z)'"));

        assertEquals("'IIF(x, y, z)'", state.getText());
    }

    @Test
    public void testIsSingleCase() {
        assertTrue(ConditionalFlatteningPass.isSingleCase("CASE WHEN a THEN CASE WHEN b THEN 1 END END"));
        assertFalse(ConditionalFlatteningPass.isSingleCase("CASE WHEN a THEN 1 END + 1"));
        assertFalse(ConditionalFlatteningPass.isSingleCase("x"));
    }
}
