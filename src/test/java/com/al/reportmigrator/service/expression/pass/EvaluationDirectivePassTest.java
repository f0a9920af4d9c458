package com.al.reportmigrator.service.expression.pass;

import com.al.reportmigrator.service.expression.RewriteState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EvaluationDirectivePassTest {

    private final EvaluationDirectivePass pass = new EvaluationDirectivePass();

    @Test
    public void testDirectiveRemovedWithWarning() {
        RewriteState state = pass.apply(RewriteState.of("WhilePrintingRecords;\n{a} + 1"));

        assertEquals("{a} + 1", state.getText());
        assertEquals(1, state.getWarnings().size());
        assertTrue(state.getWarnings().get(0).contains("WhilePrintingRecords"));
    }

    @Test
    public void testEvaluateAfterWithArgument() {
        RewriteState state = pass.apply(RewriteState.of("evaluateafter({@Subtotal}); {@Subtotal} * 2"));

        assertEquals("{@Subtotal} * 2", state.getText());
        assertTrue(state.getWarnings().get(0).contains("EvaluateAfter"));
    }

    @Test
    public void testDirectiveInsideLiteralKept() {
        RewriteState state = pass.apply(RewriteState.of("'WhileReadingRecords'"));

        assertEquals("'WhileReadingRecords'", state.getText());
        assertTrue(state.getWarnings().isEmpty());
    }
}
