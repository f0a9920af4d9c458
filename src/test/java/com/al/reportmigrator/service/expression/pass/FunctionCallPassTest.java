package com.al.reportmigrator.service.expression.pass;

import com.al.reportmigrator.service.expression.RewriteState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FunctionCallPassTest {

    private final FunctionCallPass pass = new FunctionCallPass("CF_");

    private RewriteState apply(String text) {
        return pass.apply(RewriteState.of(text));
    }

    @Test
    public void testNestedCallsInnermostFirst() {
        RewriteState state = apply("UCase(Trim(x))");

        assertEquals("UPPER(TRIM(x))", state.getText());
        assertTrue(state.getWarnings().isEmpty());
    }

    @Test
    public void testArityDependentTemplates() {
        assertEquals("SUBSTR(s, 2)", apply("Mid(s, 2)").getText());
        assertEquals("SUBSTR(s, 2, 3)", apply("Mid(s, 2, 3)").getText());
        assertEquals("INSTR(s, 'a', 1)", apply("InStr(1, s, 'a')").getText());
    }

    @Test
    public void testAliases() {
        assertEquals("LENGTH(x) + NVL(y, 0)", apply("Len(x) + nvl(y, 0)").getText());
        assertEquals("TO_CHAR(n, '0.00')", apply("CStr(n, '0.00')").getText());
    }

    @Test
    public void testArityMismatchFlagged() {
        RewriteState state = apply("Left(x)");

        assertEquals("Left(x)", state.getText());
        assertEquals(1, state.getIssues().size());
        assertEquals("Function 'Left' expected 2 args, got 1", state.getIssues().get(0));
        assertTrue(state.getWarnings().contains("Could not format function 'Left'"));
    }

    @Test
    public void testUnknownFunctionPassedThrough() {
        RewriteState state = apply("Frobnicate(x)");

        assertEquals("Frobnicate(x)", state.getText());
        assertEquals("Unknown function 'Frobnicate' - passed through", state.getIssues().get(0));
    }

    @Test
    public void testManualFunctionFlagged() {
        RewriteState state = apply("Switch(a, 1, b, 2)");

        assertEquals("Switch(a, 1, b, 2)", state.getText());
        assertEquals("Function 'Switch' requires manual conversion", state.getIssues().get(0));
    }

    @Test
    public void testConditionalNormalised() {
        assertEquals("IIF(a, LOWER(b), c)", apply("IIf(a, LCase(b), c)").getText());
    }

    @Test
    public void testKeywordFunctions() {
        RewriteState state = apply("CurrentDate + 1");
        assertEquals("TRUNC(SYSDATE) + 1", state.getText());
        assertTrue(state.getWarnings().isEmpty());

        RewriteState page = apply("PageNumber");
        assertEquals("1", page.getText());
        assertEquals(1, page.getWarnings().size());
        assertTrue(page.getIssues().isEmpty());
    }

    @Test
    public void testGeneratedFormulaCallsKept() {
        RewriteState state = apply("CF_TOTAL() + 1");

        assertEquals("CF_TOTAL() + 1", state.getText());
        assertTrue(state.getIssues().isEmpty());
    }

    @Test
    public void testSqlWordsAreNotCalls() {
        assertEquals("x IN (1, 2)", apply("x IN (1, 2)").getText());
    }

    @Test
    public void testBindVariablesNotRewritten() {
        assertEquals(":YEAR + 1", apply(":YEAR + 1").getText());
    }

    @Test
    public void testDateFunctions() {
        assertEquals("ADD_MONTHS(:D, 1)", apply("DateAdd('m', 1, :D)").getText());
        assertEquals("(x + (7))", apply("DateAdd(\"d\", 7, x)").getText());
        assertEquals("EXTRACT(YEAR FROM x)", apply("DatePart('yyyy', x)").getText());
    }

    @Test
    public void testApproximateDateIntervalWarns() {
        RewriteState state = apply("DateDiff('ww', a, b)");

        assertEquals("TRUNC((TRUNC(b) - TRUNC(a)) / 7)", state.getText());
        assertEquals(1, state.getWarnings().size());
        assertTrue(state.getIssues().isEmpty());
    }

    @Test
    public void testUnknownDateIntervalFlagged() {
        RewriteState state = apply("DatePart('zz', a)");

        assertEquals("DatePart('zz', a)", state.getText());
        assertEquals("Unknown DatePart interval 'zz'", state.getIssues().get(0));
    }

    @Test
    public void testRunningTotal() {
        RewriteState state = apply("RunningTotal(x)");

        assertEquals("SUM(x) OVER (ORDER BY ROWNUM)", state.getText());
        assertEquals(1, state.getWarnings().size());
    }

    @Test
    public void testCallInsideLiteralIgnored() {
        assertEquals("'Left(x)'", apply("'Left(x)'").getText());
    }

    @Test
    public void testModOperatorBeforeParenthesisedOperand() {
        RewriteState state = apply(":A MOD (:B + 1)");

        assertEquals(":A MOD (:B + 1)", state.getText());
        assertTrue(state.getWarnings().isEmpty());
        assertTrue(state.getIssues().isEmpty());
    }

    @Test
    public void testModOperatorAfterClosingParenthesis() {
        RewriteState state = apply("Len(x) MOD (2)");

        assertEquals("LENGTH(x) MOD (2)", state.getText());
        assertTrue(state.getIssues().isEmpty());
    }

    @Test
    public void testModFunctionStillConverted() {
        assertEquals("1 + MOD(a, 2)", apply("1 + Mod(a, 2)").getText());
        assertEquals("MOD(a, 2)", apply("MOD(a, 2)").getText());
    }
}
