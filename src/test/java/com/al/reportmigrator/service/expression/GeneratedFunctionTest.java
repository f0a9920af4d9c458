package com.al.reportmigrator.service.expression;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GeneratedFunctionTest {

    @Test
    public void testRender_Expression() {
        String code = GeneratedFunction.builder()
                .name("CF_TOTAL")
                .returnType("NUMBER")
                .expression(":AMOUNT * 2")
                .fallbackValue("NULL")
                .build()
                .render();

        assertEquals("function CF_TOTAL return NUMBER is\n"
                + "begin\n"
                + "  return (:AMOUNT * 2);\n"
                + "exception\n"
                + "  when others then\n"
                + "    return NULL;\n"
                + "end CF_TOTAL;", code);
    }

    @Test
    public void testRender_KeywordNotWrapped() {
        String code = GeneratedFunction.builder()
                .name("FT_X_1").returnType("BOOLEAN").expression("false").fallbackValue("FALSE")
                .headerComment("Suppress when: false")
                .build()
                .render();

        assertTrue(code.contains("  -- Suppress when: false\n"));
        assertTrue(code.contains("  return FALSE;\n"));
    }

    @Test
    public void testRender_Placeholder() {
        String code = GeneratedFunction.builder()
                .name("CF_BROKEN")
                .returnType("VARCHAR2")
                .placeholder(true)
                .originalText("Left({a},\n 5")
                .reason("Unbalanced parentheses: 1 unclosed '('")
                .build()
                .render();

        assertTrue(code.contains("  -- Manual conversion required\n"));
        assertTrue(code.contains("  --   Left({a},\n"));
        assertTrue(code.contains("  --    5\n"));
        assertTrue(code.contains("  -- Reason: Unbalanced parentheses"));
        assertTrue(code.contains("  return NULL;\n"));
        assertFalse(code.contains("exception"));
        assertTrue(code.endsWith("end CF_BROKEN;"));
    }

    @Test
    public void testRender_PlaceholderReturnsFallback() {
        String code = GeneratedFunction.builder()
                .name("FT_SUPPRESS_COND_1")
                .returnType("BOOLEAN")
                .fallbackValue("FALSE")
                .placeholder(true)
                .originalText("Left({a}, 5")
                .reason("Unbalanced parentheses: 1 unclosed '('")
                .build()
                .render();

        assertTrue(code.contains("  return FALSE;\n"));
        assertFalse(code.contains("return NULL;"));
    }
}
