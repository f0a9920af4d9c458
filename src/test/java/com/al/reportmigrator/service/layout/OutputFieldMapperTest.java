package com.al.reportmigrator.service.layout;

import com.al.reportmigrator.config.ConversionProperties;
import com.al.reportmigrator.config.FontProperties;
import com.al.reportmigrator.model.ConditionalFormat;
import com.al.reportmigrator.model.Field;
import com.al.reportmigrator.model.FontSpec;
import com.al.reportmigrator.model.FormatSpec;
import com.al.reportmigrator.model.enums.Elasticity;
import com.al.reportmigrator.model.enums.SourceKind;
import com.al.reportmigrator.model.enums.TriggerKind;
import com.al.reportmigrator.model.target.OutputField;
import com.al.reportmigrator.service.expression.ExpressionTranslator;
import com.al.reportmigrator.service.expression.FormatTriggerTranslator;
import com.al.reportmigrator.service.expression.TriggerNameSequence;
import com.al.reportmigrator.service.mapping.FontMapper;
import com.al.reportmigrator.service.mapping.TypeMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class OutputFieldMapperTest {

    private static final double DELTA = 1e-6;

    private OutputFieldMapper fieldMapper;
    private SynthesisRun run;
    private ConversionProperties properties;

    @BeforeEach
    public void setUp() {
        properties = new ConversionProperties();
        TypeMapper typeMapper = new TypeMapper();
        fieldMapper = new OutputFieldMapper(properties, new FontMapper(new FontProperties()), typeMapper);
        FormatTriggerTranslator triggerTranslator =
                new FormatTriggerTranslator(new ExpressionTranslator(properties, typeMapper), properties);
        run = new SynthesisRun(triggerTranslator, new TriggerNameSequence(),
                new SourceBindings(Map.of("Total", "CF_TOTAL_2")));
    }

    @Test
    public void testMap_ColumnFieldGeometryAndFormat() {
        Field field = Field.builder()
                .name("Amount")
                .source("{orders.amount}")
                .x(1440).y(20).width(2880).height(240)
                .font(FontSpec.builder().name("Times New Roman").size(9).bold(true).color("navy").build())
                .format(FormatSpec.builder()
                        .horizontalAlignment("Right")
                        .verticalAlignment("middle")
                        .formatMask("#,##0.00")
                        .canGrow(true)
                        .build())
                .build();

        OutputField output = fieldMapper.map(field, run);

        assertEquals("F_AMOUNT", output.getName());
        assertEquals(SourceKind.COLUMN, output.getSourceKind());
        assertEquals("AMOUNT", output.getSource());
        assertEquals(72.0, output.getX(), DELTA);
        assertEquals(1.0, output.getY(), DELTA);
        assertEquals(144.0, output.getWidth(), DELTA);
        assertEquals(12.0, output.getHeight(), DELTA);
        assertEquals("Times", output.getFontFamily());
        assertEquals("bold", output.getFontStyle());
        assertEquals("end", output.getHorizontalAlignment());
        assertEquals("center", output.getVerticalAlignment());
        assertEquals("999,999,999,990.00", output.getFormatMask());
        assertEquals("navy", output.getForegroundColor());
        assertEquals("white", output.getBackgroundColor());
        assertEquals(Elasticity.EXPAND, output.getVerticalElasticity());
        assertTrue(output.isVisible());
        assertNull(output.getFormatTrigger());
        assertTrue(run.getWarnings().isEmpty());
    }

    @Test
    public void testMap_SourceKindsInferred() {
        assertEquals("CF_TOTAL_2", fieldMapper.map(Field.builder().name("T").source("{@Total}").build(), run)
                .getSource());
        assertEquals("CF_OTHER", fieldMapper.map(Field.builder().name("O").source("{@Other}").build(), run)
                .getSource());
        OutputField parameter = fieldMapper.map(Field.builder().name("P").source("{?Region}").build(), run);
        assertEquals(SourceKind.PARAMETER, parameter.getSourceKind());
        assertEquals("P_REGION", parameter.getSource());
        OutputField special = fieldMapper.map(Field.builder().name("Pg").source("PageNumber").build(), run);
        assertEquals(SourceKind.SPECIAL, special.getSourceKind());
        assertEquals("&Physical Page Number", special.getSource());
        OutputField text = fieldMapper.map(Field.builder().name("Lbl").source("").build(), run);
        assertEquals(SourceKind.LITERAL, text.getSourceKind());
    }

    @Test
    public void testMap_ApproximateSpecialFieldWarns() {
        fieldMapper.map(Field.builder().name("PageOf").source("Page N of M").build(), run);

        assertEquals(1, run.getWarnings().size());
        assertTrue(run.getWarnings().get(0).contains("approximated"));
    }

    @Test
    public void testMap_DuplicateNamesSuffixed() {
        assertEquals("F_AMOUNT", fieldMapper.map(Field.builder().name("Amount").source("{a}").build(), run)
                .getName());
        assertEquals("F_AMOUNT_2", fieldMapper.map(Field.builder().name("amount").source("{a}").build(), run)
                .getName());
    }

    @Test
    public void testMap_UnmappedMaskDropped() {
        OutputField output = fieldMapper.map(Field.builder().name("X").source("{x}")
                .format(FormatSpec.builder().formatMask("General").build()).build(), run);

        assertNull(output.getFormatMask());
        assertTrue(run.getWarnings().get(0).contains("'General'"));
    }

    @Test
    public void testMap_SuppressFlagsTrigger() {
        OutputField output = fieldMapper.map(Field.builder().name("Qty").source("{orders.qty}")
                .format(FormatSpec.builder().suppressIfZero(true).build()).build(), run);

        assertEquals("FT_SUPPRESS_F_QTY_1", output.getFormatTrigger());
        assertTrue(output.isVisible());
        assertEquals(1, run.getTriggers().size());
        assertTrue(run.getTriggers().get(0).getTargetCode().contains("return (:QTY = 0);"));
    }

    @Test
    public void testMap_ConditionAndFlagsBothGenerated() {
        OutputField output = fieldMapper.map(Field.builder().name("Qty").source("{orders.qty}")
                .suppressCondition("{orders.qty} > 100")
                .format(FormatSpec.builder().suppressIfBlank(true).build()).build(), run);

        assertEquals("FT_SUPPRESS_COND_F_QTY_1", output.getFormatTrigger());
        assertFalse(output.isVisible());
        assertEquals(2, run.getTriggers().size());
        assertTrue(run.getWarnings().get(0).contains("must be merged"));
    }

    @Test
    public void testMap_ConditionalFormatAttachedWhenAlone() {
        OutputField output = fieldMapper.map(Field.builder().name("Total").source("{orders.total}")
                .conditionalFormats(new ArrayList<>(Arrays.asList(
                        ConditionalFormat.builder().property("foregroundColor").condition("{orders.total} < 0")
                                .value("red").build(),
                        ConditionalFormat.builder().property("fontStyle").condition(" ").value("bold").build())))
                .build(), run);

        assertEquals("FT_FORMAT_F_TOTAL_1", output.getFormatTrigger());
        assertEquals(1, run.getTriggers().size());
        assertEquals(TriggerKind.CONDITIONAL_FORMAT, run.getTriggers().get(0).getKind());
    }

    @Test
    public void testMap_SkippedConditionNotAttachedAndFieldVisible() {
        properties.setOnUnsupportedFormula(ConversionProperties.UnsupportedPolicy.SKIP);

        OutputField output = fieldMapper.map(Field.builder().name("Amt").source("{orders.amt}")
                .suppressCondition("Left({a}, 5").build(), run);

        assertNull(output.getFormatTrigger());
        assertTrue(output.isVisible());
        assertTrue(run.getTriggers().isEmpty());
        assertEquals(Arrays.asList("F_AMT"), run.getFailedTriggers());
        assertTrue(run.getWarnings().get(0).startsWith("Trigger for F_AMT not generated: Skipped: Unbalanced"));
    }

    @Test
    public void testMap_RefusedConditionLeavesFieldVisible() {
        properties.setOnUnsupportedFormula(ConversionProperties.UnsupportedPolicy.FAIL);

        OutputField output = fieldMapper.map(Field.builder().name("Amt").source("{orders.amt}")
                .suppressCondition("Left({a}, 5")
                .format(FormatSpec.builder().suppressIfZero(true).build()).build(), run);

        assertEquals("FT_SUPPRESS_F_AMT_2", output.getFormatTrigger());
        assertTrue(output.isVisible());
        assertEquals(1, run.getTriggers().size());
        assertEquals(Arrays.asList("F_AMT"), run.getFailedTriggers());
    }
}
