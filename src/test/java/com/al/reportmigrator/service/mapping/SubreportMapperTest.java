package com.al.reportmigrator.service.mapping;

import com.al.reportmigrator.config.ConversionProperties;
import com.al.reportmigrator.model.SubreportLink;
import com.al.reportmigrator.model.SubreportReference;
import com.al.reportmigrator.model.target.TargetSubreport;
import com.al.reportmigrator.service.expression.ExpressionTranslator;
import com.al.reportmigrator.service.expression.FormatTriggerTranslator;
import com.al.reportmigrator.service.expression.TriggerNameSequence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SubreportMapperTest {

    private ConversionProperties properties;
    private SubreportMapper subreportMapper;
    private TriggerNameSequence sequence;

    @BeforeEach
    public void setUp() {
        properties = new ConversionProperties();
        subreportMapper = new SubreportMapper(properties,
                new FormatTriggerTranslator(new ExpressionTranslator(properties, new TypeMapper()), properties));
        sequence = new TriggerNameSequence();
    }

    @Test
    public void testMap_LinksAndGeometry() {
        SubreportMapper.Mapped mapped = subreportMapper.map(SubreportReference.builder()
                .name("Order Lines")
                .filePath("lines.rpt")
                .x(1440).y(720).width(2880).height(1440)
                .links(Arrays.asList(
                        SubreportLink.builder().parentField("{orders.order id}").subreportParameter("?Order Id").build(),
                        SubreportLink.builder().parentField("{orders.region}").build()))
                .build(), sequence);
        TargetSubreport subreport = mapped.getSubreport();

        assertEquals("SR_ORDER_LINES", subreport.getName());
        assertEquals("lines.rpt", subreport.getFilePath());
        assertEquals(72.0, subreport.getX(), 1e-6);
        assertEquals(36.0, subreport.getY(), 1e-6);
        assertEquals(144.0, subreport.getWidth(), 1e-6);
        assertEquals(1, subreport.getParameterLinks().size());
        assertEquals("ORDER_ID", subreport.getParameterLinks().get(0).getParentColumn());
        assertEquals("P_ORDER_ID", subreport.getParameterLinks().get(0).getParameter());
        assertEquals(1, subreport.getWarnings().size());
        assertNull(mapped.getTrigger());
        assertFalse(mapped.isTriggerFailed());
    }

    @Test
    public void testMap_NameAlreadyPrefixed() {
        TargetSubreport subreport = subreportMapper.map(
                SubreportReference.builder().name("sr_totals").build(), sequence).getSubreport();

        assertEquals("SR_TOTALS", subreport.getName());
    }

    @Test
    public void testMap_OnDemandWarns() {
        TargetSubreport subreport = subreportMapper.map(
                SubreportReference.builder().name("Details").onDemand(true).build(), sequence).getSubreport();

        assertTrue(subreport.isOnDemand());
        assertTrue(subreport.getWarnings().get(0).contains("on demand"));
    }

    @Test
    public void testMap_SuppressTrigger() {
        SubreportMapper.Mapped mapped = subreportMapper.map(SubreportReference.builder()
                .name("Lines").suppressCondition("{orders.amount} = 0").build(), sequence);

        assertNotNull(mapped.getTrigger());
        assertEquals("FT_SUPPRESS_COND_SR_LINES_1", mapped.getTrigger().getName());
        assertEquals("FT_SUPPRESS_COND_SR_LINES_1", mapped.getSubreport().getSuppressTrigger());
        assertEquals("SR_LINES", mapped.getTrigger().getOwner());
    }

    @Test
    public void testMap_SkippedSuppressConditionNotAttached() {
        properties.setOnUnsupportedFormula(ConversionProperties.UnsupportedPolicy.SKIP);

        SubreportMapper.Mapped mapped = subreportMapper.map(SubreportReference.builder()
                .name("Lines").suppressCondition("Left({a}, 5").build(), sequence);

        assertNull(mapped.getTrigger());
        assertTrue(mapped.isTriggerFailed());
        assertNull(mapped.getSubreport().getSuppressTrigger());
        assertTrue(mapped.getSubreport().getWarnings().get(0).startsWith("Suppress condition not converted"));
    }

    @Test
    public void testMap_RefusedSuppressConditionNotAttached() {
        properties.setOnUnsupportedFormula(ConversionProperties.UnsupportedPolicy.FAIL);

        SubreportMapper.Mapped mapped = subreportMapper.map(SubreportReference.builder()
                .name("Lines").suppressCondition("Left({a}, 5").build(), sequence);

        assertNull(mapped.getTrigger());
        assertTrue(mapped.isTriggerFailed());
    }

    @Test
    public void testMap_UnnamedRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> subreportMapper.map(SubreportReference.builder().build(), sequence));
    }
}
