package com.al.reportmigrator.service.layout;

import com.al.reportmigrator.config.ConversionProperties;
import com.al.reportmigrator.config.FontProperties;
import com.al.reportmigrator.config.LayoutProperties;
import com.al.reportmigrator.model.Field;
import com.al.reportmigrator.model.Group;
import com.al.reportmigrator.model.Section;
import com.al.reportmigrator.model.enums.Elasticity;
import com.al.reportmigrator.model.enums.FrameKind;
import com.al.reportmigrator.model.enums.SectionRole;
import com.al.reportmigrator.model.target.Frame;
import com.al.reportmigrator.model.target.LayoutResult;
import com.al.reportmigrator.service.expression.ExpressionTranslator;
import com.al.reportmigrator.service.expression.FormatTriggerTranslator;
import com.al.reportmigrator.service.expression.TriggerNameSequence;
import com.al.reportmigrator.service.mapping.FontMapper;
import com.al.reportmigrator.service.mapping.TypeMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LayoutSynthesizerTest {

    private static final double DELTA = 1e-6;
    private static final double PAGE_WIDTH = 612;
    private static final double PAGE_HEIGHT = 792;

    private ConversionProperties properties;
    private LayoutSynthesizer synthesizer;
    private FormatTriggerTranslator triggerTranslator;

    @BeforeEach
    public void setUp() {
        properties = new ConversionProperties();
        TypeMapper typeMapper = new TypeMapper();
        OutputFieldMapper fieldMapper = new OutputFieldMapper(properties, new FontMapper(new FontProperties()),
                typeMapper);
        synthesizer = new LayoutSynthesizer(properties, new LayoutProperties(), fieldMapper);
        triggerTranslator = new FormatTriggerTranslator(new ExpressionTranslator(properties, typeMapper), properties);
    }

    private static Section section(String name, SectionRole role, double heightTwips) {
        return Section.builder().name(name).role(role).height(heightTwips).build();
    }

    private static List<Group> twoGroups() {
        return Arrays.asList(Group.builder().name("Region").build(),
                Group.builder().name("Customer").keepTogether(true).build());
    }

    private static List<Section> fullReport() {
        return new ArrayList<>(Arrays.asList(
                section("Report Header", SectionRole.REPORT_HEADER, 720),
                section("Page Header", SectionRole.PAGE_HEADER, 360),
                section("GH1", null, 400),
                section("GH2", null, 300),
                section("Details", null, 240),
                section("GF2", null, 300),
                section("GF1", null, 400),
                section("Page Footer", SectionRole.PAGE_FOOTER, 360),
                section("Report Footer", SectionRole.REPORT_FOOTER, 720)));
    }

    private LayoutResult synthesize(List<Section> sections, List<Group> groups) {
        return synthesizer.synthesize(sections, groups, PAGE_WIDTH, PAGE_HEIGHT, triggerTranslator,
                new TriggerNameSequence());
    }

    @Test
    public void testSynthesize_MarginFrame() {
        LayoutResult result = synthesize(fullReport(), twoGroups());
        Frame margin = result.getMarginFrame();

        assertEquals(36.0, result.getMargin(), DELTA);
        assertEquals("M_MAIN", margin.getName());
        assertEquals(FrameKind.MARGIN, margin.getKind());
        assertEquals(36.0, margin.getX(), DELTA);
        assertEquals(36.0, margin.getY(), DELTA);
        assertEquals(540.0, margin.getWidth(), DELTA);
        assertEquals(720.0, margin.getHeight(), DELTA);
    }

    @Test
    public void testSynthesize_GroupNesting() {
        LayoutResult result = synthesize(fullReport(), twoGroups());

        Frame body = result.getBodyFrame();
        assertEquals(FrameKind.BODY, body.getKind());
        assertEquals(1, body.getChildren().size());

        Frame region = body.getChildren().get(0);
        assertEquals("R_G_REGION", region.getName());
        assertEquals(FrameKind.REPEATING, region.getKind());
        assertEquals("Region", region.getSourceGroup());
        assertEquals(Elasticity.EXPAND, region.getVerticalElasticity());
        assertFalse(region.isPageProtect());
        assertEquals(Arrays.asList("M_G_REGION_HDR", "R_G_CUSTOMER", "M_G_REGION_FTR"),
                names(region.getChildren()));

        Frame customer = region.getChildren().get(1);
        assertTrue(customer.isPageProtect());
        assertEquals(Arrays.asList("M_G_CUSTOMER_HDR", "R_G_DETAIL", "M_G_CUSTOMER_FTR"),
                names(customer.getChildren()));
        assertEquals("GH2", customer.getChildren().get(0).getSourceSection());
        assertEquals(FrameKind.HEADER, customer.getChildren().get(0).getKind());
        assertEquals(FrameKind.TRAILER, customer.getChildren().get(2).getKind());

        Frame detail = customer.getChildren().get(1);
        assertEquals(Frame.DETAIL_GROUP, detail.getSourceGroup());
        assertEquals("Details", detail.getSourceSection());
        assertTrue(detail.getChildren().isEmpty());
    }

    @Test
    public void testSynthesize_HeightsAndOffsets() {
        LayoutResult result = synthesize(fullReport(), twoGroups());
        Frame region = result.getBodyFrame().getChildren().get(0);
        Frame customer = region.getChildren().get(1);
        Frame detail = customer.getChildren().get(1);

        assertEquals(12.0, detail.getHeight(), DELTA);
        assertEquals(15.0, detail.getY(), DELTA);
        assertEquals(42.0, customer.getHeight(), DELTA);
        assertEquals(20.0, customer.getY(), DELTA);
        assertEquals(62.0, region.getChildren().get(2).getY(), DELTA);
        assertEquals(82.0, region.getHeight(), DELTA);
        assertEquals(82.0, result.getBodyFrame().getHeight(), DELTA);
    }

    @Test
    public void testSynthesize_MarginChildrenPositioned() {
        LayoutResult result = synthesize(fullReport(), twoGroups());
        List<Frame> children = result.getMarginFrame().getChildren();

        assertEquals(Arrays.asList("M_REPORT_HEADER", "M_PAGE_HEADER", "M_BODY", "M_REPORT_FOOTER",
                "M_PAGE_FOOTER"), names(children));
        assertEquals(0.0, children.get(0).getY(), DELTA);
        assertEquals(36.0, children.get(1).getY(), DELTA);
        assertEquals(54.0, children.get(2).getY(), DELTA);
        assertEquals(136.0, children.get(3).getY(), DELTA);

        Frame trailer = result.getTrailerFrame();
        assertEquals(FrameKind.TRAILER, trailer.getKind());
        assertEquals(702.0, trailer.getY(), DELTA);
        assertEquals("M_PAGE_FOOTER_SECTION", trailer.getChildren().get(0).getName());

        Frame header = result.getHeaderFrame();
        assertEquals(FrameKind.HEADER, header.getKind());
        assertEquals("Page Header", header.getChildren().get(0).getSourceSection());
        assertTrue(result.getWarnings().isEmpty());
    }

    @Test
    public void testSynthesize_NoGroupsDetailDirectlyInBody() {
        LayoutResult result = synthesize(Collections.singletonList(section("Details", null, 240)),
                Collections.emptyList());

        Frame top = result.getBodyFrame().getChildren().get(0);
        assertEquals("R_G_DETAIL", top.getName());
        assertEquals(12.0, result.getBodyFrame().getHeight(), DELTA);
        assertNull(result.getHeaderFrame());
        assertNull(result.getTrailerFrame());
    }

    @Test
    public void testSynthesize_NoDetailSection() {
        LayoutResult result = synthesize(Collections.emptyList(), Collections.emptyList());

        Frame top = result.getBodyFrame().getChildren().get(0);
        assertEquals("R_G_DETAIL", top.getName());
        assertEquals(0.0, top.getHeight(), DELTA);
        assertEquals(1, result.getWarnings().size());
        assertTrue(result.getWarnings().get(0).contains("no detail section"));
    }

    @Test
    public void testSynthesize_BandWithoutGroupOmitted() {
        List<Section> sections = new ArrayList<>(fullReport());
        sections.add(section("GH3", null, 1440));

        LayoutResult result = synthesize(sections, twoGroups());

        assertEquals(82.0, result.getBodyFrame().getHeight(), DELTA);
        assertTrue(result.getMarginFrame().collect(f -> "GH3".equals(f.getSourceSection())).isEmpty());
    }

    @Test
    public void testSynthesize_ExplicitGroupIndexWins() {
        Section header = Section.builder().name("Header Band 7").role(SectionRole.GROUP_HEADER)
                .groupIndex(2).height(300).build();

        LayoutResult result = synthesize(Arrays.asList(header, section("Details", null, 240)), twoGroups());

        Frame customer = result.getBodyFrame().getChildren().get(0).getChildren().get(0);
        assertEquals("R_G_CUSTOMER", customer.getName());
        assertEquals("Header Band 7", customer.getChildren().get(0).getSourceSection());
    }

    @Test
    public void testSynthesize_ExtraDetailSectionsMerged() {
        Section first = Section.builder().name("Da").role(SectionRole.DETAIL).height(240)
                .fields(new ArrayList<>(Collections.singletonList(
                        Field.builder().name("Amount").source("{orders.amount}").y(0).build())))
                .build();
        Section second = Section.builder().name("Db").role(SectionRole.DETAIL).height(240)
                .fields(new ArrayList<>(Collections.singletonList(
                        Field.builder().name("Note").source("{orders.note}").y(20).build())))
                .build();

        LayoutResult result = synthesize(Arrays.asList(first, second), Collections.emptyList());

        Frame detail = result.getBodyFrame().getChildren().get(0);
        assertEquals(24.0, detail.getHeight(), DELTA);
        assertEquals(2, detail.getFields().size());
        assertEquals(13.0, detail.getFields().get(1).getY(), DELTA);
        assertEquals(1, result.getWarnings().size());
        assertTrue(result.getWarnings().get(0).contains("'Db' merged"));
    }

    @Test
    public void testSynthesize_SectionSuppression() {
        List<Section> sections = new ArrayList<>(fullReport());
        sections.set(2, Section.builder().name("GH1").height(400).suppressCondition("{orders.amount} = 0").build());
        sections.set(1, Section.builder().name("Page Header").role(SectionRole.PAGE_HEADER).height(360)
                .suppress(true).build());

        LayoutResult result = synthesize(sections, twoGroups());

        Frame regionHeader = result.getBodyFrame().getChildren().get(0).getChildren().get(0);
        assertEquals("FT_SUPPRESS_COND_M_G_REGION_HDR_1", regionHeader.getFormatTrigger());
        assertEquals(1, result.getTriggers().size());
        assertEquals("M_G_REGION_HDR", result.getTriggers().get(0).getOwner());
        assertFalse(result.getHeaderFrame().getChildren().get(0).isVisible());
    }

    @Test
    public void testSynthesize_TriggerRefusedUnderFailPolicy() {
        properties.setOnUnsupportedFormula(ConversionProperties.UnsupportedPolicy.FAIL);
        List<Section> sections = new ArrayList<>(fullReport());
        sections.set(4, Section.builder().name("Details").height(240).suppressCondition("Frobnicate({a})").build());

        LayoutResult result = synthesize(sections, twoGroups());

        assertEquals(Collections.singletonList("R_G_DETAIL"), result.getFailedTriggers());
        assertTrue(result.getTriggers().isEmpty());
        Frame detail = result.getMarginFrame().collect(f -> "R_G_DETAIL".equals(f.getName())).get(0);
        assertNull(detail.getFormatTrigger());
        assertTrue(result.getWarnings().get(0).startsWith("Trigger for R_G_DETAIL not generated"));
    }

    @Test
    public void testSynthesize_SkippedSectionTriggerNotAttached() {
        properties.setOnUnsupportedFormula(ConversionProperties.UnsupportedPolicy.SKIP);
        List<Section> sections = new ArrayList<>(fullReport());
        sections.set(4, Section.builder().name("Details").height(240).suppressCondition("Left({a}, 5").build());

        LayoutResult result = synthesize(sections, twoGroups());

        assertEquals(Collections.singletonList("R_G_DETAIL"), result.getFailedTriggers());
        assertTrue(result.getTriggers().isEmpty());
        Frame detail = result.getMarginFrame().collect(f -> "R_G_DETAIL".equals(f.getName())).get(0);
        assertNull(detail.getFormatTrigger());
        assertTrue(result.getWarnings().get(0).startsWith("Trigger for R_G_DETAIL not generated: Skipped"));
    }

    @Test
    public void testSynthesize_DuplicateFrameNamesSuffixed() {
        List<Section> sections = Arrays.asList(
                section("PHa", SectionRole.PAGE_HEADER, 200),
                section("PHb", SectionRole.PAGE_HEADER, 200),
                section("Details", null, 240));

        LayoutResult result = synthesize(sections, Collections.emptyList());

        assertEquals(Arrays.asList("M_PAGE_HEADER_SECTION", "M_PAGE_HEADER_SECTION_2"),
                names(result.getHeaderFrame().getChildren()));
    }

    @Test
    public void testSynthesize_OverflowWarns() {
        LayoutResult result = synthesizer.synthesize(fullReport(), twoGroups(), PAGE_WIDTH, 144,
                triggerTranslator, new TriggerNameSequence());

        assertTrue(result.getWarnings().stream().anyMatch(w -> w.contains("does not fit")));
    }

    private static List<String> names(List<Frame> frames) {
        List<String> names = new ArrayList<>();
        for (Frame frame : frames) {
            names.add(frame.getName());
        }
        return names;
    }
}
