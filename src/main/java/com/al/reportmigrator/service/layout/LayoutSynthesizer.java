package com.al.reportmigrator.service.layout;

import com.al.reportmigrator.config.ConversionProperties;
import com.al.reportmigrator.config.LayoutProperties;
import com.al.reportmigrator.model.Field;
import com.al.reportmigrator.model.Group;
import com.al.reportmigrator.model.Section;
import com.al.reportmigrator.model.enums.Elasticity;
import com.al.reportmigrator.model.enums.FrameKind;
import com.al.reportmigrator.model.enums.LinearUnit;
import com.al.reportmigrator.model.enums.SectionRole;
import com.al.reportmigrator.model.target.Frame;
import com.al.reportmigrator.model.target.LayoutResult;
import com.al.reportmigrator.model.target.OutputField;
import com.al.reportmigrator.service.expression.FormatTriggerTranslator;
import com.al.reportmigrator.service.expression.TriggerNameSequence;
import com.al.reportmigrator.util.TargetNames;
import com.al.reportmigrator.util.UnitConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the flat section list and the ordered group list of a report into a
 * nested frame tree.
 * <p>
 * The group list alone defines nesting: group 0 is the outermost repeating
 * frame, each group's repeating frame holds its header sections, the next
 * level, then its footer sections, and the detail repeating frame is always
 * the innermost one. All coordinates are in the configured target unit and
 * relative to the parent frame.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LayoutSynthesizer {

    private static final Pattern DIGITS = Pattern.compile("(\\d+)");

    private final ConversionProperties properties;
    private final LayoutProperties layoutProperties;
    private final OutputFieldMapper fieldMapper;

    public LayoutResult synthesize(List<Section> sections, List<Group> groups, double pageWidth, double pageHeight,
                                   FormatTriggerTranslator triggerTranslator, TriggerNameSequence sequence) {
        return synthesize(sections, groups, pageWidth, pageHeight, triggerTranslator, sequence,
                SourceBindings.empty());
    }

    /**
     * Build the frame tree.
     *
     * @param sections          all report sections in source order
     * @param groups            grouping rules, outermost first
     * @param pageWidth         page width in target units
     * @param pageHeight        page height in target units
     * @param triggerTranslator builds triggers for suppress and format rules
     * @param sequence          trigger numbering for this report
     * @param bindings          target names already chosen for formulas
     */
    public LayoutResult synthesize(List<Section> sections, List<Group> groups, double pageWidth, double pageHeight,
                                   FormatTriggerTranslator triggerTranslator, TriggerNameSequence sequence,
                                   SourceBindings bindings) {
        List<Section> allSections = sections == null ? List.of() : sections;
        List<Group> allGroups = groups == null ? List.of() : groups;
        log.info("Synthesizing layout: {} sections, {} groups", allSections.size(), allGroups.size());

        SynthesisRun run = new SynthesisRun(triggerTranslator, sequence, bindings);
        Map<SectionRole, List<Section>> byRole = partition(allSections);

        LinearUnit unit = properties.getCoordinateUnit();
        double margin = UnitConverter.convert(layoutProperties.getMarginInches(), LinearUnit.INCHES, unit);
        double contentWidth = Math.max(0, pageWidth - 2 * margin);
        double contentHeight = Math.max(0, pageHeight - 2 * margin);

        String marginName = run.getFrameNames().register("M_MAIN");
        Frame.FrameBuilder marginFrame = Frame.builder()
                .name(marginName)
                .kind(FrameKind.MARGIN)
                .x(margin)
                .y(margin)
                .width(contentWidth)
                .height(contentHeight);

        double y = 0;
        for (Section section : byRole.get(SectionRole.REPORT_HEADER)) {
            Frame frame = sectionFrame(section, "M_REPORT_HEADER", FrameKind.MARGIN, contentWidth, run)
                    .y(y)
                    .build();
            marginFrame.child(frame);
            y += frame.getHeight();
        }

        Frame headerFrame = null;
        List<Section> pageHeaders = byRole.get(SectionRole.PAGE_HEADER);
        if (!pageHeaders.isEmpty()) {
            headerFrame = stack("M_PAGE_HEADER", FrameKind.HEADER, "M_PAGE_HEADER_SECTION", pageHeaders,
                    contentWidth, run).y(y).build();
            marginFrame.child(headerFrame);
            y += headerFrame.getHeight();
        }

        BodyPlan plan = planBody(byRole, allGroups);
        Frame top = level(0, plan, allGroups, contentWidth, run);
        Frame bodyFrame = Frame.builder()
                .name(run.getFrameNames().register("M_BODY"))
                .kind(FrameKind.BODY)
                .x(0)
                .y(y)
                .width(contentWidth)
                .height(top.getHeight())
                .verticalElasticity(Elasticity.VARIABLE)
                .child(top)
                .build();
        marginFrame.child(bodyFrame);
        y += bodyFrame.getHeight();

        for (Section section : byRole.get(SectionRole.REPORT_FOOTER)) {
            Frame frame = sectionFrame(section, "M_REPORT_FOOTER", FrameKind.MARGIN, contentWidth, run)
                    .y(y)
                    .build();
            marginFrame.child(frame);
            y += frame.getHeight();
        }

        Frame trailerFrame = null;
        double bottom = contentHeight;
        List<Section> pageFooters = byRole.get(SectionRole.PAGE_FOOTER);
        if (!pageFooters.isEmpty()) {
            Frame.FrameBuilder trailer = stack("M_PAGE_FOOTER", FrameKind.TRAILER, "M_PAGE_FOOTER_SECTION",
                    pageFooters, contentWidth, run);
            double trailerHeight = trailer.build().getHeight();
            bottom = contentHeight - trailerHeight;
            trailerFrame = trailer.y(bottom).build();
            marginFrame.child(trailerFrame);
        }

        if (y > bottom) {
            String unitName = unit.name().toLowerCase(Locale.ROOT);
            run.warn(String.format(Locale.ROOT, "Layout content (%.2f %s) does not fit the printable height (%.2f %s)",
                    y, unitName, bottom, unitName));
        }

        LayoutResult result = LayoutResult.builder()
                .pageWidth(pageWidth)
                .pageHeight(pageHeight)
                .margin(margin)
                .marginFrame(marginFrame.build())
                .headerFrame(headerFrame)
                .bodyFrame(bodyFrame)
                .trailerFrame(trailerFrame)
                .triggers(run.getTriggers())
                .warnings(run.getWarnings())
                .failedTriggers(run.getFailedTriggers())
                .build();
        log.info("Layout synthesized: {} triggers, {} warnings", result.getTriggers().size(),
                result.getWarnings().size());
        return result;
    }

    private Map<SectionRole, List<Section>> partition(List<Section> sections) {
        Map<SectionRole, List<Section>> byRole = new EnumMap<>(SectionRole.class);
        for (SectionRole role : SectionRole.values()) {
            byRole.put(role, new ArrayList<>());
        }
        for (Section section : sections) {
            byRole.get(section.resolveRole()).add(section);
        }
        return byRole;
    }

    /**
     * Group bands keyed by their 1-based group index. Bands whose index
     * cannot be determined or has no matching group are left out.
     */
    private BodyPlan planBody(Map<SectionRole, List<Section>> byRole, List<Group> groups) {
        BodyPlan plan = new BodyPlan(byRole.get(SectionRole.DETAIL));
        for (SectionRole role : List.of(SectionRole.GROUP_HEADER, SectionRole.GROUP_FOOTER)) {
            Map<Integer, List<Section>> target = role == SectionRole.GROUP_HEADER ? plan.headers : plan.footers;
            for (Section section : byRole.get(role)) {
                Integer index = groupIndex(section);
                if (index == null || index < 1 || index > groups.size()) {
                    log.debug("Section '{}' has no matching group (index {}); level omitted", section.getName(), index);
                    continue;
                }
                target.computeIfAbsent(index, k -> new ArrayList<>()).add(section);
            }
        }
        return plan;
    }

    private static Integer groupIndex(Section section) {
        if (section.getGroupIndex() != null) {
            return section.getGroupIndex();
        }
        if (section.getName() == null) {
            return null;
        }
        Matcher matcher = DIGITS.matcher(section.getName());
        return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
    }

    /**
     * Repeating frame for group {@code index}, or the detail frame once every
     * group has been nested. Returned with y = 0; the caller positions it.
     */
    private Frame level(int index, BodyPlan plan, List<Group> groups, double width, SynthesisRun run) {
        if (index >= groups.size()) {
            return detailFrame(plan.details, width, run);
        }
        Group group = groups.get(index);
        String groupName = group.getName() == null || group.getName().isBlank()
                ? "G" + (index + 1)
                : TargetNames.sanitize(group.getName());

        Frame.FrameBuilder frame = Frame.builder()
                .name(run.getFrameNames().register("R_G_" + groupName))
                .kind(FrameKind.REPEATING)
                .sourceGroup(group.getName())
                .x(0)
                .width(width)
                .verticalElasticity(Elasticity.EXPAND)
                .pageProtect(group.isKeepTogether());

        double innerY = 0;
        for (Section header : plan.headers.getOrDefault(index + 1, List.of())) {
            Frame child = sectionFrame(header, "M_G_" + groupName + "_HDR", FrameKind.HEADER, width, run)
                    .y(innerY)
                    .build();
            frame.child(child);
            innerY += child.getHeight();
        }
        Frame nested = level(index + 1, plan, groups, width, run).toBuilder().y(innerY).build();
        frame.child(nested);
        innerY += nested.getHeight();
        for (Section footer : plan.footers.getOrDefault(index + 1, List.of())) {
            Frame child = sectionFrame(footer, "M_G_" + groupName + "_FTR", FrameKind.TRAILER, width, run)
                    .y(innerY)
                    .build();
            frame.child(child);
            innerY += child.getHeight();
        }
        return frame.height(innerY).build();
    }

    private Frame detailFrame(List<Section> details, double width, SynthesisRun run) {
        if (details.isEmpty()) {
            run.warn("Report has no detail section; an empty detail frame was generated");
            return Frame.builder()
                    .name(run.getFrameNames().register("R_G_DETAIL"))
                    .kind(FrameKind.REPEATING)
                    .sourceGroup(Frame.DETAIL_GROUP)
                    .width(width)
                    .verticalElasticity(Elasticity.EXPAND)
                    .build();
        }
        Section first = details.get(0);
        Frame.FrameBuilder frame = sectionFrame(first, "R_G_DETAIL", FrameKind.REPEATING, width, run)
                .sourceGroup(Frame.DETAIL_GROUP)
                .verticalElasticity(Elasticity.EXPAND);
        double height = UnitConverter.fromTwips(first.getHeight(), properties.getCoordinateUnit());
        for (Section extra : details.subList(1, details.size())) {
            run.warn("Detail section '" + extra.getName() + "' merged into the detail frame"
                    + (extra.isSuppress() || extra.getSuppressCondition() != null
                    ? "; its suppression settings were not carried over" : ""));
            for (Field field : extra.getFields()) {
                OutputField mapped = fieldMapper.map(field, run);
                frame.field(mapped.toBuilder().y(mapped.getY() + height).build());
            }
            height += UnitConverter.fromTwips(extra.getHeight(), properties.getCoordinateUnit());
        }
        return frame.height(height).build();
    }

    /**
     * Container frame holding one child frame per section, stacked in order.
     */
    private Frame.FrameBuilder stack(String name, FrameKind kind, String childBase, List<Section> sections,
                                     double width, SynthesisRun run) {
        Frame.FrameBuilder container = Frame.builder()
                .name(run.getFrameNames().register(name))
                .kind(kind)
                .x(0)
                .width(width);
        double y = 0;
        for (Section section : sections) {
            Frame child = sectionFrame(section, childBase, kind, width, run).y(y).build();
            container.child(child);
            y += child.getHeight();
        }
        return container.height(y);
    }

    private Frame.FrameBuilder sectionFrame(Section section, String baseName, FrameKind kind, double width,
                                            SynthesisRun run) {
        String name = run.getFrameNames().register(baseName);
        Frame.FrameBuilder frame = Frame.builder()
                .name(name)
                .kind(kind)
                .sourceSection(section.getName())
                .x(0)
                .width(width)
                .height(UnitConverter.fromTwips(section.getHeight(), properties.getCoordinateUnit()))
                .visible(!section.isSuppress());
        for (Field field : section.getFields()) {
            frame.field(fieldMapper.map(field, run));
        }
        String condition = section.getSuppressCondition();
        if (condition != null && !condition.isBlank()) {
            run.attempt(name, () -> Optional.of(
                            run.getTriggerTranslator().suppressTrigger(condition, name, run.getSequence())))
                    .ifPresent(trigger -> frame.formatTrigger(trigger.getName()));
        }
        return frame;
    }

    private static final class BodyPlan {
        private final List<Section> details;
        private final Map<Integer, List<Section>> headers = new TreeMap<>();
        private final Map<Integer, List<Section>> footers = new TreeMap<>();

        private BodyPlan(List<Section> details) {
            this.details = details;
        }
    }
}
