package com.al.reportmigrator.service.layout;

import com.al.reportmigrator.config.ConversionProperties;
import com.al.reportmigrator.model.ConditionalFormat;
import com.al.reportmigrator.model.Field;
import com.al.reportmigrator.model.FormatSpec;
import com.al.reportmigrator.model.enums.Elasticity;
import com.al.reportmigrator.model.enums.SourceKind;
import com.al.reportmigrator.model.target.OutputField;
import com.al.reportmigrator.model.target.Trigger;
import com.al.reportmigrator.service.mapping.FontMapper;
import com.al.reportmigrator.service.mapping.TypeMapper;
import com.al.reportmigrator.util.TargetNames;
import com.al.reportmigrator.util.UnitConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps one source field to an output field: geometry, data source, font,
 * alignment, mask, and the format triggers for its suppress and
 * conditional-format rules.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutputFieldMapper {

    private static final Map<String, String> HORIZONTAL_ALIGNMENT = Map.of(
            "left", "start",
            "center", "center",
            "right", "end",
            "justify", "flush",
            "justified", "flush");

    private static final Map<String, String> VERTICAL_ALIGNMENT = Map.of(
            "top", "top",
            "middle", "center",
            "center", "center",
            "bottom", "bottom");

    private final ConversionProperties properties;
    private final FontMapper fontMapper;
    private final TypeMapper typeMapper;

    OutputField map(Field field, SynthesisRun run) {
        String sourceName = field.getName() == null ? "" : field.getName();
        String name = run.getFieldNames().register(fieldName(sourceName));
        FormatSpec format = field.getFormat() == null ? new FormatSpec() : field.getFormat();
        SourceKind kind = resolveKind(field);
        String source = resolveSource(kind, field.getSource(), run, name);
        FontMapper.MappedFont font = fontMapper.map(field.getFont());

        OutputField.OutputFieldBuilder builder = OutputField.builder()
                .name(name)
                .sourceName(sourceName)
                .sourceKind(kind)
                .source(source)
                .x(toTarget(field.getX()))
                .y(toTarget(field.getY()))
                .width(toTarget(field.getWidth()))
                .height(toTarget(field.getHeight()))
                .fontFamily(font.getFamily())
                .fontSize(font.getSize())
                .fontStyle(font.getStyle())
                .underline(font.isUnderline())
                .horizontalAlignment(align(HORIZONTAL_ALIGNMENT, format.getHorizontalAlignment(), "start"))
                .verticalAlignment(align(VERTICAL_ALIGNMENT, format.getVerticalAlignment(), "top"))
                .foregroundColor(firstNonBlank(format.getForegroundColor(),
                        field.getFont() == null ? null : field.getFont().getColor(), "black"))
                .backgroundColor(firstNonBlank(format.getBackgroundColor(), null, "white"))
                .verticalElasticity(format.isCanGrow() ? Elasticity.EXPAND : Elasticity.FIXED);

        String mask = format.getFormatMask();
        if (mask != null && !mask.isBlank()) {
            Optional<String> mapped = typeMapper.mapFormatMask(mask);
            if (mapped.isPresent()) {
                builder.formatMask(mapped.get());
            } else {
                run.warn("Field " + name + ": format mask '" + mask + "' has no target equivalent and was dropped");
            }
        }

        attachTriggers(field, format, kind, source, name, builder, run);
        return builder.build();
    }

    private void attachTriggers(Field field, FormatSpec format, SourceKind kind, String source, String name,
                                OutputField.OutputFieldBuilder builder, SynthesisRun run) {
        String attached = null;
        String condition = field.getSuppressCondition();
        if (condition != null && !condition.isBlank()) {
            Optional<Trigger> trigger = run.attempt(name, () -> Optional.of(
                    run.getTriggerTranslator().suppressTrigger(condition, name, run.getSequence())));
            if (trigger.isPresent()) {
                attached = trigger.get().getName();
                builder.visible(false);
            }
        }

        Optional<Trigger> flags = run.attempt(name, () -> run.getTriggerTranslator().suppressFlagsTrigger(
                boundName(kind, source, name), format.isSuppressIfZero(), format.isSuppressIfBlank(), name,
                run.getSequence()));
        if (flags.isPresent()) {
            if (attached == null) {
                attached = flags.get().getName();
            } else {
                run.warn("Field " + name + " has both a suppress condition and suppress flags; "
                        + flags.get().getName() + " must be merged into " + attached + " manually");
            }
        }

        List<ConditionalFormat> rules = field.getConditionalFormats() == null
                ? List.of() : field.getConditionalFormats();
        for (ConditionalFormat rule : rules) {
            if (rule.getCondition() == null || rule.getCondition().isBlank()) {
                continue;
            }
            Optional<Trigger> trigger = run.attempt(name, () -> Optional.of(
                    run.getTriggerTranslator().conditionalFormatTrigger(rule.getCondition(),
                            rule.getProperty(), rule.getValue(), name, run.getSequence())));
            if (trigger.isEmpty()) {
                continue;
            }
            if (attached == null) {
                attached = trigger.get().getName();
            } else {
                run.warn("Field " + name + " already has format trigger " + attached + "; "
                        + trigger.get().getName() + " was generated but not attached");
            }
        }
        builder.formatTrigger(attached);
    }

    private String fieldName(String sourceName) {
        String prefix = properties.getFieldPrefix().toUpperCase(Locale.ROOT);
        String sanitized = TargetNames.sanitize(TargetNames.stripBraces(sourceName));
        if (sanitized.isEmpty()) {
            sanitized = "FIELD";
        }
        return sanitized.startsWith(prefix) ? sanitized : prefix + sanitized;
    }

    private static SourceKind resolveKind(Field field) {
        if (field.getSourceKind() != null) {
            return field.getSourceKind();
        }
        String source = TargetNames.stripBraces(field.getSource() == null ? "" : field.getSource().trim());
        if (source.startsWith("@")) {
            return SourceKind.FORMULA;
        }
        if (source.startsWith("?")) {
            return SourceKind.PARAMETER;
        }
        if (source.isEmpty()) {
            return SourceKind.LITERAL;
        }
        return SpecialField.fromSource(source).isPresent() ? SourceKind.SPECIAL : SourceKind.COLUMN;
    }

    private String resolveSource(SourceKind kind, String rawSource, SynthesisRun run, String fieldName) {
        String raw = rawSource == null ? "" : rawSource.trim();
        switch (kind) {
            case FORMULA:
                return run.getBindings().formulaName(raw)
                        .orElseGet(() -> TargetNames.formulaName(properties.getFormulaPrefix(), raw));
            case PARAMETER:
                return TargetNames.parameterName(properties.getParameterPrefix(), raw);
            case SPECIAL:
                Optional<SpecialField> special = SpecialField.fromSource(raw);
                if (special.isEmpty()) {
                    run.warn("Field " + fieldName + ": special field '" + raw + "' has no target equivalent");
                    return raw;
                }
                if (special.get().isApproximate()) {
                    run.warn("Field " + fieldName + ": special field '" + raw + "' approximated by "
                            + special.get().getSystemVariable());
                }
                return special.get().getSystemVariable();
            case LITERAL:
                return raw;
            case COLUMN:
            default:
                return TargetNames.columnName(raw);
        }
    }

    /**
     * Name the field's value is bound to inside a trigger body.
     */
    private static String boundName(SourceKind kind, String source, String fieldName) {
        if (kind == SourceKind.COLUMN || kind == SourceKind.FORMULA || kind == SourceKind.PARAMETER) {
            return source;
        }
        return fieldName;
    }

    private double toTarget(double twips) {
        return UnitConverter.fromTwips(twips, properties.getCoordinateUnit());
    }

    private static String align(Map<String, String> table, String value, String fallback) {
        if (value == null) {
            return fallback;
        }
        return table.getOrDefault(value.trim().toLowerCase(Locale.ROOT), fallback);
    }

    private static String firstNonBlank(String first, String second, String fallback) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        if (second != null && !second.isBlank()) {
            return second;
        }
        return fallback;
    }
}
