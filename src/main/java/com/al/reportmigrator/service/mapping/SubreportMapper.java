package com.al.reportmigrator.service.mapping;

import com.al.reportmigrator.config.ConversionProperties;
import com.al.reportmigrator.exception.UnsupportedExpressionException;
import com.al.reportmigrator.model.SubreportLink;
import com.al.reportmigrator.model.SubreportReference;
import com.al.reportmigrator.model.target.TargetSubreport;
import com.al.reportmigrator.model.target.Trigger;
import com.al.reportmigrator.service.expression.FormatTriggerTranslator;
import com.al.reportmigrator.service.expression.TriggerNameSequence;
import com.al.reportmigrator.util.TargetNames;
import com.al.reportmigrator.util.UnitConverter;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps embedded subreports onto placeholders carrying their parameter links
 * and suppress trigger.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubreportMapper {

    static final String PREFIX = "SR_";

    private final ConversionProperties properties;
    private final FormatTriggerTranslator triggerTranslator;

    /**
     * A subreport with its suppress trigger. The trigger is null when the
     * subreport has no suppress condition or when the condition could not be
     * translated; {@code triggerFailed} tells the two apart.
     */
    @Value
    public static class Mapped {
        TargetSubreport subreport;
        Trigger trigger;
        boolean triggerFailed;
    }

    public Mapped map(SubreportReference reference, TriggerNameSequence sequence) {
        if (reference.getName() == null || reference.getName().isBlank()) {
            throw new IllegalArgumentException("Subreport without a name");
        }
        String name = TargetNames.objectName(PREFIX, reference.getName());
        TargetSubreport.TargetSubreportBuilder builder = TargetSubreport.builder()
                .sourceName(reference.getName())
                .name(name)
                .filePath(reference.getFilePath())
                .x(convert(reference.getX()))
                .y(convert(reference.getY()))
                .width(convert(reference.getWidth()))
                .height(convert(reference.getHeight()))
                .onDemand(reference.isOnDemand());

        if (reference.getLinks() != null) {
            for (SubreportLink link : reference.getLinks()) {
                if (isBlank(link.getParentField()) || isBlank(link.getSubreportParameter())) {
                    builder.warning("Incomplete parameter link ignored");
                    continue;
                }
                builder.parameterLink(new TargetSubreport.ParameterLink(
                        TargetNames.columnName(link.getParentField()),
                        TargetNames.parameterName(properties.getParameterPrefix(), link.getSubreportParameter())));
            }
        }
        if (reference.isOnDemand()) {
            builder.warning("Subreport '" + reference.getName()
                    + "' is shown on demand; run it as a separate report");
        }

        Trigger trigger = null;
        boolean triggerFailed = false;
        if (!isBlank(reference.getSuppressCondition())) {
            try {
                Trigger candidate = triggerTranslator.suppressTrigger(reference.getSuppressCondition(), name, sequence);
                if (candidate.isSuccess()) {
                    trigger = candidate;
                    builder.suppressTrigger(candidate.getName());
                } else {
                    triggerFailed = true;
                    builder.warning("Suppress condition not converted: " + String.join("; ", candidate.getWarnings()));
                }
            } catch (UnsupportedExpressionException e) {
                triggerFailed = true;
                builder.warning("Suppress condition not converted: " + e.getMessage());
            }
        }
        log.debug("Mapped subreport '{}' to {}", reference.getName(), name);
        return new Mapped(builder.build(), trigger, triggerFailed);
    }

    private double convert(double twips) {
        return UnitConverter.fromTwips(twips, properties.getCoordinateUnit());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
