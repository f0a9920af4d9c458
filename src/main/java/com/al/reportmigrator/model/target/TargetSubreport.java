package com.al.reportmigrator.model.target;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Subreport placeholder, to be realised as a child query or a separate
 * report run with the linked parameters.
 */
@Value
@Builder
public class TargetSubreport {

    String sourceName;

    String name;

    String filePath;

    double x;

    double y;

    double width;

    double height;

    @Singular
    List<ParameterLink> parameterLinks;

    /**
     * Name of the suppress trigger, null when none was attached.
     */
    String suppressTrigger;

    boolean onDemand;

    @Singular
    List<String> warnings;

    @Value
    public static class ParameterLink {

        /**
         * Bound column in the parent report.
         */
        String parentColumn;

        /**
         * Parameter of the subreport receiving the value.
         */
        String parameter;
    }
}
