package com.al.reportmigrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Page geometry defaults for layout synthesis.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "report-migrator.layout")
public class LayoutProperties {

    /**
     * Margin on every side of the page, in inches.
     */
    private double marginInches = 0.5;

    /**
     * Page width in twips used when a report does not declare one (US Letter).
     */
    private double defaultPageWidthTwips = 12240;

    /**
     * Page height in twips used when a report does not declare one (US Letter).
     */
    private double defaultPageHeightTwips = 15840;
}
