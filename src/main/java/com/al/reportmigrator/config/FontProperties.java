package com.al.reportmigrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Font defaults and user supplied font family overrides.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "report-migrator.fonts")
public class FontProperties {

    private String defaultFamily = "Arial";

    private double defaultSize = 10;

    /**
     * Source family to target family, consulted before the built-in table.
     */
    private Map<String, String> mappings = new LinkedHashMap<>();
}
