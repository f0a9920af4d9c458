package com.al.reportmigrator.config;

import com.al.reportmigrator.model.enums.LinearUnit;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Naming, unit and failure-policy settings for report conversion.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "report-migrator.conversion")
public class ConversionProperties {

    /**
     * Prefix for generated formula functions.
     */
    private String formulaPrefix = "CF_";

    /**
     * Prefix for user parameters and their bind variables.
     */
    private String parameterPrefix = "P_";

    /**
     * Prefix for layout field names.
     */
    private String fieldPrefix = "F_";

    /**
     * Prefix for generated format triggers.
     */
    private String triggerPrefix = "FT_";

    /**
     * Unit of every coordinate and size in the generated layout.
     */
    private LinearUnit coordinateUnit = LinearUnit.POINTS;

    /**
     * What to do with a formula that cannot be translated.
     * PLACEHOLDER: emit a stub function documenting the original text
     * SKIP: emit nothing and count the formula as failed
     * FAIL: raise an error for that formula
     */
    private UnsupportedPolicy onUnsupportedFormula = UnsupportedPolicy.PLACEHOLDER;

    /**
     * Upper bound on conditional flattening rounds per expression.
     */
    private int maxConditionalDepth = 20;

    public enum UnsupportedPolicy {
        PLACEHOLDER,
        SKIP,
        FAIL
    }

    public boolean isFailHard() {
        return onUnsupportedFormula == UnsupportedPolicy.FAIL;
    }
}
