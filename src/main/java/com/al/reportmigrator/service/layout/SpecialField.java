package com.al.reportmigrator.service.layout;

import lombok.Getter;

import java.util.Locale;
import java.util.Optional;

/**
 * Built-in source fields that map onto target system variables.
 */
@Getter
public enum SpecialField {

    PAGE_NUMBER("&Physical Page Number", false),
    TOTAL_PAGE_COUNT("&Total Physical Pages", false),
    // "Page N of M" needs two variables in boilerplate text
    PAGE_N_OF_M("&Physical Page Number", true),
    PRINT_DATE("&Current Date", false),
    PRINT_TIME("&Current Date", false),
    DATA_DATE("&Current Date", true);

    private final String systemVariable;
    private final boolean approximate;

    SpecialField(String systemVariable, boolean approximate) {
        this.systemVariable = systemVariable;
        this.approximate = approximate;
    }

    /**
     * Lookup ignoring braces, spaces, underscores and case, so "PageNumber",
     * "{Page Number}" and "page_number" all match.
     */
    public static Optional<SpecialField> fromSource(String source) {
        if (source == null) {
            return Optional.empty();
        }
        String key = source.toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
        for (SpecialField field : values()) {
            if (field.name().toLowerCase(Locale.ROOT).replace("_", "").equals(key)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
