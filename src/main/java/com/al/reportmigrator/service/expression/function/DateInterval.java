package com.al.reportmigrator.service.expression.function;

import lombok.Getter;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Interval codes accepted by DatePart, DateAdd and DateDiff.
 * <p>
 * Placeholders: DatePart {0}=date; DateAdd {0}=count, {1}=date; DateDiff
 * {0}=start, {1}=end. Intervals flagged approximate do not reproduce the
 * source calendar rules exactly (week numbering, day-of-year counting).
 */
@Getter
public enum DateInterval {

    YEAR(false,
            "EXTRACT(YEAR FROM {0})",
            "ADD_MONTHS({1}, 12 * ({0}))",
            "TRUNC(MONTHS_BETWEEN({1}, {0}) / 12)",
            "yyyy", "year"),
    QUARTER(false,
            "TO_CHAR({0}, 'Q')",
            "ADD_MONTHS({1}, 3 * ({0}))",
            "TRUNC(MONTHS_BETWEEN({1}, {0}) / 3)",
            "q", "quarter"),
    MONTH(false,
            "EXTRACT(MONTH FROM {0})",
            "ADD_MONTHS({1}, {0})",
            "TRUNC(MONTHS_BETWEEN({1}, {0}))",
            "m", "month"),
    DAY_OF_YEAR(true,
            "TO_CHAR({0}, 'DDD')",
            "({1} + ({0}))",
            "(TRUNC({1}) - TRUNC({0}))",
            "y", "dayofyear"),
    DAY(false,
            "EXTRACT(DAY FROM {0})",
            "({1} + ({0}))",
            "(TRUNC({1}) - TRUNC({0}))",
            "d", "day"),
    WEEK(true,
            "TO_CHAR({0}, 'IW')",
            "({1} + 7 * ({0}))",
            "TRUNC((TRUNC({1}) - TRUNC({0})) / 7)",
            "w", "ww", "week"),
    WEEKDAY(false,
            "TO_CHAR({0}, 'D')",
            "({1} + ({0}))",
            "(TRUNC({1}) - TRUNC({0}))",
            "weekday"),
    HOUR(false,
            "EXTRACT(HOUR FROM CAST({0} AS TIMESTAMP))",
            "({1} + ({0}) / 24)",
            "ROUND(({1} - {0}) * 24)",
            "h", "hour"),
    MINUTE(false,
            "EXTRACT(MINUTE FROM CAST({0} AS TIMESTAMP))",
            "({1} + ({0}) / 1440)",
            "ROUND(({1} - {0}) * 1440)",
            "n", "minute"),
    SECOND(false,
            "EXTRACT(SECOND FROM CAST({0} AS TIMESTAMP))",
            "({1} + ({0}) / 86400)",
            "ROUND(({1} - {0}) * 86400)",
            "s", "second");

    private static final Map<String, DateInterval> BY_CODE;

    static {
        Map<String, DateInterval> codes = new HashMap<>();
        for (DateInterval interval : values()) {
            interval.codes.forEach(code -> codes.put(code, interval));
        }
        BY_CODE = Collections.unmodifiableMap(codes);
    }

    private final boolean approximate;
    private final String datePartTemplate;
    private final String dateAddTemplate;
    private final String dateDiffTemplate;
    private final List<String> codes;

    DateInterval(boolean approximate, String datePartTemplate, String dateAddTemplate,
                 String dateDiffTemplate, String... codes) {
        this.approximate = approximate;
        this.datePartTemplate = datePartTemplate;
        this.dateAddTemplate = dateAddTemplate;
        this.dateDiffTemplate = dateDiffTemplate;
        this.codes = List.of(codes);
    }

    /**
     * Lookup by interval code; quotes around the code and letter case are
     * ignored.
     */
    public static Optional<DateInterval> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim();
        if (normalized.length() >= 2 && (normalized.charAt(0) == '\'' || normalized.charAt(0) == '"')) {
            normalized = normalized.substring(1, normalized.length() - 1);
        }
        return Optional.ofNullable(BY_CODE.get(normalized.trim().toLowerCase(Locale.ROOT)));
    }
}
