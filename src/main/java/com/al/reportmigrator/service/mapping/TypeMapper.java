package com.al.reportmigrator.service.mapping;

import com.al.reportmigrator.model.enums.ValueType;
import com.al.reportmigrator.model.target.TargetType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps source value types to target type declarations and source display
 * masks to target format masks.
 */
@Slf4j
@Component
public class TypeMapper {

    private static final Map<ValueType, TargetType> DEFAULT_TYPES;

    private static final Map<String, String> FORMAT_MASKS;

    static {
        Map<ValueType, TargetType> types = new EnumMap<>(ValueType.class);
        types.put(ValueType.STRING, TargetType.builder().name("VARCHAR2").length(4000).build());
        types.put(ValueType.NUMBER, TargetType.builder().name("NUMBER").build());
        types.put(ValueType.CURRENCY, TargetType.builder().name("NUMBER").precision(15).scale(2).build());
        types.put(ValueType.DATE, TargetType.builder().name("DATE").build());
        // no separate time type on the target side
        types.put(ValueType.TIME, TargetType.builder().name("DATE").build());
        types.put(ValueType.DATETIME, TargetType.builder().name("TIMESTAMP").build());
        // stored as 'Y' / 'N'
        types.put(ValueType.BOOLEAN, TargetType.builder().name("VARCHAR2").length(1).build());
        types.put(ValueType.MEMO, TargetType.builder().name("CLOB").build());
        types.put(ValueType.BLOB, TargetType.builder().name("BLOB").build());
        types.put(ValueType.UNKNOWN, TargetType.builder().name("VARCHAR2").length(4000).build());
        DEFAULT_TYPES = Collections.unmodifiableMap(types);

        Map<String, String> masks = new LinkedHashMap<>();
        // numbers
        masks.put("#,##0", "999,999,999,990");
        masks.put("#,##0.00", "999,999,999,990.00");
        masks.put("0.00", "990.00");
        masks.put("0", "990");
        masks.put("#,##0.00;(#,##0.00)", "999,999,999,990.00PR");
        masks.put("0%", "990%");
        masks.put("0.00%", "990.00%");
        // currency
        masks.put("$#,##0", "$999,999,999,990");
        masks.put("$#,##0.00", "$999,999,999,990.00");
        masks.put("$#,##0.00;($#,##0.00)", "$999,999,999,990.00PR");
        // dates
        masks.put("MM/dd/yyyy", "MM/DD/YYYY");
        masks.put("dd/MM/yyyy", "DD/MM/YYYY");
        masks.put("yyyy-MM-dd", "YYYY-MM-DD");
        masks.put("MMMM d, yyyy", "MONTH DD, YYYY");
        masks.put("MMM d, yyyy", "MON DD, YYYY");
        masks.put("M/d/yy", "MM/DD/YY");
        // times
        masks.put("h:mm:ss tt", "HH:MI:SS AM");
        masks.put("HH:mm:ss", "HH24:MI:SS");
        masks.put("h:mm tt", "HH:MI AM");
        masks.put("HH:mm", "HH24:MI");
        // date and time
        masks.put("MM/dd/yyyy h:mm:ss tt", "MM/DD/YYYY HH:MI:SS AM");
        masks.put("yyyy-MM-dd HH:mm:ss", "YYYY-MM-DD HH24:MI:SS");
        FORMAT_MASKS = Collections.unmodifiableMap(masks);
    }

    /**
     * Default declaration for a value type.
     */
    public TargetType mapType(ValueType kind) {
        return DEFAULT_TYPES.getOrDefault(kind == null ? ValueType.UNKNOWN : kind,
                DEFAULT_TYPES.get(ValueType.UNKNOWN));
    }

    /**
     * Declaration for a value type with optional size overrides. Each
     * override replaces only the default attribute it names; attributes not
     * overridden keep their defaults. Lengths apply to character types,
     * precision and scale to numeric types.
     *
     * @param kind      source value type, null treated as unknown
     * @param length    character length override
     * @param precision numeric precision override
     * @param scale     numeric scale override
     */
    public TargetType mapType(ValueType kind, Integer length, Integer precision, Integer scale) {
        TargetType base = mapType(kind);
        if (length == null && precision == null && scale == null) {
            return base;
        }
        boolean numeric = "NUMBER".equals(base.getName());
        boolean sized = "VARCHAR2".equals(base.getName());
        if (!numeric && !sized) {
            log.debug("Size override ignored for {} ({})", kind, base.getName());
            return base;
        }
        return TargetType.builder()
                .name(base.getName())
                .length(sized && length != null ? length : base.getLength())
                .precision(numeric && precision != null ? precision : base.getPrecision())
                .scale(numeric && scale != null ? scale : base.getScale())
                .build();
    }

    /**
     * Map a source display mask. Tries the curated table first, then
     * substitutes date tokens and time tokens. Empty when nothing in the mask
     * was recognised.
     */
    public Optional<String> mapFormatMask(String mask) {
        if (mask == null || mask.isBlank()) {
            return Optional.empty();
        }
        String exact = FORMAT_MASKS.get(mask);
        if (exact != null) {
            return Optional.of(exact);
        }
        String substituted = substituteTokens(mask);
        if (substituted.equals(mask)) {
            return Optional.empty();
        }
        return Optional.of(substituted);
    }

    /**
     * Target literal for a parameter's initial value.
     */
    public String defaultValueLiteral(ValueType kind, String value) {
        if (value == null) {
            return "NULL";
        }
        ValueType type = kind == null ? ValueType.UNKNOWN : kind;
        switch (type) {
            case BOOLEAN:
                String v = value.trim().toLowerCase(Locale.ROOT);
                return v.equals("true") || v.equals("yes") || v.equals("1") || v.equals("y") ? "'Y'" : "'N'";
            case NUMBER:
            case CURRENCY:
                return value.trim();
            case DATE:
                return "TO_DATE('" + escape(value.trim()) + "', 'YYYY-MM-DD')";
            case DATETIME:
                return "TO_TIMESTAMP('" + escape(value.trim()) + "', 'YYYY-MM-DD HH24:MI:SS')";
            case TIME:
                return "TO_DATE('1970-01-01 " + escape(value.trim()) + "', 'YYYY-MM-DD HH24:MI:SS')";
            default:
                return "'" + escape(value) + "'";
        }
    }

    private static String escape(String value) {
        return value.replace("'", "''");
    }

    /**
     * Replace runs of one pattern letter in a single left-to-right scan,
     * leaving quoted text alone. Date letters (y, M, d) and time letters
     * (H, h, m, s, t) are disjoint, so each run maps to at most one token.
     */
    private static String substituteTokens(String mask) {
        StringBuilder out = new StringBuilder(mask.length() + 8);
        int i = 0;
        while (i < mask.length()) {
            char c = mask.charAt(i);
            if (c == '"' || c == '\'') {
                int end = mask.indexOf(c, i + 1);
                end = end < 0 ? mask.length() : end + 1;
                out.append(mask, i, end);
                i = end;
                continue;
            }
            if (mask.regionMatches(true, i, "AM/PM", 0, 5)) {
                out.append("AM");
                i += 5;
                continue;
            }
            int run = i;
            while (run < mask.length() && mask.charAt(run) == c) {
                run++;
            }
            int length = run - i;
            String replacement = dateToken(c, length);
            if (replacement == null) {
                replacement = timeToken(c);
            }
            out.append(replacement != null ? replacement : mask.substring(i, run));
            i = run;
        }
        return out.toString();
    }

    private static String dateToken(char c, int length) {
        switch (c) {
            case 'y':
                return length >= 3 ? "YYYY" : length == 2 ? "YY" : "Y";
            case 'M':
                return length >= 4 ? "MONTH" : length == 3 ? "MON" : "MM";
            case 'd':
                return length >= 4 ? "DAY" : length == 3 ? "DY" : "DD";
            default:
                return null;
        }
    }

    private static String timeToken(char c) {
        switch (c) {
            case 'H':
                return "HH24";
            case 'h':
                return "HH";
            case 'm':
                return "MI";
            case 's':
                return "SS";
            case 't':
                return "AM";
            default:
                return null;
        }
    }
}
