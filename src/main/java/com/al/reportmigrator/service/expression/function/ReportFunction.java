package com.al.reportmigrator.service.expression.function;

import lombok.Getter;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Closed catalogue of source formula functions with their target
 * equivalents. Templates use positional placeholders ({0}, {1}, ...); a
 * function with several templates accepts one template per argument count,
 * starting at {@link #getMinArity()}.
 *
 * @author Report Migrator Team
 * @version 1.0.0
 * @since 1.0.0
 */
@Getter
public enum ReportFunction {

    // String functions
    LEFT(2, "SUBSTR({0}, 1, {1})"),
    RIGHT(2, "SUBSTR({0}, -1 * {1})"),
    MID(Kind.TEMPLATE, 2, List.of("SUBSTR({0}, {1})", "SUBSTR({0}, {1}, {2})")),
    TRIM(1, "TRIM({0})"),
    LTRIM(1, "LTRIM({0})"),
    RTRIM(1, "RTRIM({0})"),
    UPPER(1, "UPPER({0})", "ucase"),
    LOWER(1, "LOWER({0})", "lcase"),
    LENGTH(1, "LENGTH({0})", "len"),
    INSTR(Kind.TEMPLATE, 2, List.of("INSTR({0}, {1})", "INSTR({1}, {2}, {0})")),
    INSTRREV(2, "INSTR({0}, {1}, -1)"),
    REPLACE(3, "REPLACE({0}, {1}, {2})"),
    SPACE(1, "RPAD(' ', {0})"),
    REPLICATE_STRING(2, "RPAD({0}, LENGTH({0}) * {1}, {0})", "replicate"),
    CHR(1, "CHR({0})", "chrw"),
    ASC(1, "ASCII({0})", "ascw"),
    VAL(1, "TO_NUMBER({0})"),
    STR(1, "TO_CHAR({0})"),
    STR_REVERSE(1, "REVERSE({0})"),
    STR_CMP(2, "CASE WHEN {0} < {1} THEN -1 WHEN {0} > {1} THEN 1 ELSE 0 END"),
    PROPER_CASE(1, "INITCAP({0})"),

    // Date functions
    DATE(Kind.TEMPLATE, 1, List.of(
            "TRUNC({0})",
            "TRUNC({0})",
            "TO_DATE({0}||'-'||{1}||'-'||{2}, 'YYYY-MM-DD')")),
    YEAR(1, "EXTRACT(YEAR FROM {0})"),
    MONTH(1, "EXTRACT(MONTH FROM {0})"),
    DAY(1, "EXTRACT(DAY FROM {0})"),
    HOUR(1, "EXTRACT(HOUR FROM CAST({0} AS TIMESTAMP))"),
    MINUTE(1, "EXTRACT(MINUTE FROM CAST({0} AS TIMESTAMP))"),
    SECOND(1, "EXTRACT(SECOND FROM CAST({0} AS TIMESTAMP))"),
    DAY_OF_WEEK(1, "TO_NUMBER(TO_CHAR({0}, 'D'))"),
    WEEKDAY(1, "TO_CHAR({0}, 'D')"),
    MONTH_NAME(1, "TO_CHAR({0}, 'Month')"),
    DATE_SERIAL(3, "TO_DATE({0}||'-'||{1}||'-'||{2}, 'YYYY-MM-DD')"),
    DATE_VALUE(1, "TO_DATE({0}, 'YYYY-MM-DD')"),
    TIME_VALUE(1, "TO_DATE({0}, 'HH24:MI:SS')"),
    DATE_PART(Kind.DATE_PART, 2),
    DATE_ADD(Kind.DATE_ADD, 3),
    DATE_DIFF(Kind.DATE_DIFF, 3),

    // Numeric functions
    ABS(1, "ABS({0})"),
    ROUND(Kind.TEMPLATE, 1, List.of("ROUND({0})", "ROUND({0}, {1})")),
    TRUNCATE(Kind.TEMPLATE, 1, List.of("TRUNC({0})", "TRUNC({0}, {1})")),
    INT(1, "FLOOR({0})"),
    FIX(1, "TRUNC({0})"),
    MOD(2, "MOD({0}, {1})"),
    REMAINDER(2, "REMAINDER({0}, {1})"),
    SIGN(1, "SIGN({0})", "sgn"),
    SQRT(1, "SQRT({0})", "sqr"),
    EXP(1, "EXP({0})"),
    LOG(1, "LN({0})"),
    LOG10(1, "LOG(10, {0})"),
    POWER(2, "POWER({0}, {1})"),
    CEILING(1, "CEIL({0})"),
    FLOOR(1, "FLOOR({0})"),

    // Trigonometric functions
    SIN(1, "SIN({0})"),
    COS(1, "COS({0})"),
    TAN(1, "TAN({0})"),
    ASIN(1, "ASIN({0})"),
    ACOS(1, "ACOS({0})"),
    ATAN(1, "ATAN({0})", "atn"),

    // Conversion functions
    TO_TEXT(Kind.TEMPLATE, 1, List.of("TO_CHAR({0})", "TO_CHAR({0}, {1})"), "cstr"),
    TO_NUMBER(1, "TO_NUMBER({0})", "cdbl"),
    TO_WORDS(1, "TO_CHAR(TO_DATE({0}, 'J'), 'JSP')"),
    CDATE(1, "TO_DATE({0})"),
    CBOOL(1, "CASE WHEN {0} THEN 'Y' ELSE 'N' END"),

    // Null handling
    IS_NULL(1, "({0} IS NULL)", "isnothing"),
    NV(2, "NVL({0}, {1})", "nvl"),

    // Logical functions
    IIF(Kind.CONDITIONAL, 3),
    SWITCH(Kind.MANUAL, 1),
    CHOOSE(Kind.MANUAL, 2),

    // Aggregates
    SUM(Kind.TEMPLATE, 1, List.of("SUM({0})", "SUM({0})")),
    AVERAGE(Kind.TEMPLATE, 1, List.of("AVG({0})", "AVG({0})"), "avg"),
    COUNT(Kind.TEMPLATE, 1, List.of("COUNT({0})", "COUNT({0})")),
    MAXIMUM(Kind.TEMPLATE, 1, List.of("MAX({0})", "MAX({0})"), "max"),
    MINIMUM(Kind.TEMPLATE, 1, List.of("MIN({0})", "MIN({0})"), "min"),
    DISTINCT_COUNT(Kind.TEMPLATE, 1, List.of("COUNT(DISTINCT {0})", "COUNT(DISTINCT {0})")),
    RUNNING_TOTAL(Kind.RUNNING_TOTAL, 1);

    /**
     * How a call is rewritten.
     */
    public enum Kind {
        /** Positional template per argument count. */
        TEMPLATE,
        /** Kept as an IIF call for conditional flattening. */
        CONDITIONAL,
        /** No automatic equivalent; left in place and flagged. */
        MANUAL,
        DATE_PART,
        DATE_ADD,
        DATE_DIFF,
        RUNNING_TOTAL
    }

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\d+)\\}");

    private static final Map<String, ReportFunction> BY_NAME;

    static {
        Map<String, ReportFunction> names = new HashMap<>();
        for (ReportFunction function : values()) {
            names.put(function.sourceName(), function);
            for (String alias : function.aliases) {
                names.put(alias, function);
            }
        }
        BY_NAME = Collections.unmodifiableMap(names);
    }

    private final Kind kind;
    private final int minArity;
    private final List<String> templates;
    private final List<String> aliases;

    ReportFunction(int arity, String template, String... aliases) {
        this(Kind.TEMPLATE, arity, List.of(template), aliases);
    }

    ReportFunction(Kind kind, int minArity) {
        this(kind, minArity, List.of());
    }

    ReportFunction(Kind kind, int minArity, List<String> templates, String... aliases) {
        this.kind = kind;
        this.minArity = minArity;
        this.templates = templates;
        this.aliases = List.of(aliases);
    }

    /**
     * Case-insensitive lookup by source function name or alias.
     */
    public static Optional<ReportFunction> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name.toLowerCase(Locale.ROOT)));
    }

    /**
     * Lower-case source spelling, e.g. {@code distinctcount}.
     */
    public String sourceName() {
        return name().toLowerCase(Locale.ROOT).replace("_", "");
    }

    public int getMaxArity() {
        return templates.isEmpty() ? minArity : minArity + templates.size() - 1;
    }

    public boolean acceptsArity(int count) {
        if (kind == Kind.MANUAL || kind == Kind.RUNNING_TOTAL) {
            return count >= minArity;
        }
        return count >= minArity && count <= getMaxArity();
    }

    /**
     * Template for the given argument count, clamped to the nearest declared
     * variant.
     */
    public String templateFor(int count) {
        if (templates.isEmpty()) {
            throw new IllegalStateException(name() + " has no template");
        }
        int index = Math.max(0, Math.min(templates.size() - 1, count - minArity));
        return templates.get(index);
    }

    /**
     * Number of distinct argument positions a template refers to, i.e. the
     * highest placeholder index plus one.
     */
    public static int placeholderCount(String template) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        int highest = -1;
        while (matcher.find()) {
            highest = Math.max(highest, Integer.parseInt(matcher.group(1)));
        }
        return highest + 1;
    }

    public static String fill(String template, List<String> args) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            int index = Integer.parseInt(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(args.get(index)));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
