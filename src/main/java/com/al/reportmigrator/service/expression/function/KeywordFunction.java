package com.al.reportmigrator.service.expression.function;

import lombok.Getter;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Source functions written without an argument list, such as CurrentDate or
 * PageNumber. Approximate entries have no row-level equivalent in the target
 * and are flagged when used.
 */
@Getter
public enum KeywordFunction {

    CURRENT_DATE("TRUNC(SYSDATE)", false, "today"),
    CURRENT_DATE_TIME("SYSTIMESTAMP", false),
    CURRENT_TIME("TO_CHAR(SYSDATE, 'HH24:MI:SS')", false),
    NOW("SYSDATE", false),
    TIMER("(SYSDATE - TRUNC(SYSDATE)) * 86400", false),
    PRINT_DATE("SYSDATE", false, "datadate"),
    PRINT_TIME("SYSDATE", false, "datatime"),
    PAGE_NUMBER("1", true),
    TOTAL_PAGE_COUNT("1", true),
    GROUP_NUMBER("1", true),
    RECORD_NUMBER("ROWNUM", false);

    private static final Map<String, KeywordFunction> BY_NAME;

    static {
        Map<String, KeywordFunction> names = new HashMap<>();
        for (KeywordFunction keyword : values()) {
            names.put(keyword.sourceName(), keyword);
            keyword.aliases.forEach(alias -> names.put(alias, keyword));
        }
        BY_NAME = Collections.unmodifiableMap(names);
    }

    private final String target;
    private final boolean approximate;
    private final List<String> aliases;

    KeywordFunction(String target, boolean approximate, String... aliases) {
        this.target = target;
        this.approximate = approximate;
        this.aliases = List.of(aliases);
    }

    public static Optional<KeywordFunction> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name.toLowerCase(Locale.ROOT)));
    }

    public String sourceName() {
        return name().toLowerCase(Locale.ROOT).replace("_", "");
    }
}
