package com.al.reportmigrator.service.layout;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Target names already chosen for formulas, keyed by source name. Lets the
 * layout bind formula fields to deduplicated function names instead of
 * deriving them again.
 */
public class SourceBindings {

    private static final SourceBindings EMPTY = new SourceBindings(Collections.emptyMap());

    private final Map<String, String> formulaNames;

    public SourceBindings(Map<String, String> formulaNames) {
        Map<String, String> keyed = new HashMap<>();
        formulaNames.forEach((source, target) -> keyed.put(key(source), target));
        this.formulaNames = Collections.unmodifiableMap(keyed);
    }

    public static SourceBindings empty() {
        return EMPTY;
    }

    public Optional<String> formulaName(String sourceName) {
        return Optional.ofNullable(formulaNames.get(key(sourceName)));
    }

    private static String key(String name) {
        if (name == null) {
            return "";
        }
        String key = name.trim();
        if (key.startsWith("{") && key.endsWith("}")) {
            key = key.substring(1, key.length() - 1).trim();
        }
        if (key.startsWith("@")) {
            key = key.substring(1);
        }
        return key.trim().toLowerCase(Locale.ROOT);
    }
}
