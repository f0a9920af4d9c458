package com.al.reportmigrator.service.layout;

import java.util.HashMap;
import java.util.Map;

/**
 * Hands out unique names within one synthesis run: the first request for a
 * base name gets it unchanged, later ones get _2, _3, ...
 */
public class NameRegistry {

    private final Map<String, Integer> counts = new HashMap<>();

    public String register(String base) {
        int count = counts.merge(base, 1, Integer::sum);
        if (count == 1) {
            return base;
        }
        String candidate = base + "_" + count;
        // "A_2" may already have been requested as a base name of its own
        while (counts.containsKey(candidate)) {
            count = counts.merge(base, 1, Integer::sum);
            candidate = base + "_" + count;
        }
        counts.put(candidate, 1);
        return candidate;
    }
}
