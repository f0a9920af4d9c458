package com.al.reportmigrator.model.enums;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Role of a report section in the source layout.
 */
public enum SectionRole {
    REPORT_HEADER("reportheader", "rh"),
    PAGE_HEADER("pageheader", "ph"),
    GROUP_HEADER("groupheader", "gh"),
    DETAIL("detail", "d"),
    GROUP_FOOTER("groupfooter", "gf"),
    PAGE_FOOTER("pagefooter", "pf"),
    REPORT_FOOTER("reportfooter", "rf");

    // Section names such as "GH1", "GF2a", "Da", "RHb"
    private static final Pattern ABBREVIATED_NAME = Pattern.compile("^(rh|ph|gh|gf|pf|rf|d)(\\d*)[a-z]?$");

    private final String token;
    private final String abbreviation;

    SectionRole(String token, String abbreviation) {
        this.token = token;
        this.abbreviation = abbreviation;
    }

    public boolean isGroupBand() {
        return this == GROUP_HEADER || this == GROUP_FOOTER;
    }

    /**
     * Parse an explicit role tag ("group_header", "GroupHeader", "GH", "details").
     * Returns null when the tag is absent or not recognised.
     */
    public static SectionRole fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return null;
        }
        String normalized = normalize(tag);
        if (normalized.equals("details") || normalized.equals("body")) {
            return DETAIL;
        }
        for (SectionRole role : values()) {
            if (role.token.equals(normalized) || role.abbreviation.equals(normalized)
                    || normalized.equals(role.token + "section")) {
                return role;
            }
        }
        return null;
    }

    /**
     * Resolve a section's role: the explicit tag first, then the section name,
     * falling back to {@link #DETAIL}.
     */
    public static SectionRole resolve(String tag, String sectionName) {
        SectionRole explicit = fromTag(tag);
        if (explicit != null) {
            return explicit;
        }
        if (sectionName == null || sectionName.isBlank()) {
            return DETAIL;
        }
        String name = normalize(sectionName);
        for (SectionRole role : values()) {
            if (name.contains(role.token)) {
                return role;
            }
        }
        Matcher abbreviated = ABBREVIATED_NAME.matcher(sectionName.trim().toLowerCase(Locale.ROOT));
        if (abbreviated.matches()) {
            String prefix = abbreviated.group(1);
            for (SectionRole role : values()) {
                if (role.abbreviation.equals(prefix)) {
                    return role;
                }
            }
        }
        return DETAIL;
    }

    private static String normalize(String text) {
        return text.toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
    }
}
