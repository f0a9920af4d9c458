package com.al.reportmigrator.service.mapping;

import com.al.reportmigrator.config.FontProperties;
import com.al.reportmigrator.model.FontSpec;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps source font families, sizes and styles onto fonts the target platform
 * ships with.
 */
@Slf4j
@Component
public class FontMapper {

    static final double MIN_SIZE = 4;
    static final double MAX_SIZE = 144;

    private static final Map<String, String> DEFAULT_FAMILIES;

    static {
        Map<String, String> families = new LinkedHashMap<>();
        families.put("Arial", "Arial");
        families.put("Times New Roman", "Times");
        families.put("Courier New", "Courier");
        families.put("Verdana", "Helvetica");
        families.put("Tahoma", "Helvetica");
        families.put("Comic Sans MS", "Helvetica");
        families.put("Georgia", "Times");
        families.put("Trebuchet MS", "Helvetica");
        families.put("Impact", "Helvetica");
        families.put("Calibri", "Helvetica");
        families.put("Cambria", "Times");
        families.put("Consolas", "Courier");
        families.put("Lucida Console", "Courier");
        families.put("Lucida Sans Unicode", "Helvetica");
        families.put("Palatino Linotype", "Times");
        families.put("Book Antiqua", "Times");
        families.put("Century Gothic", "Helvetica");
        families.put("Franklin Gothic Medium", "Helvetica");
        families.put("Garamond", "Times");
        families.put("MS Sans Serif", "Helvetica");
        families.put("MS Serif", "Times");
        families.put("Symbol", "Symbol");
        families.put("Wingdings", "Symbol");
        DEFAULT_FAMILIES = Collections.unmodifiableMap(families);
    }

    private final Map<String, String> families;
    private final String defaultFamily;
    private final double defaultSize;

    @Autowired
    public FontMapper(FontProperties properties) {
        Map<String, String> merged = new LinkedHashMap<>(properties.getMappings());
        DEFAULT_FAMILIES.forEach(merged::putIfAbsent);
        this.families = Collections.unmodifiableMap(merged);
        this.defaultFamily = properties.getDefaultFamily();
        this.defaultSize = properties.getDefaultSize();
        log.debug("FontMapper initialised with {} family mappings, default {} {}pt",
                families.size(), defaultFamily, defaultSize);
    }

    public MappedFont map(FontSpec font) {
        if (font == null) {
            return MappedFont.builder()
                    .family(defaultFamily)
                    .size(defaultSize)
                    .style(style(false, false))
                    .build();
        }
        return MappedFont.builder()
                .family(mapFamily(font.getName()))
                .size(mapSize(font.getSize()))
                .style(style(font.isBold(), font.isItalic()))
                .underline(font.isUnderline())
                .build();
    }

    /**
     * Exact match, then case-insensitive match, then partial match
     * ("Arial Unicode MS" maps like "Arial"), else the default family.
     */
    public String mapFamily(String sourceFamily) {
        if (sourceFamily == null || sourceFamily.isBlank()) {
            return defaultFamily;
        }
        String exact = families.get(sourceFamily);
        if (exact != null) {
            return exact;
        }
        String lower = sourceFamily.trim().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : families.entrySet()) {
            if (entry.getKey().toLowerCase(Locale.ROOT).equals(lower)) {
                return entry.getValue();
            }
        }
        for (Map.Entry<String, String> entry : families.entrySet()) {
            if (lower.contains(entry.getKey().toLowerCase(Locale.ROOT))) {
                log.debug("Font '{}' mapped by partial match to {}", sourceFamily, entry.getValue());
                return entry.getValue();
            }
        }
        log.warn("No mapping for font '{}', using default: {}", sourceFamily, defaultFamily);
        return defaultFamily;
    }

    /**
     * Sizes are in points on both sides; non-positive sizes take the default,
     * others are clamped to 4..144.
     */
    public double mapSize(double size) {
        if (size <= 0) {
            return defaultSize;
        }
        if (size < MIN_SIZE) {
            log.warn("Font size {} too small, using {}pt", size, MIN_SIZE);
            return MIN_SIZE;
        }
        if (size > MAX_SIZE) {
            log.warn("Font size {} too large, using {}pt", size, MAX_SIZE);
            return MAX_SIZE;
        }
        return size;
    }

    public String style(boolean bold, boolean italic) {
        if (bold && italic) {
            return "bolditalic";
        }
        if (bold) {
            return "bold";
        }
        return italic ? "italic" : "plain";
    }

    @Value
    @Builder
    public static class MappedFont {
        String family;
        double size;
        String style;
        boolean underline;
    }
}
