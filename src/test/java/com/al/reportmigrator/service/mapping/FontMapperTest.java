package com.al.reportmigrator.service.mapping;

import com.al.reportmigrator.config.FontProperties;
import com.al.reportmigrator.model.FontSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FontMapperTest {

    private FontMapper fontMapper;

    @BeforeEach
    public void setUp() {
        FontProperties properties = new FontProperties();
        properties.getMappings().put("Corporate Sans", "Helvetica");
        fontMapper = new FontMapper(properties);
    }

    @Test
    public void testMapFamily_ExactAndCaseInsensitive() {
        assertEquals("Times", fontMapper.mapFamily("Times New Roman"));
        assertEquals("Courier", fontMapper.mapFamily("courier new"));
    }

    @Test
    public void testMapFamily_PartialMatch() {
        assertEquals("Arial", fontMapper.mapFamily("Arial Unicode MS"));
    }

    @Test
    public void testMapFamily_ConfiguredOverride() {
        assertEquals("Helvetica", fontMapper.mapFamily("Corporate Sans"));
    }

    @Test
    public void testMapFamily_UnknownFallsBackToDefault() {
        assertEquals("Arial", fontMapper.mapFamily("Zapfino Extra"));
        assertEquals("Arial", fontMapper.mapFamily(null));
    }

    @Test
    public void testMapSize_Clamped() {
        assertEquals(10.0, fontMapper.mapSize(0));
        assertEquals(4.0, fontMapper.mapSize(2));
        assertEquals(144.0, fontMapper.mapSize(300));
        assertEquals(11.5, fontMapper.mapSize(11.5));
    }

    @Test
    public void testMap_Style() {
        FontMapper.MappedFont font = fontMapper.map(FontSpec.builder()
                .name("Verdana").size(9).bold(true).italic(true).underline(true).build());

        assertEquals("Helvetica", font.getFamily());
        assertEquals(9.0, font.getSize());
        assertEquals("bolditalic", font.getStyle());
        assertTrue(font.isUnderline());
    }

    @Test
    public void testMap_NullFontUsesDefaults() {
        FontMapper.MappedFont font = fontMapper.map(null);
        assertEquals("Arial", font.getFamily());
        assertEquals(10.0, font.getSize());
        assertEquals("plain", font.getStyle());
    }
}
