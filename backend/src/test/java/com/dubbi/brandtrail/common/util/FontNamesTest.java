package com.dubbi.brandtrail.common.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FontNamesTest {

    @Test
    void cleansNextJsFontNames() {
        assertEquals("Roboto Mono", FontNames.cleanNextJsFontName("__Roboto_Mono_c8ca7d"));
        assertNull(FontNames.cleanNextJsFontName("__suisse_Fallback_6d5c28"));
        assertEquals("Inter", FontNames.cleanNextJsFontName("Inter"));
    }

    @Test
    void parsesStackWithoutQuotesFallbacksOrVars() {
        List<String> stack = FontNames.parseStack("\"Inter\", __Inter_Fallback_abc123, var(--font), 'Helvetica Neue', sans-serif, Inter");
        assertEquals(List.of("Inter", "Helvetica Neue", "sans-serif"), stack);
        assertTrue(FontNames.parseStack(null).isEmpty());
    }

    @Test
    void genericKeywords() {
        assertTrue(FontNames.isGeneric("system-ui"));
        assertTrue(FontNames.isGeneric("Apple Color Emoji"));
        assertTrue(FontNames.isGeneric("-apple-system"));
        assertFalse(FontNames.isGeneric("Inter"));
    }
}
