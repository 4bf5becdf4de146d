package com.dubbi.brandtrail.inference.service;

import com.dubbi.brandtrail.collect.domain.BackgroundCandidate;
import com.dubbi.brandtrail.collect.domain.ColorScheme;
import com.dubbi.brandtrail.collect.domain.CssData;
import com.dubbi.brandtrail.collect.domain.CssSkip;
import com.dubbi.brandtrail.collect.domain.ImageRef;
import com.dubbi.brandtrail.collect.domain.ImageType;
import com.dubbi.brandtrail.collect.domain.RawBrandingRecord;
import com.dubbi.brandtrail.collect.domain.StyleSnapshot;
import com.dubbi.brandtrail.collect.domain.TypographySignals;
import com.dubbi.brandtrail.inference.domain.ButtonCandidate;
import com.dubbi.brandtrail.inference.domain.HeuristicBrandingProfile;
import com.dubbi.brandtrail.inference.domain.Palette;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import static com.dubbi.brandtrail.collect.domain.TestSnapshots.button;
import static com.dubbi.brandtrail.collect.domain.TestSnapshots.text;
import static org.junit.jupiter.api.Assertions.*;

class BrandingInferenceEngineTest {

    private static final Pattern HEX = Pattern.compile("^#[0-9A-F]{6}([0-9A-F]{2})?$");

    private final BrandingInferenceEngine engine = new BrandingInferenceEngine();

    private static RawBrandingRecord sampleRecord() {
        List<StyleSnapshot> snaps = new ArrayList<>();
        for (int i = 0; i < 10; i++) snaps.add(text("p", "rgb(17, 17, 17)", List.of("Inter", "sans-serif")));
        snaps.add(button("Get started", "rgb(0, 102, 255)", "btn btn-primary", 140, 44));
        snaps.add(button("Get started", "rgb(0, 102, 255)", "btn btn-primary", 140, 44));
        snaps.add(button("Pricing", "rgba(0, 0, 0, 0)", "btn", 100, 40));

        CssData css = new CssData(Set.of("#FF5500"), Set.of(4.0, 8.0), Set.of(8.0, 16.0, 24.0, 32.0),
                Map.of("--brand", "#0066ff"), List.of("Inter", "Roboto Mono", "Inter"), List.of(CssSkip.sheet("https://cdn.test/x.css", "blocked")));

        return new RawBrandingRecord(
                css,
                snaps,
                List.of(new ImageRef(ImageType.FAVICON, "/favicon.ico"),
                        new ImageRef(ImageType.TWITTER, "/tw.png"),
                        new ImageRef(ImageType.LOGO_SVG, "data:image/svg+xml;utf8,%3Csvg%3E")),
                ColorScheme.LIGHT,
                "#FFFFFF",
                new TypographySignals(List.of("Inter", "sans-serif"), List.of("Inter"), "48px", "32px", "16px"),
                Set.of("nextjs"),
                List.of(new BackgroundCandidate("body", "#FFFFFF", 1_000_000)),
                List.of(),
                "Acme");
    }

    @Test
    void infersCompleteProfile() {
        HeuristicBrandingProfile profile = engine.infer(sampleRecord());

        assertEquals(ColorScheme.LIGHT, profile.colorScheme());
        assertEquals("#FFFFFF", profile.colors().background());
        assertEquals("#0066FF", profile.colors().primary());
        assertEquals(8, profile.spacing().baseUnit());
        assertEquals("Inter", profile.typography().fontFamilies().primary());
        assertEquals("Inter", profile.fonts().get(0).family());
        assertEquals("data:image/svg+xml;utf8,%3Csvg%3E", profile.images().logo());
        assertEquals("/favicon.ico", profile.images().favicon());
        assertEquals("/tw.png", profile.images().ogImage());
        assertEquals("#0066FF", profile.components().buttonPrimary().background());
        assertEquals(Set.of("nextjs"), profile.frameworkHints());

        List<ButtonCandidate> buttons = profile.buttonCandidates();
        assertEquals(2, buttons.size());
        assertEquals("Get started", buttons.get(0).text());
        assertEquals(2, buttons.get(0).occurrences());

        assertNotNull(profile.debug());
        assertEquals(1, profile.debug().skippedCss().size());
        assertEquals(List.of("Inter", "Roboto Mono"), profile.debug().rawCssFonts());
        assertEquals(profile.colors(), profile.debug().inferredPalette());
        assertFalse(profile.debug().snapshotColors().backgrounds().isEmpty());
    }

    @Test
    void everyEmittedColorIsHexOrNull() {
        HeuristicBrandingProfile profile = engine.infer(sampleRecord());
        Palette p = profile.colors();

        for (String color : new String[]{p.primary(), p.accent(), p.background(), p.textPrimary(), p.link(),
                profile.components().buttonPrimary().background(),
                profile.components().buttonPrimary().textColor(),
                profile.components().input().borderColor()}) {
            assertTrue(color == null || HEX.matcher(color).matches(), "not hex: " + color);
        }
        for (ButtonCandidate c : profile.buttonCandidates()) {
            assertTrue(c.background() == null || HEX.matcher(c.background()).matches());
            assertTrue(HEX.matcher(c.textColor()).matches());
        }
    }

    @Test
    void emptyRecordDegradesToDefaults() {
        HeuristicBrandingProfile profile = engine.infer(new RawBrandingRecord(
                null, null, null, null, null, null, null, null, null, null));

        assertEquals(ColorScheme.LIGHT, profile.colorScheme());
        assertEquals(8, profile.spacing().baseUnit());
        assertEquals("8px", profile.spacing().borderRadius());
        assertEquals("#FFFFFF", profile.colors().background());
        assertTrue(profile.buttonCandidates().isEmpty());
        assertNull(profile.images().logo());
    }

    @Test
    void nullEntriesInsideRecordAreIgnored() {
        Set<String> cssColors = new LinkedHashSet<>(Arrays.asList("#FF5500", null));
        Set<Double> spacings = new LinkedHashSet<>(Arrays.asList(8.0, null, 16.0));
        CssData css = new CssData(cssColors, new HashSet<>(Arrays.asList(4.0, null)), spacings,
                null, Arrays.asList("Inter", null), Arrays.asList((CssSkip) null));

        RawBrandingRecord raw = new RawBrandingRecord(
                css,
                Arrays.asList(null, button("Get started", "rgb(0, 102, 255)", "btn btn-primary", 140, 44), null),
                Arrays.asList(null, new ImageRef(ImageType.OG, "/og.png")),
                ColorScheme.LIGHT,
                null,
                new TypographySignals(Arrays.asList(null, "Inter"), null, null, null, null),
                new HashSet<>(Arrays.asList("nextjs", null)),
                Arrays.asList((BackgroundCandidate) null),
                Arrays.asList(null, null),
                null);

        HeuristicBrandingProfile profile = assertDoesNotThrow(() -> engine.infer(raw));

        assertEquals(1, raw.snapshots().size());
        assertEquals(List.of(8.0, 16.0), List.copyOf(raw.cssData().spacings()));
        assertEquals(1, profile.buttonCandidates().size());
        assertEquals("#0066FF", profile.components().buttonPrimary().background());
        assertEquals("/og.png", profile.images().logo());
        assertEquals(Set.of("nextjs"), profile.frameworkHints());
        assertTrue(raw.logoCandidates().isEmpty());
        assertTrue(profile.debug().backgroundCandidates().isEmpty());
    }

    @Test
    void missingRecordIsCallerError() {
        assertThrows(NullPointerException.class, () -> engine.infer(null));
    }
}
