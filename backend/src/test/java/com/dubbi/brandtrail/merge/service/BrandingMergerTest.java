package com.dubbi.brandtrail.merge.service;

import com.dubbi.brandtrail.classify.ClassificationOutcome;
import com.dubbi.brandtrail.classify.SemanticEnhancement;
import com.dubbi.brandtrail.classify.SemanticEnhancement.ButtonClassification;
import com.dubbi.brandtrail.classify.SemanticEnhancement.ColorRoles;
import com.dubbi.brandtrail.classify.SemanticEnhancement.LogoSelection;
import com.dubbi.brandtrail.collect.domain.ColorScheme;
import com.dubbi.brandtrail.collect.domain.LogoCandidate;
import com.dubbi.brandtrail.inference.domain.BrandingDebug;
import com.dubbi.brandtrail.inference.domain.BrandingParts.BrandImages;
import com.dubbi.brandtrail.inference.domain.BrandingParts.ButtonStyle;
import com.dubbi.brandtrail.inference.domain.BrandingParts.ComponentStyles;
import com.dubbi.brandtrail.inference.domain.BrandingParts.FontFamilies;
import com.dubbi.brandtrail.inference.domain.BrandingParts.FontSizes;
import com.dubbi.brandtrail.inference.domain.BrandingParts.FontUsage;
import com.dubbi.brandtrail.inference.domain.BrandingParts.InputStyle;
import com.dubbi.brandtrail.inference.domain.BrandingParts.SpacingProfile;
import com.dubbi.brandtrail.inference.domain.BrandingParts.TypographyProfile;
import com.dubbi.brandtrail.inference.domain.ButtonCandidate;
import com.dubbi.brandtrail.inference.domain.HeuristicBrandingProfile;
import com.dubbi.brandtrail.inference.domain.Palette;
import com.dubbi.brandtrail.merge.domain.FieldSource;
import com.dubbi.brandtrail.merge.domain.FinalBrandingProfile;
import com.dubbi.brandtrail.merge.domain.MergeField;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BrandingMergerTest {

    private static final Palette PALETTE = new Palette("#0066FF", "#FF5500", "#FFFFFF", "#111111", "#FF5500");
    private static final ButtonStyle HEURISTIC_PRIMARY = new ButtonStyle("#0066FF", "#FFFFFF", null, "6px");

    private final BrandingMerger merger = new BrandingMerger();

    private static ButtonCandidate candidate(int index, String text, String background) {
        return new ButtonCandidate(index, text, "btn", background, "#FFFFFF", null, "8px", null,
                900 - index, text.toLowerCase() + "|" + background + "|btn", 1, background, "#FFFFFF", null);
    }

    private static final List<LogoCandidate> LOGOS = List.of(
            new LogoCandidate("https://acme.test/logo.svg", "Acme", false, true, true, 10, 120, 32),
            new LogoCandidate("https://acme.test/footer-logo.png", "Acme", false, false, false, 3000, 80, 20));

    private static HeuristicBrandingProfile heuristic() {
        return new HeuristicBrandingProfile(
                ColorScheme.LIGHT,
                List.of(new FontUsage("Inter", 4)),
                PALETTE,
                new TypographyProfile(new FontFamilies("Inter", "Inter"), Map.of("body", List.of("Inter")),
                        new FontSizes("48px", "32px", "16px")),
                new SpacingProfile(8, "6px"),
                new ComponentStyles(HEURISTIC_PRIMARY, null, new InputStyle("#CCCCCC", "6px")),
                new BrandImages("https://acme.test/og.png", "https://acme.test/favicon.ico", "https://acme.test/og.png"),
                List.of(candidate(0, "Get started", "#0066FF"), candidate(1, "Talk to sales", "#111111")),
                Set.of("nextjs"),
                new BrandingDebug(List.of(), List.of(), List.of(), List.of(), null, PALETTE, List.of(), null));
    }

    @Test
    void failureKeepsHeuristicAndStripsDebug() {
        HeuristicBrandingProfile h = heuristic();

        FinalBrandingProfile result = merger.merge(h, ClassificationOutcome.failure("timeout"), LOGOS, false);

        assertEquals(FinalBrandingProfile.fromHeuristic(h, false), result);
        assertEquals(h.colors(), result.colors());
        assertEquals(h.components(), result.components());
        assertNull(result.buttonCandidates());
        assertNull(result.debug());
        for (MergeField f : MergeField.values()) assertEquals(FieldSource.KEPT_HEURISTIC, result.sourceOf(f));
    }

    @Test
    void outOfRangeIndicesAreIgnored() {
        SemanticEnhancement e = new SemanticEnhancement(
                new ButtonClassification(7, -1, 0.9), null, new LogoSelection(2, 0.8));

        FinalBrandingProfile result = merger.merge(heuristic(), ClassificationOutcome.success(e), LOGOS, false);

        assertEquals(HEURISTIC_PRIMARY, result.components().buttonPrimary());
        assertNull(result.components().buttonSecondary());
        assertEquals("https://acme.test/og.png", result.images().logo());
        assertEquals(FieldSource.KEPT_HEURISTIC, result.sourceOf(MergeField.BUTTON_PRIMARY));
        assertEquals(FieldSource.KEPT_HEURISTIC, result.sourceOf(MergeField.LOGO));
    }

    @Test
    void validFieldsAreOverriddenIndependently() {
        SemanticEnhancement e = new SemanticEnhancement(
                new ButtonClassification(1, null, 0.4),
                new ColorRoles("rgb(255, 0, 0)", "not-a-color", "rgba(0, 0, 0, 0)", null, "#00aa00", 0.3),
                new LogoSelection(0, 0.1));

        FinalBrandingProfile result = merger.merge(heuristic(), ClassificationOutcome.success(e), LOGOS, false);

        assertEquals(new ButtonStyle("#111111", "#FFFFFF", null, "8px"), result.components().buttonPrimary());
        assertEquals(FieldSource.OVERRIDDEN, result.sourceOf(MergeField.BUTTON_PRIMARY));
        assertEquals(FieldSource.KEPT_HEURISTIC, result.sourceOf(MergeField.BUTTON_SECONDARY));

        assertEquals(new Palette("#FF0000", "#FF5500", "#FFFFFF", "#111111", "#00AA00"), result.colors());
        assertEquals(FieldSource.OVERRIDDEN, result.sourceOf(MergeField.COLOR_PRIMARY));
        assertEquals(FieldSource.KEPT_HEURISTIC, result.sourceOf(MergeField.COLOR_ACCENT));
        assertEquals(FieldSource.KEPT_HEURISTIC, result.sourceOf(MergeField.COLOR_BACKGROUND));
        assertEquals(FieldSource.OVERRIDDEN, result.sourceOf(MergeField.COLOR_LINK));

        assertEquals("https://acme.test/logo.svg", result.images().logo());
        assertEquals(FieldSource.OVERRIDDEN, result.sourceOf(MergeField.LOGO));
    }

    @Test
    @SuppressWarnings("unchecked")
    void failingLogoFieldDoesNotRollBackButtons() {
        List<LogoCandidate> broken = mock(List.class);
        when(broken.size()).thenThrow(new IllegalStateException("detached"));
        SemanticEnhancement e = new SemanticEnhancement(
                new ButtonClassification(0, 1, 0.9), null, new LogoSelection(0, 0.9));

        FinalBrandingProfile result = merger.merge(heuristic(), ClassificationOutcome.success(e), broken, false);

        assertEquals(FieldSource.OVERRIDDEN, result.sourceOf(MergeField.BUTTON_PRIMARY));
        assertEquals(FieldSource.OVERRIDDEN, result.sourceOf(MergeField.BUTTON_SECONDARY));
        assertEquals(new ButtonStyle("#111111", "#FFFFFF", null, "8px"), result.components().buttonSecondary());
        assertEquals(FieldSource.KEPT_HEURISTIC, result.sourceOf(MergeField.LOGO));
        assertEquals("https://acme.test/og.png", result.images().logo());
    }

    @Test
    void debugPayloadCarriesConfidences() {
        SemanticEnhancement e = new SemanticEnhancement(
                new ButtonClassification(0, null, 0.95), new ColorRoles(null, null, null, null, null, 0.5), null);

        FinalBrandingProfile result = merger.merge(heuristic(), ClassificationOutcome.success(e), LOGOS, true);

        assertEquals(2, result.buttonCandidates().size());
        assertNotNull(result.debug());
        assertEquals(0.95, result.debug().enhancement().buttonConfidence());
        assertEquals(0.5, result.debug().enhancement().colorConfidence());
        assertNull(result.debug().enhancement().selectedLogoIndex());
    }
}
