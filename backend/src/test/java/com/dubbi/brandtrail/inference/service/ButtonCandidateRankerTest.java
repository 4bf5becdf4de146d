package com.dubbi.brandtrail.inference.service;

import com.dubbi.brandtrail.collect.domain.StyleSnapshot;
import com.dubbi.brandtrail.inference.domain.ButtonCandidate;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.dubbi.brandtrail.collect.domain.TestSnapshots.button;
import static com.dubbi.brandtrail.collect.domain.TestSnapshots.cta;
import static com.dubbi.brandtrail.collect.domain.TestSnapshots.text;
import static com.dubbi.brandtrail.collect.domain.TestSnapshots.withBorder;
import static org.junit.jupiter.api.Assertions.*;

class ButtonCandidateRankerTest {

    @Test
    void sameTextBackgroundAndLeadingClassesCollapse() {
        List<StyleSnapshot> snaps = List.of(
                button("Get Started", "#0000FF", "btn btn-lg btn-primary hero wide one", 140, 44),
                button("Get Started", "#0000FF", "btn btn-lg btn-primary hero wide two", 140, 44));

        List<ButtonCandidate> ranked = ButtonCandidateRanker.rank(snaps);

        assertEquals(1, ranked.size());
        assertEquals(2, ranked.get(0).occurrences());
        assertEquals("get started|#0000FF|btn btn-lg btn-primary hero wide", ranked.get(0).signature());
    }

    @Test
    void ineligibleSnapshotsAreDropped() {
        List<StyleSnapshot> snaps = List.of(
                button("Tiny", "#0000FF", "btn", 20, 20),
                button("   ", "#0000FF", "btn", 100, 40),
                button("Weird", "var(--brand)", "btn", 100, 40),
                text("a", "#0000FF", List.of()),
                button("Ok", "#0000FF", "btn", 100, 40));

        List<ButtonCandidate> ranked = ButtonCandidateRanker.rank(snaps);

        assertEquals(List.of("Ok"), ranked.stream().map(ButtonCandidate::text).toList());
    }

    @Test
    void ctaIndicatorAndKeywordsRankFirst() {
        List<StyleSnapshot> snaps = List.of(
                button("Learn more", "#0000FF", "btn", 300, 60),
                button("Start free trial", "#0000FF", "btn", 100, 40),
                cta("Talk to us", "#00AA00"));

        List<ButtonCandidate> ranked = ButtonCandidateRanker.rank(snaps);

        assertEquals(List.of("Talk to us", "Start free trial", "Learn more"),
                ranked.stream().map(ButtonCandidate::text).toList());
        assertEquals(List.of(0, 1, 2), ranked.stream().map(ButtonCandidate::index).toList());
    }

    @Test
    void transparentAndNearWhiteBackgroundsEarnNoColorBonus() {
        double colored = ButtonCandidateRanker.score(button("Docs", "#0000FF", "btn", 100, 40));
        double transparent = ButtonCandidateRanker.score(button("Docs", "rgba(0, 0, 0, 0)", "btn", 100, 40));
        double white = ButtonCandidateRanker.score(button("Docs", "rgb(250, 250, 250)", "btn", 100, 40));

        assertEquals(300, colored - transparent, 1e-9);
        assertEquals(transparent, white, 1e-9);
    }

    @Test
    void outputIsCappedWithUniqueSignatures() {
        List<StyleSnapshot> snaps = new ArrayList<>();
        for (int i = 0; i < 120; i++) {
            snaps.add(button("Button " + i, "#0000FF", "btn", 100, 40));
            snaps.add(button("Button " + i, "#0000FF", "btn", 100, 40));
        }

        List<ButtonCandidate> ranked = ButtonCandidateRanker.rank(snaps);

        assertEquals(ButtonCandidateRanker.MAX_CANDIDATES, ranked.size());
        Set<String> signatures = new HashSet<>();
        for (ButtonCandidate c : ranked) assertTrue(signatures.add(c.signature()));
    }

    @Test
    void candidateCarriesNormalizedAndOriginalColors() {
        StyleSnapshot plain = button("Buy now", "rgb(0, 0, 255)", "btn", 100, 40);
        StyleSnapshot bordered = withBorder(button("Contact", "rgb(255, 255, 255)", "btn", 100, 40), "rgb(0, 0, 255)", 1);

        List<ButtonCandidate> ranked = ButtonCandidateRanker.rank(List.of(plain, bordered));

        ButtonCandidate buy = ranked.stream().filter(c -> c.text().equals("Buy now")).findFirst().orElseThrow();
        assertEquals("#0000FF", buy.background());
        assertEquals("#FFFFFF", buy.textColor());
        assertNull(buy.borderColor());
        assertEquals("6px", buy.borderRadius());
        assertEquals("rgb(0, 0, 255)", buy.originalBackgroundColor());

        ButtonCandidate contact = ranked.stream().filter(c -> c.text().equals("Contact")).findFirst().orElseThrow();
        assertEquals("#0000FF", contact.borderColor());
    }
}
