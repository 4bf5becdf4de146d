package com.dubbi.brandtrail.inference.service;

import com.dubbi.brandtrail.collect.domain.StyleSnapshot;
import com.dubbi.brandtrail.common.util.CssColors;
import com.dubbi.brandtrail.inference.domain.ButtonCandidate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 버튼 후보 선별, 점수 계산, 중복 제거
 */
public class ButtonCandidateRanker {
    public static final int MAX_CANDIDATES = 80;
    static final double MIN_SIZE = 30;

    static final List<String> CTA_KEYWORDS = List.of(
            "sign up", "get started", "deploy", "try", "demo", "contact", "buy",
            "subscribe", "join", "register", "free", "start", "get");
    private static final Set<String> NEAR_WHITE = Set.of("#FFFFFF", "#FAFAFA", "#F5F5F5");

    private static final int SIGNATURE_TEXT_LENGTH = 50;
    private static final int SIGNATURE_CLASS_TOKENS = 5;

    private ButtonCandidateRanker() {}

    public static List<ButtonCandidate> rank(List<StyleSnapshot> snapshots) {
        List<Scored> scored = new ArrayList<>();
        for (StyleSnapshot s : snapshots) {
            if (isEligible(s)) scored.add(new Scored(s, score(s)));
        }
        scored.sort((a, b) -> Double.compare(b.score(), a.score()));

        // signature → 첫 후보, 등장 횟수
        Map<String, Scored> unique = new LinkedHashMap<>();
        Map<String, Integer> occurrences = new HashMap<>();
        for (Scored s : scored) {
            String sig = signature(s.snapshot());
            unique.putIfAbsent(sig, s);
            occurrences.merge(sig, 1, Integer::sum);
        }

        List<ButtonCandidate> out = new ArrayList<>();
        for (Map.Entry<String, Scored> e : unique.entrySet()) {
            if (out.size() >= MAX_CANDIDATES) break;
            out.add(toCandidate(out.size(), e.getValue(), e.getKey(), occurrences.get(e.getKey())));
        }
        return out;
    }

    static boolean isEligible(StyleSnapshot s) {
        if (!s.isButton()) return false;
        if (s.rect().w() < MIN_SIZE || s.rect().h() < MIN_SIZE) return false;
        if (s.text().isBlank()) return false;
        return CssColors.hexify(s.colors().background()) != null;
    }

    static double score(StyleSnapshot s) {
        double score = 0;
        if (s.hasCtaIndicator()) score += 1000;

        String text = s.text().toLowerCase(Locale.ROOT);
        if (CTA_KEYWORDS.stream().anyMatch(text::contains)) score += 500;

        String bg = CssColors.hexify(s.colors().background());
        if (bg != null && !NEAR_WHITE.contains(bg) && !CssColors.isTransparent(bg)) score += 300;

        if (!text.isEmpty() && text.length() < 50) score += 100;

        score += Math.log10(s.rect().area() + 1) * 10;
        return score;
    }

    /**
     * 텍스트(소문자, 50자) | 배경 hex | 앞쪽 클래스 5개
     */
    static String signature(StyleSnapshot s) {
        String bg = CssColors.hexify(s.colors().background());
        String text = s.text().trim().toLowerCase(Locale.ROOT);
        if (text.length() > SIGNATURE_TEXT_LENGTH) text = text.substring(0, SIGNATURE_TEXT_LENGTH);
        String classes = Arrays.stream(s.classes().trim().split("\\s+"))
                .limit(SIGNATURE_CLASS_TOKENS)
                .collect(Collectors.joining(" "))
                .toLowerCase(Locale.ROOT);
        return text + "|" + (bg == null ? "transparent" : bg) + "|" + classes;
    }

    private static ButtonCandidate toCandidate(int index, Scored scored, String signature, int occurrences) {
        StyleSnapshot s = scored.snapshot();
        StyleSnapshot.Colors c = s.colors();
        String border = c.borderWidth() > 0 ? CssColors.hexify(c.border()) : null;
        String text = CssColors.hexify(c.text());
        return new ButtonCandidate(
                index,
                s.text(),
                s.classes(),
                CssColors.hexify(c.background()),
                text == null ? "#000000" : text,
                border,
                s.radius() != null && s.radius() > 0 ? formatPx(s.radius()) : "0px",
                s.shadow(),
                scored.score(),
                signature,
                occurrences,
                c.background(),
                c.text(),
                c.border());
    }

    static String formatPx(double v) {
        if (v == Math.rint(v)) return ((long) v) + "px";
        return v + "px";
    }

    private record Scored(StyleSnapshot snapshot, double score) {}
}
