package com.dubbi.brandtrail.inference.service;

import com.dubbi.brandtrail.collect.domain.ColorScheme;
import com.dubbi.brandtrail.collect.domain.StyleSnapshot;
import com.dubbi.brandtrail.common.util.CssColors;
import com.dubbi.brandtrail.inference.domain.BrandingDebug.ColorFrequency;
import com.dubbi.brandtrail.inference.domain.Palette;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * 색상 빈도표로 팔레트를 추론한다.
 * 빈도표는 호출마다 새로 만들어지는 지역 값이다.
 */
public class PaletteInference {
    static final double PAGE_BACKGROUND_WEIGHT = 1000.0;
    static final double TEXT_WEIGHT = 1.0;
    static final double BORDER_WEIGHT = 0.3;
    static final double CSS_WEIGHT = 0.5;

    private static final String WHITE = "#FFFFFF";
    private static final String DARK_DEFAULT_BACKGROUND = "#1A1A1A";

    private PaletteInference() {}

    /**
     * @param palette 추론된 팔레트
     * @param frequencies 가중치 내림차순 빈도표 (디버그용)
     */
    public record PaletteResult(Palette palette, List<ColorFrequency> frequencies) {}

    public static PaletteResult infer(
            List<StyleSnapshot> snapshots,
            Collection<String> cssColors,
            ColorScheme colorScheme,
            String pageBackground
    ) {
        boolean dark = colorScheme != null && colorScheme.isDark();
        Map<String, Double> freq = new LinkedHashMap<>();

        String pageBg = CssColors.hexify(pageBackground);
        if (CssColors.isTransparent(pageBg)) pageBg = null;
        bump(freq, pageBg, PAGE_BACKGROUND_WEIGHT);

        for (StyleSnapshot s : snapshots) {
            double area = Math.max(1, s.rect().area());
            bump(freq, CssColors.hexify(s.colors().background()), 0.5 + Math.log10(area + 10));
            bump(freq, CssColors.hexify(s.colors().text()), TEXT_WEIGHT);
            bump(freq, CssColors.hexify(s.colors().border()), BORDER_WEIGHT);
        }
        for (String c : cssColors) {
            bump(freq, CssColors.hexify(c), CSS_WEIGHT);
        }

        // List.sort 는 안정 정렬이라 동점이면 먼저 본 색이 앞선다
        List<Map.Entry<String, Double>> entries = new ArrayList<>(freq.entrySet());
        entries.sort((a, b) -> Double.compare(b.getValue(), a.getValue()));
        List<String> ranked = entries.stream().map(Map.Entry::getKey).toList();

        String background = WHITE;
        if (pageBg != null && CssColors.isGrayish(pageBg)) {
            background = pageBg;
        }
        if (background.equals(WHITE) || (pageBg == null && !ranked.isEmpty())) {
            if (dark) {
                background = first(ranked, h -> CssColors.isGrayish(h) && CssColors.contrastYIQ(h) < 128 && CssColors.contrastYIQ(h) > 0)
                        .or(() -> first(ranked, h -> CssColors.isGrayish(h) && CssColors.contrastYIQ(h) < 180))
                        .orElse(DARK_DEFAULT_BACKGROUND);
            } else {
                background = first(ranked, h -> CssColors.isGrayish(h) && CssColors.contrastYIQ(h) > 180)
                        .orElse(WHITE);
            }
        }

        String textPrimary = first(ranked, h -> !h.equalsIgnoreCase(WHITE) && CssColors.contrastYIQ(h) < 160)
                .orElse(dark ? WHITE : "#111111");
        String bg = background;
        String primary = first(ranked, h -> !CssColors.isGrayish(h) && !h.equals(textPrimary) && !h.equals(bg))
                .orElse(dark ? WHITE : "#000000");
        String accent = first(ranked, h -> !h.equals(primary) && !CssColors.isGrayish(h))
                .orElse(primary);
        String link = firstLinkColor(snapshots).orElse(accent);

        List<ColorFrequency> frequencies = entries.stream()
                .map(e -> new ColorFrequency(e.getKey(), e.getValue(),
                        CssColors.isGrayish(e.getKey()), CssColors.contrastYIQ(e.getKey())))
                .toList();

        return new PaletteResult(new Palette(primary, accent, background, textPrimary, link), frequencies);
    }

    // 투명색은 빈도표에 넣지 않는다
    private static void bump(Map<String, Double> freq, String hex, double weight) {
        if (hex == null || CssColors.isTransparent(hex)) return;
        freq.merge(hex, weight, Double::sum);
    }

    private static Optional<String> first(List<String> ranked, Predicate<String> test) {
        return ranked.stream().filter(test).findFirst();
    }

    private static Optional<String> firstLinkColor(List<StyleSnapshot> snapshots) {
        return snapshots.stream()
                .filter(s -> "a".equals(s.tag()))
                .findFirst()
                .map(s -> CssColors.hexify(s.colors().text()))
                .filter(h -> !CssColors.isTransparent(h));
    }
}
