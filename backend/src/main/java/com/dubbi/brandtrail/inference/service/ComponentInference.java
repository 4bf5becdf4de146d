package com.dubbi.brandtrail.inference.service;

import com.dubbi.brandtrail.collect.domain.StyleSnapshot;
import com.dubbi.brandtrail.common.util.CssColors;
import com.dubbi.brandtrail.inference.domain.BrandingParts.ButtonStyle;
import com.dubbi.brandtrail.inference.domain.BrandingParts.ComponentStyles;
import com.dubbi.brandtrail.inference.domain.BrandingParts.InputStyle;
import com.dubbi.brandtrail.inference.domain.Palette;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 버튼/입력 컴포넌트 스타일 추론
 * primary: primary 클래스 → 가장 큰 유효 색 버튼 → 아무 버튼
 * secondary: secondary 클래스 → 2개 이상 반복되는 스타일 그룹 → 시각적으로 구분되는 버튼
 */
public class ComponentInference {
    static final String DEFAULT_INPUT_BORDER = "#CCCCCC";
    private static final int MIN_GROUP_SIZE = 2;

    private ComponentInference() {}

    public static ComponentStyles infer(List<StyleSnapshot> snapshots, Palette palette, String medianRadius) {
        List<StyleSnapshot> buttons = snapshots.stream().filter(StyleSnapshot::isButton).toList();

        StyleSnapshot byPrimaryClass = buttons.stream()
                .filter(s -> s.classes().contains("primary") || s.classes().contains("cta"))
                .findFirst().orElse(null);
        StyleSnapshot bySecondaryClass = buttons.stream()
                .filter(ComponentInference::hasSecondaryClass)
                .findFirst().orElse(null);

        List<StyleSnapshot> colored = new ArrayList<>(buttons.stream()
                .filter(s -> CssColors.isColorValid(s.colors().background()))
                .toList());
        colored.sort(Comparator.comparingDouble((StyleSnapshot s) -> s.rect().area()).reversed());

        StyleSnapshot primaryBtn;
        if (byPrimaryClass != null && CssColors.isColorValid(byPrimaryClass.colors().background())) {
            primaryBtn = byPrimaryClass;
        } else if (!colored.isEmpty()) {
            primaryBtn = colored.get(0);
        } else if (byPrimaryClass != null) {
            primaryBtn = byPrimaryClass;
        } else {
            primaryBtn = buttons.isEmpty() ? null : buttons.get(0);
        }

        StyleSnapshot secondaryBtn = bySecondaryClass != null ? bySecondaryClass : pickSecondary(buttons, primaryBtn);

        ButtonStyle primary = primaryStyle(primaryBtn, palette, medianRadius);
        ButtonStyle secondary = secondaryBtn == null ? null : secondaryStyle(secondaryBtn, palette, primary.borderRadius());

        StyleSnapshot input = snapshots.stream().filter(StyleSnapshot::isInput).findFirst().orElse(null);
        String inputBorder = input == null ? null : CssColors.hexify(input.colors().border());

        return new ComponentStyles(primary, secondary,
                new InputStyle(inputBorder == null ? DEFAULT_INPUT_BORDER : inputBorder, medianRadius));
    }

    static boolean hasSecondaryClass(StyleSnapshot s) {
        if (s.classes().isBlank()) return false;
        for (String cls : s.classes().trim().split("\\s+")) {
            if (cls.equals("outline") || cls.equals("ghost")) return true;
            if (cls.contains("secondary") && !cls.contains("tertiary")) return true;
        }
        return false;
    }

    private static StyleSnapshot pickSecondary(List<StyleSnapshot> buttons, StyleSnapshot primaryBtn) {
        List<StyleSnapshot> others = buttons.stream().filter(b -> b != primaryBtn).toList();
        if (others.isEmpty()) return null;

        String primarySignature = styleSignature(primaryBtn);
        Map<String, List<StyleSnapshot>> groups = new LinkedHashMap<>();
        for (StyleSnapshot b : others) {
            String sig = styleSignature(b);
            if (sig.equals(primarySignature)) continue;
            groups.computeIfAbsent(sig, k -> new ArrayList<>()).add(b);
        }

        List<StyleSnapshot> top = groups.values().stream()
                .filter(g -> g.size() >= MIN_GROUP_SIZE)
                .max(Comparator.comparingInt(List::size))
                .orElse(null);
        if (top != null) return top.get(0);

        boolean primaryHasBorder = primaryBtn != null && CssColors.isColorValid(primaryBtn.colors().border());
        String primaryBg = primaryBtn == null ? null : primaryBtn.colors().background();
        return others.stream()
                .filter(b -> {
                    boolean differentBg = !Objects.equals(b.colors().background(), primaryBg);
                    boolean hasBorder = CssColors.isColorValid(b.colors().border());
                    return differentBg || (hasBorder && !primaryHasBorder);
                })
                .findFirst().orElse(null);
    }

    private static String styleSignature(StyleSnapshot b) {
        if (b == null) return "transparent|none|inherit";
        StyleSnapshot.Colors c = b.colors();
        return (c.background() == null ? "transparent" : c.background()) + "|"
                + (c.border() == null ? "none" : c.border()) + "|"
                + (c.text() == null ? "inherit" : c.text());
    }

    private static ButtonStyle primaryStyle(StyleSnapshot btn, Palette palette, String medianRadius) {
        String bg = btn != null && CssColors.isColorValid(btn.colors().background())
                ? CssColors.hexify(btn.colors().background())
                : palette.primary();
        String text = btn == null ? null : CssColors.hexify(btn.colors().text());
        if (text == null) text = CssColors.readableTextOn(bg);
        String radius = btn != null && btn.radius() != null && btn.radius() > 0
                ? Math.round(btn.radius()) + "px"
                : medianRadius;
        return new ButtonStyle(bg, text, null, radius);
    }

    private static ButtonStyle secondaryStyle(StyleSnapshot btn, Palette palette, String primaryRadius) {
        StyleSnapshot.Colors c = btn.colors();
        String bg = CssColors.isColorValid(c.background()) ? CssColors.hexify(c.background()) : null;
        String border = CssColors.isColorValid(c.border()) ? CssColors.hexify(c.border()) : palette.primary();
        String text = CssColors.hexify(c.text());
        String radius = btn.radius() != null && btn.radius() > 0 ? Math.round(btn.radius()) + "px" : primaryRadius;
        return new ButtonStyle(bg, text == null ? palette.primary() : text, border, radius);
    }
}
