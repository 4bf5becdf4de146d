package com.dubbi.brandtrail.collect.domain;

import java.util.List;

/**
 * 추론 테스트용 스냅샷 생성기
 */
public final class TestSnapshots {
    private TestSnapshots() {}

    public static StyleSnapshot button(String text, String background, String classes, double w, double h) {
        return new StyleSnapshot("button", classes, text, new StyleSnapshot.Box(w, h),
                new StyleSnapshot.Colors("rgb(255, 255, 255)", background, null, 0),
                new StyleSnapshot.Typography(null, List.of(), "16px", 500),
                6.0, true, false, false, false, null);
    }

    public static StyleSnapshot cta(String text, String background) {
        StyleSnapshot b = button(text, background, "hero-cta", 120, 40);
        return new StyleSnapshot(b.tag(), b.classes(), b.text(), b.rect(), b.colors(), b.typography(),
                b.radius(), true, false, false, true, null);
    }

    public static StyleSnapshot withBorder(StyleSnapshot s, String border, double width) {
        StyleSnapshot.Colors c = s.colors();
        return new StyleSnapshot(s.tag(), s.classes(), s.text(), s.rect(),
                new StyleSnapshot.Colors(c.text(), c.background(), border, width), s.typography(),
                s.radius(), s.isButton(), s.isInput(), s.isLink(), s.hasCtaIndicator(), s.shadow());
    }

    public static StyleSnapshot text(String tag, String color, List<String> fontStack) {
        return new StyleSnapshot(tag, "", "Some text", new StyleSnapshot.Box(300, 20),
                new StyleSnapshot.Colors(color, "rgba(0, 0, 0, 0)", null, 0),
                new StyleSnapshot.Typography(fontStack.isEmpty() ? null : fontStack.get(0), fontStack, "16px", 400),
                null, false, false, "a".equals(tag), false, null);
    }

    public static StyleSnapshot block(String background, double w, double h) {
        return new StyleSnapshot("div", "", "", new StyleSnapshot.Box(w, h),
                new StyleSnapshot.Colors("rgb(0, 0, 0)", background, null, 0),
                new StyleSnapshot.Typography(null, List.of(), "16px", 400),
                0.0, false, false, false, false, null);
    }

    public static StyleSnapshot input(String border) {
        return new StyleSnapshot("input", "form-control", "", new StyleSnapshot.Box(200, 36),
                new StyleSnapshot.Colors("rgb(0, 0, 0)", "rgb(255, 255, 255)", border, 1),
                new StyleSnapshot.Typography(null, List.of(), "14px", 400),
                4.0, false, true, false, false, null);
    }
}
