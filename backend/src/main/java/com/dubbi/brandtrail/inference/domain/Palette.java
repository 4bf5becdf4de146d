package com.dubbi.brandtrail.inference.domain;

/**
 * 역할별 브랜드 색상. 각 값은 정규화된 hex 또는 null
 */
public record Palette(
        String primary,
        String accent,
        String background,
        String textPrimary,
        String link
) {
    public Palette withPrimary(String v) {
        return new Palette(v, accent, background, textPrimary, link);
    }

    public Palette withAccent(String v) {
        return new Palette(primary, v, background, textPrimary, link);
    }

    public Palette withBackground(String v) {
        return new Palette(primary, accent, v, textPrimary, link);
    }

    public Palette withTextPrimary(String v) {
        return new Palette(primary, accent, background, v, link);
    }

    public Palette withLink(String v) {
        return new Palette(primary, accent, background, textPrimary, v);
    }
}
