package com.dubbi.brandtrail.collect.web;

public enum CssRuleType {
    STYLE,
    FONT_FACE,
    OTHER;

    public static CssRuleType fromNullable(String raw) {
        if (raw == null) return OTHER;
        try {
            return CssRuleType.valueOf(raw.trim().toUpperCase());
        } catch (Exception ignored) {
            return OTHER;
        }
    }
}
