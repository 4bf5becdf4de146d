package com.dubbi.brandtrail.collect.domain;

public enum ColorScheme {
    LIGHT,
    DARK;

    public static ColorScheme fromNullable(String raw) {
        if (raw == null) return LIGHT;
        try {
            return ColorScheme.valueOf(raw.trim().toUpperCase());
        } catch (Exception ignored) {
            return LIGHT;
        }
    }

    public boolean isDark() {
        return this == DARK;
    }
}
