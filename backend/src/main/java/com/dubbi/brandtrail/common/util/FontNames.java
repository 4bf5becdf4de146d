package com.dubbi.brandtrail.common.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * font-family 값 파싱 유틸리티
 */
public class FontNames {
    public static final String DEFAULT_FAMILY = "system-ui, sans-serif";

    private static final Set<String> GENERIC = Set.of(
            "inherit", "initial", "unset", "revert",
            "ui-sans-serif", "ui-serif", "ui-monospace", "ui-rounded",
            "system-ui", "-apple-system", "blinkmacsystemfont",
            "sans-serif", "serif", "monospace", "cursive", "fantasy", "math", "fangsong",
            "emoji", "apple color emoji", "segoe ui emoji", "segoe ui symbol", "noto color emoji"
    );

    private FontNames() {}

    /**
     * Next.js 가 생성한 폰트 이름 정리
     * "__Roboto_Mono_c8ca7d" → "Roboto Mono", "__suisse_Fallback_6d5c28" → null (fallback 은 제외)
     */
    public static String cleanNextJsFontName(String fontName) {
        if (fontName == null) return null;
        if (!fontName.startsWith("__")) return fontName;
        if (fontName.contains("_Fallback_")) return null;

        String cleaned = fontName.replaceFirst("^__", "").replaceFirst("_[a-f0-9]{6}$", "");
        List<String> words = new ArrayList<>();
        for (String word : cleaned.split("_")) {
            if (word.isEmpty()) continue;
            words.add(word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT));
        }
        return words.isEmpty() ? null : String.join(" ", words);
    }

    /**
     * "\"Inter\", __Inter_Fallback_abc123, sans-serif" → [Inter, sans-serif]
     * 따옴표 제거, var() 참조와 빈 항목 제외
     */
    public static List<String> parseStack(String fontFamily) {
        List<String> stack = new ArrayList<>();
        if (fontFamily == null || fontFamily.isBlank()) return stack;
        for (String part : fontFamily.split(",")) {
            String name = part.replace("\"", "").replace("'", "").trim();
            if (name.isEmpty() || name.contains("var(")) continue;
            String cleaned = cleanNextJsFontName(name);
            if (cleaned != null && !stack.contains(cleaned)) stack.add(cleaned);
        }
        return stack;
    }

    public static boolean isGeneric(String family) {
        return family == null || GENERIC.contains(family.trim().toLowerCase(Locale.ROOT));
    }
}
