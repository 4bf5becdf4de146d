package com.dubbi.brandtrail.inference.service;

import com.dubbi.brandtrail.collect.domain.StyleSnapshot;
import com.dubbi.brandtrail.collect.domain.TypographySignals;
import com.dubbi.brandtrail.common.util.FontNames;
import com.dubbi.brandtrail.inference.domain.BrandingParts.FontFamilies;
import com.dubbi.brandtrail.inference.domain.BrandingParts.FontSizes;
import com.dubbi.brandtrail.inference.domain.BrandingParts.FontUsage;
import com.dubbi.brandtrail.inference.domain.BrandingParts.TypographyProfile;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class TypographyInference {
    static final int MAX_FONTS = 10;

    private TypographyInference() {}

    public static TypographyProfile profile(TypographySignals signals) {
        String primary = firstOr(signals.bodyStack(), FontNames.DEFAULT_FAMILY);
        String heading = firstOr(signals.headingStack(), primary);

        Map<String, List<String>> stacks = new LinkedHashMap<>();
        stacks.put("body", signals.bodyStack());
        stacks.put("heading", signals.headingStack());

        return new TypographyProfile(
                new FontFamilies(primary, heading),
                stacks,
                new FontSizes(
                        orDefault(signals.h1Size(), "32px"),
                        orDefault(signals.h2Size(), "24px"),
                        orDefault(signals.bodySize(), "16px")));
    }

    /**
     * body/heading 스택과 모든 스냅샷 스택에서 폰트 빈도를 세어 상위 10개. 일반 키워드는 제외
     */
    public static List<FontUsage> fonts(TypographySignals signals, List<StyleSnapshot> snapshots) {
        Map<String, Integer> freq = new LinkedHashMap<>();
        count(freq, signals.bodyStack());
        count(freq, signals.headingStack());
        for (StyleSnapshot s : snapshots) {
            count(freq, s.typography().fontStack());
        }

        List<Map.Entry<String, Integer>> entries = new ArrayList<>(freq.entrySet());
        entries.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));
        return entries.stream()
                .limit(MAX_FONTS)
                .map(e -> new FontUsage(e.getKey(), e.getValue()))
                .toList();
    }

    private static void count(Map<String, Integer> freq, List<String> stack) {
        for (String family : stack) {
            if (family == null || family.isBlank() || FontNames.isGeneric(family)) continue;
            freq.merge(family, 1, Integer::sum);
        }
    }

    private static String firstOr(List<String> stack, String fallback) {
        return stack.isEmpty() ? fallback : stack.get(0);
    }

    private static String orDefault(String v, String fallback) {
        return v == null || v.isBlank() ? fallback : v;
    }
}
