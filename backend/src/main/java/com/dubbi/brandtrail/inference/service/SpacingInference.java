package com.dubbi.brandtrail.inference.service;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * 간격 기본 단위와 대표 border-radius 추론
 */
public class SpacingInference {
    public static final int DEFAULT_BASE_UNIT = 8;
    public static final String DEFAULT_BORDER_RADIUS = "8px";

    // 큰 단위부터 시도: 8 의 배수 집합이 4 로 떨어지지 않도록
    private static final int[] CANDIDATES = {12, 10, 8, 6, 4};
    private static final double AGREEMENT = 0.6;
    private static final double MAX_SPACING = 128;

    private SpacingInference() {}

    /**
     * 0 초과 128 이하 값을 반올림한 뒤, 60% 이상이 배수(±1px)인 가장 큰 후보.
     * 없으면 중앙값을 짝수로 반올림해 [2, 12] 로 제한. 값이 없으면 8
     */
    public static int baseUnit(Collection<Double> spacings) {
        if (spacings == null) return DEFAULT_BASE_UNIT;
        List<Long> vs = spacings.stream()
                .filter(Objects::nonNull)
                .filter(v -> Double.isFinite(v) && v > 0 && v <= MAX_SPACING)
                .map(Math::round)
                .toList();
        if (vs.isEmpty()) return DEFAULT_BASE_UNIT;

        for (int c : CANDIDATES) {
            long ok = vs.stream().filter(v -> fits(v, c)).count();
            if ((double) ok / vs.size() >= AGREEMENT) return c;
        }

        List<Long> sorted = vs.stream().sorted().toList();
        long med = sorted.get(sorted.size() / 2);
        long even = Math.round(med / 2.0) * 2;
        return (int) Math.max(2, Math.min(12, even));
    }

    private static boolean fits(long v, int c) {
        long rem = v % c;
        return rem == 0 || Math.abs(rem - c) <= 1 || rem <= 1;
    }

    /**
     * 관측된 radius 의 중앙값 (반올림, px). 값이 없으면 8px
     */
    public static String borderRadius(Collection<Double> radii) {
        if (radii == null) return DEFAULT_BORDER_RADIUS;
        List<Double> rs = radii.stream()
                .filter(Objects::nonNull)
                .filter(Double::isFinite)
                .sorted()
                .toList();
        if (rs.isEmpty()) return DEFAULT_BORDER_RADIUS;
        return Math.round(rs.get(rs.size() / 2)) + "px";
    }
}
