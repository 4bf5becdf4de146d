package com.dubbi.brandtrail.common.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CSS 길이 값을 px 로 변환
 */
public class CssUnits {
    public static final double DEFAULT_FONT_SIZE = 16.0;

    private static final Pattern LEADING_NUMBER = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)");

    private CssUnits() {}

    /**
     * auto → null, px → 그대로, rem → 루트 폰트 크기 배수, em → body 폰트 크기 배수,
     * % → null (레이아웃 없이는 모호함), 그 외 숫자로 파싱 가능하면 숫자
     */
    public static Double toPx(String value, double rootFontSize, double bodyFontSize) {
        if (value == null) return null;
        String v = value.trim();
        if (v.isEmpty() || v.equals("auto")) return null;

        if (v.endsWith("px")) return leadingNumber(v);
        if (v.endsWith("rem")) {
            Double n = leadingNumber(v);
            return n == null ? null : n * rootFontSize;
        }
        if (v.endsWith("em")) {
            Double n = leadingNumber(v);
            return n == null ? null : n * bodyFontSize;
        }
        if (v.endsWith("%")) return null;
        return leadingNumber(v);
    }

    public static Double toPx(String value) {
        return toPx(value, DEFAULT_FONT_SIZE, DEFAULT_FONT_SIZE);
    }

    /**
     * "15px" 같은 computed font-size 를 숫자로. 해석 불가 시 16
     */
    public static double fontSizeOrDefault(String computedFontSize) {
        Double px = toPx(computedFontSize);
        return px == null || px <= 0 ? DEFAULT_FONT_SIZE : px;
    }

    // parseFloat 과 같이 앞쪽 숫자만 읽는다 ("8px 16px" → 8)
    private static Double leadingNumber(String v) {
        Matcher m = LEADING_NUMBER.matcher(v);
        if (!m.find()) return null;
        try {
            double d = Double.parseDouble(m.group());
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
