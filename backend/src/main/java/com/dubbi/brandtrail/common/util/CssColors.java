package com.dubbi.brandtrail.common.util;

import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CSS 색상 정규화 유틸리티
 * hex / rgb() / rgba() / color(display-p3|srgb ...) 값을 #RRGGBB 또는 #RRGGBBAA 로 통일한다.
 * 파싱할 수 없는 값은 null 을 돌려주며 예외를 던지지 않는다.
 */
public class CssColors {
    public static final double TRANSPARENT_ALPHA = 0.01;

    private static final Pattern HEX = Pattern.compile("^#([0-9a-fA-F]{3,8})$");
    private static final Pattern COLOR_FN = Pattern.compile(
            "^color\\(\\s*(?:display-p3|srgb)\\s+([\\d.]+)\\s+([\\d.]+)\\s+([\\d.]+)(?:\\s*/\\s*([\\d.]+%?))?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern RGB_FN = Pattern.compile(
            "^rgba?\\(\\s*([\\d.]+)\\s*[,\\s]\\s*([\\d.]+)\\s*[,\\s]\\s*([\\d.]+)(?:\\s*[,/]\\s*([\\d.]+%?))?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern COLOR_NAME = Pattern.compile("^[a-zA-Z]+$");
    private static final Pattern PURE_BLACK_OR_WHITE = Pattern.compile("^#(FFF(FFF)?|000(000)?)$", Pattern.CASE_INSENSITIVE);

    private CssColors() {}

    /**
     * 색상 문자열 정규화 (이름 있는 색상은 해석하지 않음, transparent 제외)
     */
    public static String hexify(String raw) {
        return hexify(raw, null);
    }

    /**
     * 색상 문자열 정규화
     *
     * @param raw 원본 색상 문자열
     * @param namedColorResolver 이름 있는 색상(red, rebeccapurple 등)을 canvas 로 해석하는 함수 (null 가능)
     * @return #RRGGBB / #RRGGBBAA 또는 null
     */
    public static String hexify(String raw, Function<String, String> namedColorResolver) {
        if (raw == null) return null;
        String value = raw.trim();
        if (value.isEmpty()) return null;

        try {
            Matcher hex = HEX.matcher(value);
            if (hex.matches()) {
                return expandHex(hex.group(1));
            }

            Matcher colorFn = COLOR_FN.matcher(value);
            if (colorFn.find()) {
                return toHex(
                        Double.parseDouble(colorFn.group(1)) * 255,
                        Double.parseDouble(colorFn.group(2)) * 255,
                        Double.parseDouble(colorFn.group(3)) * 255,
                        parseAlpha(colorFn.group(4)));
            }

            Matcher rgb = RGB_FN.matcher(value);
            if (rgb.find()) {
                return toHex(
                        Double.parseDouble(rgb.group(1)),
                        Double.parseDouble(rgb.group(2)),
                        Double.parseDouble(rgb.group(3)),
                        parseAlpha(rgb.group(4)));
            }

            if (value.equalsIgnoreCase("transparent")) {
                return "#00000000";
            }

            if (namedColorResolver != null && COLOR_NAME.matcher(value).matches()) {
                String resolved = namedColorResolver.apply(value);
                if (resolved != null && !resolved.equalsIgnoreCase(value)) {
                    return hexify(resolved, null);
                }
            }
        } catch (RuntimeException e) {
            // NumberFormatException 등: 정규화 실패는 null
            return null;
        }
        return null;
    }

    private static String expandHex(String digits) {
        String d = digits.toUpperCase(Locale.ROOT);
        return switch (d.length()) {
            case 3, 4 -> {
                StringBuilder sb = new StringBuilder("#");
                for (char ch : d.toCharArray()) sb.append(ch).append(ch);
                yield sb.toString();
            }
            case 6, 8 -> "#" + d;
            default -> null;
        };
    }

    private static double parseAlpha(String raw) {
        if (raw == null || raw.isBlank()) return 1.0;
        double alpha = raw.endsWith("%")
                ? Double.parseDouble(raw.substring(0, raw.length() - 1)) / 100.0
                : Double.parseDouble(raw);
        alpha = Math.max(0.0, Math.min(1.0, alpha));
        // 소수점 둘째 자리까지 유지
        return Math.round(alpha * 100) / 100.0;
    }

    private static String toHex(double r, double g, double b, double alpha) {
        String rgb = String.format("#%02X%02X%02X", clampChannel(r), clampChannel(g), clampChannel(b));
        if (alpha >= 1.0) return rgb;
        return rgb + String.format("%02X", (int) Math.round(alpha * 255));
    }

    private static int clampChannel(double v) {
        return (int) Math.max(0, Math.min(255, Math.round(v)));
    }

    /**
     * #RRGGBB(AA) 를 [r, g, b] 로 분해. 6자리 미만이면 null
     */
    public static int[] channels(String hex) {
        if (hex == null) return null;
        String h = hex.startsWith("#") ? hex.substring(1) : hex;
        if (h.length() < 6) return null;
        try {
            return new int[]{
                    Integer.parseInt(h.substring(0, 2), 16),
                    Integer.parseInt(h.substring(2, 4), 16),
                    Integer.parseInt(h.substring(4, 6), 16)
            };
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * YIQ 밝기: (R*299 + G*587 + B*114) / 1000, 파싱 불가 시 0
     */
    public static double contrastYIQ(String hex) {
        int[] c = channels(hex);
        if (c == null) return 0;
        return (c[0] * 299 + c[1] * 587 + c[2] * 114) / 1000.0;
    }

    /**
     * 텍스트 색 기본값: 어두운 배경이면 흰색, 밝은 배경이면 거의 검정
     */
    public static String readableTextOn(String backgroundHex) {
        return contrastYIQ(backgroundHex) < 128 ? "#FFFFFF" : "#111111";
    }

    /**
     * 채널 최대-최소 차이가 15 미만이면 회색 계열
     */
    public static boolean isGrayish(String hex) {
        int[] c = channels(hex);
        if (c == null) return true;
        int max = Math.max(c[0], Math.max(c[1], c[2]));
        int min = Math.min(c[0], Math.min(c[1], c[2]));
        return max - min < 15;
    }

    /**
     * 정규화된 hex 의 알파 (0..1). 6자리면 1
     */
    public static double alpha(String hex) {
        if (hex == null) return 0;
        String h = hex.startsWith("#") ? hex.substring(1) : hex;
        if (h.length() != 8) return 1.0;
        try {
            return Integer.parseInt(h.substring(6, 8), 16) / 255.0;
        } catch (NumberFormatException e) {
            return 1.0;
        }
    }

    public static boolean isTransparent(String hex) {
        return hex == null || alpha(hex) < TRANSPARENT_ALPHA;
    }

    /**
     * 브랜드 색으로 쓸 수 있는 색인지 판단
     * 완전 투명, 순수 검정/흰색은 제외. rgb()/rgba() 는 투명만 아니면 허용, hex 는 YIQ 240 미만만 허용
     */
    public static boolean isColorValid(String color) {
        if (color == null || color.isBlank()) return false;
        String value = color.trim();
        String lower = value.toLowerCase(Locale.ROOT);

        if (lower.startsWith("rgba(") || lower.startsWith("rgb(")) {
            String hex = hexify(value);
            return hex != null && !isTransparent(hex);
        }

        if (PURE_BLACK_OR_WHITE.matcher(value).matches()) return false;
        String hex = hexify(value);
        if (hex == null || isTransparent(hex)) return false;
        if (PURE_BLACK_OR_WHITE.matcher(hex.length() == 9 ? hex.substring(0, 7) : hex).matches()) return false;
        return contrastYIQ(hex) < 240;
    }

    /**
     * WCAG 상대 휘도 (0..1). sRGB 채널을 감마 보정 후 0.2126/0.7152/0.0722 가중 합
     */
    public static double relativeLuminance(String hex) {
        int[] c = channels(hex);
        if (c == null) return 1.0;
        return 0.2126 * linearize(c[0]) + 0.7152 * linearize(c[1]) + 0.0722 * linearize(c[2]);
    }

    private static double linearize(int channel) {
        double s = channel / 255.0;
        return s <= 0.03928 ? s / 12.92 : Math.pow((s + 0.055) / 1.055, 2.4);
    }
}
