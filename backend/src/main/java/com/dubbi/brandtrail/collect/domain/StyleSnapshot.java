package com.dubbi.brandtrail.collect.domain;

import java.util.List;

/**
 * 샘플링한 요소 하나의 computed style 스냅샷
 *
 * @param tag 소문자 태그 이름
 * @param classes 소문자 class 문자열
 * @param text 잘라낸 텍스트
 * @param radius border-radius px (해석 불가 시 null)
 * @param hasCtaIndicator 명시적 CTA 표시 (cta 클래스, data-cta 등)
 * @param shadow box-shadow (none 이면 null)
 */
public record StyleSnapshot(
        String tag,
        String classes,
        String text,
        Box rect,
        Colors colors,
        Typography typography,
        Double radius,
        boolean isButton,
        boolean isInput,
        boolean isLink,
        boolean hasCtaIndicator,
        String shadow
) {
    public StyleSnapshot {
        tag = tag == null ? "" : tag;
        classes = classes == null ? "" : classes;
        text = text == null ? "" : text;
        rect = rect == null ? new Box(0, 0) : rect;
        colors = colors == null ? new Colors(null, null, null, 0) : colors;
        typography = typography == null ? new Typography(null, List.of(), null, null) : typography;
    }

    public record Box(double w, double h) {
        public double area() {
            return Math.max(0, w) * Math.max(0, h);
        }
    }

    /**
     * 원본 색상 문자열 (computed 값 그대로)
     */
    public record Colors(String text, String background, String border, double borderWidth) {}

    public record Typography(String family, List<String> fontStack, String size, Integer weight) {
        public Typography {
            fontStack = RawBrandingRecord.nonNull(fontStack);
        }
    }
}
