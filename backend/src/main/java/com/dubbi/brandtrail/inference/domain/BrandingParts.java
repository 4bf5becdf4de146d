package com.dubbi.brandtrail.inference.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 브랜딩 프로필을 구성하는 값 타입들
 */
public final class BrandingParts {
    private BrandingParts() {}

    public record FontUsage(String family, int count) {}

    public record FontFamilies(String primary, String heading) {}

    public record FontSizes(String h1, String h2, String body) {}

    /**
     * @param fontStacks 역할(body, heading) → 폰트 스택
     */
    public record TypographyProfile(
            FontFamilies fontFamilies,
            Map<String, List<String>> fontStacks,
            FontSizes fontSizes
    ) {
        public TypographyProfile {
            fontStacks = fontStacks == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fontStacks));
        }
    }

    /**
     * @param baseUnit 2, 4, 6, 8, 10, 12 중 하나
     * @param borderRadius "8px" 형식
     */
    public record SpacingProfile(int baseUnit, String borderRadius) {}

    /**
     * 버튼 스타일. background 가 null 이면 투명 배경
     */
    public record ButtonStyle(String background, String textColor, String borderColor, String borderRadius) {}

    public record InputStyle(String borderColor, String borderRadius) {}

    public record ComponentStyles(ButtonStyle buttonPrimary, ButtonStyle buttonSecondary, InputStyle input) {
        public ComponentStyles withButtonPrimary(ButtonStyle style) {
            return new ComponentStyles(style, buttonSecondary, input);
        }

        public ComponentStyles withButtonSecondary(ButtonStyle style) {
            return new ComponentStyles(buttonPrimary, style, input);
        }
    }

    public record BrandImages(String logo, String favicon, String ogImage) {
        public BrandImages withLogo(String src) {
            return new BrandImages(src, favicon, ogImage);
        }
    }
}
