package com.dubbi.brandtrail.classify;

/**
 * 분류기 응답. 각 부분과 필드는 없을 수 있다(null).
 */
public record SemanticEnhancement(
        ButtonClassification buttonClassification,
        ColorRoles colorRoles,
        LogoSelection logoSelection
) {
    public record ButtonClassification(Integer primaryButtonIndex, Integer secondaryButtonIndex, Double confidence) {}

    public record ColorRoles(
            String primary,
            String accent,
            String background,
            String textPrimary,
            String link,
            Double confidence
    ) {}

    public record LogoSelection(Integer selectedLogoIndex, Double confidence) {}
}
