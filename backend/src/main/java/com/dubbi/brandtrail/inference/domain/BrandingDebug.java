package com.dubbi.brandtrail.inference.domain;

import com.dubbi.brandtrail.collect.domain.BackgroundCandidate;
import com.dubbi.brandtrail.collect.domain.CssSkip;
import java.util.List;

/**
 * 디버그 출력 전용 진단 정보 (branding.debug 가 켜진 경우에만 응답에 남는다)
 */
public record BrandingDebug(
        List<ColorFrequency> allDetectedColors,
        List<BackgroundCandidate> backgroundCandidates,
        List<String> rawCssColors,
        List<String> rawCssFonts,
        SnapshotColors snapshotColors,
        Palette inferredPalette,
        List<CssSkip> skippedCss,
        EnhancementConfidence enhancement
) {
    public BrandingDebug {
        allDetectedColors = allDetectedColors == null ? List.of() : List.copyOf(allDetectedColors);
        backgroundCandidates = backgroundCandidates == null ? List.of() : List.copyOf(backgroundCandidates);
        rawCssColors = rawCssColors == null ? List.of() : List.copyOf(rawCssColors);
        rawCssFonts = rawCssFonts == null ? List.of() : List.copyOf(rawCssFonts);
        skippedCss = skippedCss == null ? List.of() : List.copyOf(skippedCss);
    }

    public BrandingDebug withEnhancement(EnhancementConfidence confidence) {
        return new BrandingDebug(allDetectedColors, backgroundCandidates, rawCssColors, rawCssFonts, snapshotColors,
                inferredPalette, skippedCss, confidence);
    }

    public record ColorFrequency(String hex, double frequency, boolean grayish, double yiq) {}

    /**
     * @param area 배경색의 경우 요소 면적, 그 외 0
     */
    public record SnapshotColor(String hex, double area, String tag, String classes) {}

    public record SnapshotColors(List<SnapshotColor> backgrounds, List<SnapshotColor> texts, List<SnapshotColor> borders) {
        public SnapshotColors {
            backgrounds = backgrounds == null ? List.of() : List.copyOf(backgrounds);
            texts = texts == null ? List.of() : List.copyOf(texts);
            borders = borders == null ? List.of() : List.copyOf(borders);
        }
    }

    /**
     * 분류기 결과의 신뢰도. 병합 여부에는 쓰이지 않는다.
     */
    public record EnhancementConfidence(
            Integer primaryButtonIndex,
            Integer secondaryButtonIndex,
            Double buttonConfidence,
            Double colorConfidence,
            Integer selectedLogoIndex,
            Double logoConfidence
    ) {}
}
