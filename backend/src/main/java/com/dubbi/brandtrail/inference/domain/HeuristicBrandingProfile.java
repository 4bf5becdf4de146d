package com.dubbi.brandtrail.inference.domain;

import com.dubbi.brandtrail.collect.domain.ColorScheme;
import com.dubbi.brandtrail.inference.domain.BrandingParts.BrandImages;
import com.dubbi.brandtrail.inference.domain.BrandingParts.ComponentStyles;
import com.dubbi.brandtrail.inference.domain.BrandingParts.FontUsage;
import com.dubbi.brandtrail.inference.domain.BrandingParts.SpacingProfile;
import com.dubbi.brandtrail.inference.domain.BrandingParts.TypographyProfile;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 규칙 기반 추론만으로 만든 브랜딩 프로필
 *
 * @param buttonCandidates 점수순, 중복 제거, 최대 80개
 */
public record HeuristicBrandingProfile(
        ColorScheme colorScheme,
        List<FontUsage> fonts,
        Palette colors,
        TypographyProfile typography,
        SpacingProfile spacing,
        ComponentStyles components,
        BrandImages images,
        List<ButtonCandidate> buttonCandidates,
        Set<String> frameworkHints,
        BrandingDebug debug
) {
    public HeuristicBrandingProfile {
        fonts = fonts == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(fonts));
        buttonCandidates = buttonCandidates == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(buttonCandidates));
        frameworkHints = frameworkHints == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(frameworkHints));
    }
}
