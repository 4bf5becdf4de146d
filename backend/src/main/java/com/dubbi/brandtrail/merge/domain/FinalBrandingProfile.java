package com.dubbi.brandtrail.merge.domain;

import com.dubbi.brandtrail.collect.domain.ColorScheme;
import com.dubbi.brandtrail.inference.domain.BrandingDebug;
import com.dubbi.brandtrail.inference.domain.BrandingParts.BrandImages;
import com.dubbi.brandtrail.inference.domain.BrandingParts.ComponentStyles;
import com.dubbi.brandtrail.inference.domain.BrandingParts.FontUsage;
import com.dubbi.brandtrail.inference.domain.BrandingParts.SpacingProfile;
import com.dubbi.brandtrail.inference.domain.BrandingParts.TypographyProfile;
import com.dubbi.brandtrail.inference.domain.ButtonCandidate;
import com.dubbi.brandtrail.inference.domain.HeuristicBrandingProfile;
import com.dubbi.brandtrail.inference.domain.Palette;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 호출자에게 돌려주는 최종 프로필.
 * buttonCandidates 와 debug 는 디버그 출력이 켜진 경우에만 채워진다.
 *
 * @param fieldSources 필드별로 규칙 기반 값을 유지했는지, 분류기 값으로 바꿨는지
 */
public record FinalBrandingProfile(
        ColorScheme colorScheme,
        List<FontUsage> fonts,
        Palette colors,
        TypographyProfile typography,
        SpacingProfile spacing,
        ComponentStyles components,
        BrandImages images,
        Set<String> frameworkHints,
        Map<MergeField, FieldSource> fieldSources,
        List<ButtonCandidate> buttonCandidates,
        BrandingDebug debug
) {
    public FinalBrandingProfile {
        fonts = fonts == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(fonts));
        frameworkHints = frameworkHints == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(frameworkHints));
        Map<MergeField, FieldSource> sources = new EnumMap<>(allKept());
        if (fieldSources != null) sources.putAll(fieldSources);
        fieldSources = Collections.unmodifiableMap(sources);
        buttonCandidates = buttonCandidates == null ? null : Collections.unmodifiableList(new ArrayList<>(buttonCandidates));
    }

    /**
     * 규칙 기반 프로필을 그대로 옮긴다. includeDebug 가 false 면 진단 정보는 제거
     */
    public static FinalBrandingProfile fromHeuristic(HeuristicBrandingProfile h, boolean includeDebug) {
        return new FinalBrandingProfile(
                h.colorScheme(),
                h.fonts(),
                h.colors(),
                h.typography(),
                h.spacing(),
                h.components(),
                h.images(),
                h.frameworkHints(),
                allKept(),
                includeDebug ? h.buttonCandidates() : null,
                includeDebug ? h.debug() : null);
    }

    public static Map<MergeField, FieldSource> allKept() {
        EnumMap<MergeField, FieldSource> sources = new EnumMap<>(MergeField.class);
        for (MergeField f : MergeField.values()) sources.put(f, FieldSource.KEPT_HEURISTIC);
        return sources;
    }

    public FieldSource sourceOf(MergeField field) {
        return fieldSources.getOrDefault(field, FieldSource.KEPT_HEURISTIC);
    }
}
