package com.dubbi.brandtrail.collect.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 렌더링된 페이지 하나에서 수집한 브랜딩 신호 묶음.
 * 한 번 만들어져 한 번 소비된다.
 *
 * @param pageBackground html/body 에서 읽은 명시적 페이지 배경 (정규화된 hex, 없으면 null)
 * @param brandName og:site_name / application-name / title 에서 얻은 브랜드 이름 힌트
 */
public record RawBrandingRecord(
        CssData cssData,
        List<StyleSnapshot> snapshots,
        List<ImageRef> images,
        ColorScheme colorScheme,
        String pageBackground,
        TypographySignals typography,
        Set<String> frameworkHints,
        List<BackgroundCandidate> backgroundCandidates,
        List<LogoCandidate> logoCandidates,
        String brandName
) {
    public RawBrandingRecord {
        cssData = cssData == null ? CssData.empty() : cssData;
        snapshots = nonNull(snapshots);
        images = nonNull(images);
        colorScheme = colorScheme == null ? ColorScheme.LIGHT : colorScheme;
        typography = typography == null ? TypographySignals.empty() : typography;
        frameworkHints = frameworkHints == null ? Set.of() : Collections.unmodifiableSet(frameworkHints.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.<String, LinkedHashSet<String>>toCollection(LinkedHashSet::new)));
        backgroundCandidates = nonNull(backgroundCandidates);
        logoCandidates = nonNull(logoCandidates);
    }

    // 누락된 항목(null)은 버린다
    static <T> List<T> nonNull(List<T> items) {
        return items == null ? List.of() : items.stream().filter(Objects::nonNull).toList();
    }
}
