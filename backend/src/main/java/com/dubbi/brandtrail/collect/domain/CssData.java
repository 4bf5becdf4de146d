package com.dubbi.brandtrail.collect.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 스타일시트 규칙에서 모은 값들
 *
 * @param colors 규칙에 나온 서로 다른 색상 (정규화된 hex, 등장 순서)
 * @param radii border-radius px 값
 * @param spacings margin/padding/gap px 값
 * @param customProperties CSS 변수 테이블 (--name → 값)
 * @param fonts @font-face 및 font-family 선언의 폰트 이름
 * @param skipped 접근할 수 없어 건너뛴 시트/규칙
 */
public record CssData(
        Set<String> colors,
        Set<Double> radii,
        Set<Double> spacings,
        Map<String, String> customProperties,
        List<String> fonts,
        List<CssSkip> skipped
) {
    public CssData {
        colors = nonNullSet(colors);
        radii = nonNullSet(radii);
        spacings = nonNullSet(spacings);
        Map<String, String> props = new LinkedHashMap<>();
        if (customProperties != null) {
            customProperties.forEach((k, v) -> {
                if (k != null && v != null) props.put(k, v);
            });
        }
        customProperties = Collections.unmodifiableMap(props);
        fonts = RawBrandingRecord.nonNull(fonts);
        skipped = RawBrandingRecord.nonNull(skipped);
    }

    private static <T> Set<T> nonNullSet(Set<T> items) {
        if (items == null) return Set.of();
        return Collections.unmodifiableSet(items.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.<T, LinkedHashSet<T>>toCollection(LinkedHashSet::new)));
    }

    public static CssData empty() {
        return new CssData(Set.of(), Set.of(), Set.of(), Map.of(), List.of(), List.of());
    }
}
