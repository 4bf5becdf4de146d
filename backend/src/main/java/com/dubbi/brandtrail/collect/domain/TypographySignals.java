package com.dubbi.brandtrail.collect.domain;

import java.util.List;

/**
 * 역할별 폰트 스택과 대표 폰트 크기
 */
public record TypographySignals(
        List<String> bodyStack,
        List<String> headingStack,
        String h1Size,
        String h2Size,
        String bodySize
) {
    public TypographySignals {
        bodyStack = RawBrandingRecord.nonNull(bodyStack);
        headingStack = RawBrandingRecord.nonNull(headingStack);
    }

    public static TypographySignals empty() {
        return new TypographySignals(List.of(), List.of(), null, null, null);
    }
}
