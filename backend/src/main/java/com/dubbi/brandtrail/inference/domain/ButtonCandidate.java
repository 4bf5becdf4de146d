package com.dubbi.brandtrail.inference.domain;

/**
 * 점수가 매겨지고 중복 제거된 버튼 후보. index 는 분류기에 넘기는 목록에서의 위치.
 *
 * @param background 정규화된 배경색 (해석 불가 시 null)
 * @param borderColor 테두리 두께가 0 보다 클 때만 채워진다
 * @param signature 중복 제거 키: 텍스트|배경|앞쪽 클래스 5개
 * @param occurrences 같은 signature 로 발견된 횟수
 */
public record ButtonCandidate(
        int index,
        String text,
        String classes,
        String background,
        String textColor,
        String borderColor,
        String borderRadius,
        String shadow,
        double score,
        String signature,
        int occurrences,
        String originalBackgroundColor,
        String originalTextColor,
        String originalBorderColor
) {}
