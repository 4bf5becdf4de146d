package com.dubbi.brandtrail.collect.domain;

/**
 * 로고 후보. 분류기에 인덱스로 전달되며, 선택된 인덱스의 src 가 최종 로고가 된다.
 *
 * @param src 이미지 URL 또는 data:image/svg+xml URI
 * @param alt img alt 또는 svg id/class
 * @param svg 인라인 SVG 여부
 * @param inHeader header/nav/banner 안에 있는지
 * @param insideHeaderLink header 영역 링크 안에 있는지 (1순위 후보)
 * @param top 뷰포트 기준 상단 좌표
 */
public record LogoCandidate(
        String src,
        String alt,
        boolean svg,
        boolean inHeader,
        boolean insideHeaderLink,
        double top,
        double width,
        double height
) {}
