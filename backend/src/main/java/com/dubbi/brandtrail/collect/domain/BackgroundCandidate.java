package com.dubbi.brandtrail.collect.domain;

/**
 * 페이지 배경 후보 (html, body, 앱 루트 컨테이너)
 *
 * @param source 후보를 찾은 위치 (예: "body", "#__next")
 * @param color 정규화된 hex
 * @param area 요소 면적 (px²)
 */
public record BackgroundCandidate(String source, String color, double area) {}
