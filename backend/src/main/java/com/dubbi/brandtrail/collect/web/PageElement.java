package com.dubbi.brandtrail.collect.web;

import java.util.List;
import java.util.Map;

/**
 * 렌더링된 페이지의 요소 하나에 대한 읽기 전용 접근
 */
public interface PageElement {

    /**
     * 같은 DOM 요소면 같은 값 (샘플 중복 제거용)
     */
    Object identity();

    /** 소문자 태그 이름 */
    String tagName();

    /** class 문자열 (SVG 는 className.baseVal) */
    String className();

    String attribute(String name);

    /**
     * 브라우저가 해석한 URL 속성 (img.src, link.href 등). 해석할 수 없으면 속성 원본
     */
    String urlProperty(String name);

    /** innerText 또는 textContent, 앞뒤 공백 제거 */
    String text();

    /**
     * 여러 computed style 값을 한 번에 읽는다. 값이 없으면 빈 문자열
     */
    Map<String, String> computedStyles(List<String> properties);

    default String computedStyle(String property) {
        String value = computedStyles(List.of(property)).get(property);
        return value == null ? "" : value;
    }

    ElementBox box();

    boolean matches(String selector);

    /**
     * 자기 자신 또는 조상 중 selector 와 일치하는 요소가 있는지 (element.closest)
     */
    boolean hasAncestor(String selector);

    /** 직렬화된 마크업 (SVG 는 XML 직렬화) */
    String markup();

    /**
     * 자신과 모든 하위 요소의 computed style, 문서 순서
     */
    List<Map<String, String>> subtreeComputedStyles(List<String> properties);

    record ElementBox(double width, double height, double top) {
        public double area() {
            return Math.max(0, width) * Math.max(0, height);
        }
    }
}
