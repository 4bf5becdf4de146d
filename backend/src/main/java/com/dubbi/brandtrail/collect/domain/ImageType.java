package com.dubbi.brandtrail.collect.domain;

/**
 * 페이지에서 수집한 이미지의 출처
 */
public enum ImageType {
    FAVICON,
    OG,
    TWITTER,
    LOGO,
    LOGO_SVG
}
