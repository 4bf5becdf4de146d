package com.dubbi.brandtrail.merge.domain;

/**
 * 분류기 결과로 바뀔 수 있는 필드
 */
public enum MergeField {
    BUTTON_PRIMARY,
    BUTTON_SECONDARY,
    COLOR_PRIMARY,
    COLOR_ACCENT,
    COLOR_BACKGROUND,
    COLOR_TEXT_PRIMARY,
    COLOR_LINK,
    LOGO
}
