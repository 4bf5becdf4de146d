package com.dubbi.brandtrail.collect.web;

/**
 * 스타일시트나 규칙을 읽을 수 없음 (cross-origin, 잘못된 규칙 등)
 */
public class StyleSheetAccessException extends Exception {
    public StyleSheetAccessException(String message) {
        super(message);
    }
}
