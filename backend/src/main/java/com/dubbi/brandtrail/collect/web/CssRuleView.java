package com.dubbi.brandtrail.collect.web;

import java.util.Map;

public interface CssRuleView {

    CssRuleType type();

    /**
     * 선언 목록 (속성 이름 → 값). 축약 속성(margin, border-radius 등)도 포함
     *
     * @throws StyleSheetAccessException 규칙을 읽을 수 없을 때
     */
    Map<String, String> declarations() throws StyleSheetAccessException;
}
