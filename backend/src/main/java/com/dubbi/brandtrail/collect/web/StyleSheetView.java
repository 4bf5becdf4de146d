package com.dubbi.brandtrail.collect.web;

import java.util.List;

public interface StyleSheetView {

    /** 외부 스타일시트 주소, 인라인이면 null */
    String href();

    /**
     * @throws StyleSheetAccessException cross-origin 등으로 규칙을 읽을 수 없을 때
     */
    List<CssRuleView> cssRules() throws StyleSheetAccessException;
}
