package com.dubbi.brandtrail.collect.web;

import java.util.List;
import java.util.Optional;

/**
 * 브라우저 자동화 계층이 제공하는 페이지 읽기 기능.
 * 수집 로직은 이 인터페이스만 사용하므로 실제 브라우저 없이 fixture 로 테스트할 수 있다.
 */
public interface PageAccessor {

    /** 문서 순서대로 selector 와 일치하는 요소들 */
    List<PageElement> querySelectorAll(String selector);

    default Optional<PageElement> querySelector(String selector) {
        List<PageElement> all = querySelectorAll(selector);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    /** &lt;html&gt; */
    Optional<PageElement> documentElement();

    Optional<PageElement> body();

    List<StyleSheetView> styleSheets();

    /**
     * canvas fillStyle 로 색상 이름을 해석 (red → #ff0000). 해석할 수 없으면 null
     */
    String canvasFillStyle(String color);

    String title();
}
