package com.dubbi.brandtrail.collect.domain;

/**
 * 읽지 못하고 건너뛴 스타일시트 또는 규칙
 *
 * @param href 스타일시트 주소 (인라인 &lt;style&gt; 이면 null)
 * @param ruleIndex 규칙 인덱스, 시트 전체를 건너뛴 경우 -1
 * @param reason 건너뛴 이유
 */
public record CssSkip(String href, int ruleIndex, String reason) {
    public static CssSkip sheet(String href, String reason) {
        return new CssSkip(href, -1, reason);
    }

    public static CssSkip rule(String href, int ruleIndex, String reason) {
        return new CssSkip(href, ruleIndex, reason);
    }

    public boolean wholeSheet() {
        return ruleIndex < 0;
    }
}
