package com.dubbi.brandtrail.collect.web;

import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.Page;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 이미 로드된 Playwright Page 위에서 동작하는 PageAccessor.
 * 페이지 이동, 로드 대기, 스크린샷은 호출자 책임이며 여기서는 DOM 을 읽기만 한다.
 */
public class PlaywrightPageAccessor implements PageAccessor {
    private final Page page;

    public PlaywrightPageAccessor(Page page) {
        this.page = page;
    }

    @Override
    public List<PageElement> querySelectorAll(String selector) {
        List<PageElement> out = new ArrayList<>();
        for (ElementHandle handle : page.querySelectorAll(selector)) {
            out.add(new PlaywrightPageElement(handle));
        }
        return out;
    }

    @Override
    public Optional<PageElement> documentElement() {
        return single("html");
    }

    @Override
    public Optional<PageElement> body() {
        return single("body");
    }

    private Optional<PageElement> single(String selector) {
        ElementHandle handle = page.querySelector(selector);
        return handle == null ? Optional.empty() : Optional.of(new PlaywrightPageElement(handle));
    }

    @Override
    public List<StyleSheetView> styleSheets() {
        Object raw = page.evaluate("""
            () => {
                const shorthands = [
                    'border-radius', 'margin', 'padding', 'gap',
                    'border-color', 'background', 'font', 'font-family'
                ];
                const message = e => String((e && e.message) || e);
                return Array.from(document.styleSheets).map(sheet => {
                    const href = sheet.href || null;
                    let rules;
                    try {
                        rules = sheet.cssRules;
                    } catch (e) {
                        return { href, error: message(e) };
                    }
                    if (!rules) return { href, rules: [] };
                    return {
                        href,
                        rules: Array.from(rules).map(rule => {
                            const type = rule.type === CSSRule.STYLE_RULE ? 'STYLE'
                                : rule.type === CSSRule.FONT_FACE_RULE ? 'FONT_FACE' : 'OTHER';
                            try {
                                if (type === 'OTHER') return { type, declarations: {} };
                                const s = rule.style;
                                const declarations = {};
                                for (const name of Array.from(s)) declarations[name] = s.getPropertyValue(name);
                                for (const name of shorthands) {
                                    const v = s.getPropertyValue(name);
                                    if (v) declarations[name] = v;
                                }
                                return { type, declarations };
                            } catch (e) {
                                return { type, error: message(e) };
                            }
                        })
                    };
                });
            }
        """);

        List<StyleSheetView> sheets = new ArrayList<>();
        if (!(raw instanceof List<?> list)) return sheets;
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> m)) continue;
            String href = m.get("href") == null ? null : String.valueOf(m.get("href"));
            String error = m.get("error") == null ? null : String.valueOf(m.get("error"));
            List<CssRuleView> rules = new ArrayList<>();
            if (m.get("rules") instanceof List<?> ruleList) {
                for (Object r : ruleList) {
                    if (!(r instanceof Map<?, ?> rm)) continue;
                    rules.add(new EvaluatedRule(
                            CssRuleType.fromNullable(rm.get("type") == null ? null : String.valueOf(rm.get("type"))),
                            PlaywrightPageElement.toStringMap(rm.get("declarations")),
                            rm.get("error") == null ? null : String.valueOf(rm.get("error"))));
                }
            }
            sheets.add(new EvaluatedSheet(href, rules, error));
        }
        return sheets;
    }

    @Override
    public String canvasFillStyle(String color) {
        // 유효하지 않은 색상은 fillStyle 을 바꾸지 않으므로, 서로 다른 초기값 두 번으로 판별
        Object result = page.evaluate("""
            c => {
                const ctx = document.createElement('canvas').getContext('2d');
                if (!ctx) return null;
                ctx.fillStyle = '#000000';
                ctx.fillStyle = c;
                const first = ctx.fillStyle;
                ctx.fillStyle = '#ffffff';
                ctx.fillStyle = c;
                return first === ctx.fillStyle ? first : null;
            }
        """, color);
        return result == null ? null : String.valueOf(result);
    }

    @Override
    public String title() {
        return page.title();
    }

    private record EvaluatedSheet(String href, List<CssRuleView> rules, String error) implements StyleSheetView {
        @Override
        public List<CssRuleView> cssRules() throws StyleSheetAccessException {
            if (error != null) throw new StyleSheetAccessException(error);
            return rules;
        }
    }

    private record EvaluatedRule(CssRuleType type, Map<String, String> values, String error) implements CssRuleView {
        @Override
        public Map<String, String> declarations() throws StyleSheetAccessException {
            if (error != null) throw new StyleSheetAccessException(error);
            return values;
        }
    }
}
