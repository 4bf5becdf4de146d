package com.dubbi.brandtrail.collect.web;

import com.microsoft.playwright.ElementHandle;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Playwright ElementHandle 기반 PageElement
 */
public class PlaywrightPageElement implements PageElement {
    private final ElementHandle handle;
    private Integer documentIndex;

    public PlaywrightPageElement(ElementHandle handle) {
        this.handle = handle;
    }

    @Override
    public Object identity() {
        if (documentIndex == null) {
            // 문서 순서상의 위치를 DOM 요소 식별자로 사용
            Object result = handle.evaluate("el => Array.prototype.indexOf.call(document.getElementsByTagName('*'), el)");
            documentIndex = result instanceof Number n ? n.intValue() : System.identityHashCode(handle);
        }
        return documentIndex;
    }

    @Override
    public String tagName() {
        return asString(handle.evaluate("el => el.tagName.toLowerCase()"));
    }

    @Override
    public String className() {
        return asString(handle.evaluate("""
            el => typeof el.className === 'string'
                ? el.className
                : ((el.className && el.className.baseVal) || '')
        """));
    }

    @Override
    public String attribute(String name) {
        return handle.getAttribute(name);
    }

    @Override
    public String urlProperty(String name) {
        Object result = handle.evaluate("""
            (el, name) => {
                const v = el[name];
                return typeof v === 'string' && v ? v : el.getAttribute(name);
            }
        """, name);
        return result == null ? null : String.valueOf(result);
    }

    @Override
    public String text() {
        return asString(handle.evaluate("el => (el.innerText || el.textContent || '').trim()"));
    }

    @Override
    public Map<String, String> computedStyles(List<String> properties) {
        Object result = handle.evaluate("""
            (el, props) => {
                const cs = getComputedStyle(el);
                const out = {};
                for (const p of props) out[p] = cs.getPropertyValue(p) || '';
                return out;
            }
        """, properties);
        return toStringMap(result);
    }

    @Override
    public ElementBox box() {
        Object result = handle.evaluate("""
            el => {
                const r = el.getBoundingClientRect();
                return { width: r.width, height: r.height, top: r.top };
            }
        """);
        if (!(result instanceof Map<?, ?> m)) return new ElementBox(0, 0, 0);
        return new ElementBox(asDouble(m.get("width")), asDouble(m.get("height")), asDouble(m.get("top")));
    }

    @Override
    public boolean matches(String selector) {
        return Boolean.TRUE.equals(handle.evaluate("(el, s) => el.matches(s)", selector));
    }

    @Override
    public boolean hasAncestor(String selector) {
        return Boolean.TRUE.equals(handle.evaluate("(el, s) => el.closest(s) !== null", selector));
    }

    @Override
    public String markup() {
        return asString(handle.evaluate("el => new XMLSerializer().serializeToString(el)"));
    }

    @Override
    public List<Map<String, String>> subtreeComputedStyles(List<String> properties) {
        Object result = handle.evaluate("""
            (el, props) => [el, ...el.querySelectorAll('*')].map(node => {
                const cs = getComputedStyle(node);
                const out = {};
                for (const p of props) out[p] = cs.getPropertyValue(p) || '';
                return out;
            })
        """, properties);
        List<Map<String, String>> styles = new ArrayList<>();
        if (result instanceof List<?> list) {
            for (Object item : list) {
                styles.add(toStringMap(item));
            }
        }
        return styles;
    }

    static Map<String, String> toStringMap(Object raw) {
        Map<String, String> out = new HashMap<>();
        if (!(raw instanceof Map<?, ?> m)) return out;
        for (Map.Entry<?, ?> e : m.entrySet()) {
            if (e.getKey() == null) continue;
            out.put(String.valueOf(e.getKey()), e.getValue() == null ? "" : String.valueOf(e.getValue()));
        }
        return out;
    }

    private static String asString(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private static double asDouble(Object value) {
        return value instanceof Number n ? n.doubleValue() : 0.0;
    }
}
