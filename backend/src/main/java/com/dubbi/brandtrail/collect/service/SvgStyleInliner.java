package com.dubbi.brandtrail.collect.service;

import com.dubbi.brandtrail.collect.web.PageElement;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

/**
 * 인라인 SVG 로고를 페이지 스타일시트 없이도 같은 모양으로 보이도록 내보낸다.
 * var() 로 참조된 속성은 computed 값으로 치환하고, 기본값과 다르거나 명시된 속성만 인라인한다.
 * 원본 DOM 은 건드리지 않고 직렬화된 마크업 사본(jsoup XML)에서 작업한다.
 */
public class SvgStyleInliner {
    public static final String DATA_URI_PREFIX = "data:image/svg+xml;utf8,";

    static final List<String> PROPERTIES = List.of(
            "fill", "stroke", "color", "stop-color", "flood-color", "lighting-color",
            "stroke-width", "stroke-dasharray", "stroke-dashoffset", "stroke-linecap", "stroke-linejoin",
            "opacity", "fill-opacity", "stroke-opacity");

    private static final Map<String, String> SVG_DEFAULTS = Map.of(
            "fill", "rgb(0, 0, 0)",
            "stroke", "none",
            "stroke-width", "1px",
            "opacity", "1",
            "fill-opacity", "1",
            "stroke-opacity", "1");

    private SvgStyleInliner() {}

    /**
     * SVG 요소를 스타일이 해석된 data URI 로 변환
     */
    public static String toDataUri(PageElement svg) {
        return DATA_URI_PREFIX + encodeURIComponent(inline(svg.markup(), svg.subtreeComputedStyles(PROPERTIES)));
    }

    /**
     * @param markup SVG 마크업
     * @param computedStyles 루트와 하위 요소의 computed style (문서 순서)
     * @return 스타일이 인라인된 마크업
     */
    public static String inline(String markup, List<Map<String, String>> computedStyles) {
        Document doc = Jsoup.parse(markup == null ? "" : markup, "", Parser.xmlParser());
        doc.outputSettings().prettyPrint(false).syntax(Document.OutputSettings.Syntax.xml);
        Element root = doc.children().first();
        if (root == null) return markup == null ? "" : markup;

        List<Element> elements = root.getAllElements();
        int count = Math.min(elements.size(), computedStyles == null ? 0 : computedStyles.size());
        for (int i = 0; i < count; i++) {
            applyResolvedStyles(elements.get(i), computedStyles.get(i));
        }
        return root.outerHtml();
    }

    private static void applyResolvedStyles(Element el, Map<String, String> computed) {
        if (computed == null) return;
        Map<String, String> inlineStyle = parseStyle(el.attr("style"));
        Map<String, String> original = new LinkedHashMap<>(inlineStyle);
        boolean changed = false;

        for (String prop : PROPERTIES) {
            String attrValue = el.hasAttr(prop) ? el.attr(prop) : null;
            String value = computed.get(prop);
            boolean hasValue = value != null && !value.isBlank();

            if (attrValue != null && attrValue.contains("var(")) {
                el.removeAttr(prop);
                if (hasValue) {
                    inlineStyle.put(prop, value.trim() + " !important");
                }
                changed = true;
            } else if (hasValue) {
                boolean explicit = attrValue != null || original.containsKey(prop);
                boolean different = SVG_DEFAULTS.containsKey(prop) && !value.trim().equals(SVG_DEFAULTS.get(prop));
                if (explicit || different) {
                    inlineStyle.put(prop, value.trim() + " !important");
                    changed = true;
                }
            }
        }

        if (changed) {
            if (inlineStyle.isEmpty()) {
                el.removeAttr("style");
            } else {
                el.attr("style", serializeStyle(inlineStyle));
            }
        }
    }

    static Map<String, String> parseStyle(String style) {
        Map<String, String> out = new LinkedHashMap<>();
        if (style == null || style.isBlank()) return out;
        for (String decl : style.split(";")) {
            int idx = decl.indexOf(':');
            if (idx <= 0) continue;
            String name = decl.substring(0, idx).trim().toLowerCase();
            String value = decl.substring(idx + 1).trim();
            if (!name.isEmpty() && !value.isEmpty()) out.put(name, value);
        }
        return out;
    }

    private static String serializeStyle(Map<String, String> style) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : style.entrySet()) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(e.getKey()).append(": ").append(e.getValue()).append(';');
        }
        return sb.toString();
    }

    // JS encodeURIComponent 와 같은 결과
    static String encodeURIComponent(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("%21", "!")
                .replace("%27", "'")
                .replace("%28", "(")
                .replace("%29", ")")
                .replace("%7E", "~");
    }
}
