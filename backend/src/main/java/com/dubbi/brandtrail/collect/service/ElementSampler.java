package com.dubbi.brandtrail.collect.service;

import com.dubbi.brandtrail.collect.domain.StyleSnapshot;
import com.dubbi.brandtrail.collect.domain.TypographySignals;
import com.dubbi.brandtrail.collect.web.PageAccessor;
import com.dubbi.brandtrail.collect.web.PageElement;
import com.dubbi.brandtrail.common.util.CssUnits;
import com.dubbi.brandtrail.common.util.FontNames;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 대표 요소 샘플링과 스타일 스냅샷 생성
 * 로고 이미지 5개, 버튼류 50개, 폼 컨트롤 25개, 제목/본문/링크 50개까지 문서 순서로 고른 뒤 요소 단위로 중복 제거
 */
public class ElementSampler {
    private static final Logger log = LoggerFactory.getLogger(ElementSampler.class);

    static final String LOGO_IMAGES = "header img, .site-logo img, img[alt*=logo], img[alt*=Logo], img[src*=logo]";
    static final String BUTTON_ELEMENTS = "button, [role=button], a.button, a.btn, [class*=btn]";
    // cta 는 클래스 토큰 단위로 다시 거른다 (octagon, selectable-row 제외)
    static final String BUTTONS = BUTTON_ELEMENTS + ", [class*=cta]";
    static final String FORM_CONTROLS = "input, select, textarea, [class*=form-control]";
    static final String TEXT_ELEMENTS = "h1, h2, h3, p, a";

    static final int MAX_LOGO_IMAGES = 5;
    static final int MAX_BUTTONS = 50;
    static final int MAX_FORM_CONTROLS = 25;
    static final int MAX_TEXT_ELEMENTS = 50;
    static final int MAX_TEXT_LENGTH = 100;

    static final List<String> SNAPSHOT_PROPERTIES = List.of(
            "color", "background-color", "border-top-color", "border-top-width",
            "border-radius", "font-family", "font-size", "font-weight", "box-shadow");

    private static final Pattern CTA_CLASS = Pattern.compile("cta|cta[-_].*|.*[-_]cta");

    private ElementSampler() {}

    public static List<PageElement> sample(PageAccessor page) {
        Map<Object, PageElement> picks = new LinkedHashMap<>();
        pick(page, LOGO_IMAGES, MAX_LOGO_IMAGES, picks, el -> true);
        pick(page, BUTTONS, MAX_BUTTONS, picks, ElementSampler::isButtonLike);
        pick(page, FORM_CONTROLS, MAX_FORM_CONTROLS, picks, el -> true);
        pick(page, TEXT_ELEMENTS, MAX_TEXT_ELEMENTS, picks, el -> true);
        return new ArrayList<>(picks.values());
    }

    private static void pick(PageAccessor page, String selector, int limit, Map<Object, PageElement> picks,
                             Predicate<PageElement> accept) {
        int taken = 0;
        for (PageElement el : page.querySelectorAll(selector)) {
            if (taken >= limit) break;
            if (!accept.test(el)) continue;
            picks.putIfAbsent(el.identity(), el);
            taken++;
        }
    }

    static boolean isButtonLike(PageElement el) {
        return el.matches(BUTTON_ELEMENTS) || hasCtaClass(lowerClasses(el));
    }

    private static String lowerClasses(PageElement el) {
        return el.className() == null ? "" : el.className().toLowerCase(Locale.ROOT);
    }

    /**
     * 샘플 요소들의 스냅샷. 읽다가 실패한 요소는 건너뛴다.
     */
    public static List<StyleSnapshot> snapshots(PageAccessor page, double rootFontSize, double bodyFontSize) {
        List<StyleSnapshot> out = new ArrayList<>();
        for (PageElement el : sample(page)) {
            try {
                out.add(snapshot(el, rootFontSize, bodyFontSize));
            } catch (RuntimeException e) {
                log.debug("Skipping element snapshot: {}", e.getMessage());
            }
        }
        return out;
    }

    public static StyleSnapshot snapshot(PageElement el, double rootFontSize, double bodyFontSize) {
        Map<String, String> cs = el.computedStyles(SNAPSHOT_PROPERTIES);
        PageElement.ElementBox box = el.box();

        List<String> fontStack = FontNames.parseStack(cs.get("font-family"));
        String family = fontStack.isEmpty() ? null : fontStack.get(0);

        String classes = lowerClasses(el);
        String text = el.text() == null ? "" : el.text();
        if (text.length() > MAX_TEXT_LENGTH) text = text.substring(0, MAX_TEXT_LENGTH);

        Double borderWidth = CssUnits.toPx(cs.get("border-top-width"), rootFontSize, bodyFontSize);
        String shadow = blankToNull(cs.get("box-shadow"));
        if ("none".equals(shadow)) shadow = null;

        return new StyleSnapshot(
                el.tagName(),
                classes,
                text,
                new StyleSnapshot.Box(box.width(), box.height()),
                new StyleSnapshot.Colors(
                        blankToNull(cs.get("color")),
                        blankToNull(cs.get("background-color")),
                        blankToNull(cs.get("border-top-color")),
                        borderWidth == null ? 0 : borderWidth),
                new StyleSnapshot.Typography(family, fontStack, blankToNull(cs.get("font-size")), parseWeight(cs.get("font-weight"))),
                CssUnits.toPx(cs.get("border-radius"), rootFontSize, bodyFontSize),
                el.matches(BUTTON_ELEMENTS) || hasCtaClass(classes),
                el.matches(FORM_CONTROLS),
                "a".equals(el.tagName()),
                hasCtaIndicator(el, classes),
                shadow);
    }

    /**
     * cta 클래스 토큰(cta, cta-*, *-cta, *_cta), data-cta 속성, data-variant="primary" 를 명시적 CTA 로 본다
     */
    static boolean hasCtaIndicator(PageElement el, String lowerClasses) {
        if (hasCtaClass(lowerClasses)) return true;
        if (el.attribute("data-cta") != null) return true;
        String variant = el.attribute("data-variant");
        return variant != null && variant.trim().equalsIgnoreCase("primary");
    }

    static boolean hasCtaClass(String lowerClasses) {
        for (String token : lowerClasses.trim().split("\\s+")) {
            if (CTA_CLASS.matcher(token).matches()) return true;
        }
        return false;
    }

    /**
     * 본문/제목 폰트 스택과 h1/h2/본문 폰트 크기
     */
    public static TypographySignals typography(PageAccessor page) {
        Optional<PageElement> body = page.body();
        Optional<PageElement> h1 = page.querySelector("h1").or(() -> body);
        Optional<PageElement> h2 = page.querySelector("h2").or(() -> h1);
        Optional<PageElement> p = page.querySelector("p").or(() -> body);

        List<String> bodyStack = body.map(el -> FontNames.parseStack(el.computedStyle("font-family"))).orElse(List.of());
        List<String> headingStack = h1.map(el -> FontNames.parseStack(el.computedStyle("font-family"))).orElse(List.of());

        return new TypographySignals(
                bodyStack,
                headingStack,
                h1.map(el -> blankToNull(el.computedStyle("font-size"))).orElse("32px"),
                h2.map(el -> blankToNull(el.computedStyle("font-size"))).orElse("24px"),
                p.map(el -> blankToNull(el.computedStyle("font-size"))).orElse("16px"));
    }

    private static Integer parseWeight(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return switch (raw.trim()) {
                case "bold" -> 700;
                case "normal" -> 400;
                default -> null;
            };
        }
    }

    private static String blankToNull(String v) {
        return v == null || v.isBlank() ? null : v.trim();
    }
}
