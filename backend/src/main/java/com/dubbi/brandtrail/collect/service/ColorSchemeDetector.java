package com.dubbi.brandtrail.collect.service;

import com.dubbi.brandtrail.collect.domain.BackgroundCandidate;
import com.dubbi.brandtrail.collect.domain.ColorScheme;
import com.dubbi.brandtrail.collect.web.PageAccessor;
import com.dubbi.brandtrail.collect.web.PageElement;
import com.dubbi.brandtrail.common.util.CssColors;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * 라이트/다크 판별
 * 명시적인 다크 모드 표시(class, data-theme 등)가 있으면 그대로 다크.
 * 없으면 body/html 배경(투명하면 앱 루트 컨테이너 배경)의 WCAG 상대 휘도가 0.4 미만일 때 다크.
 */
public class ColorSchemeDetector {
    static final double DARK_LUMINANCE = 0.4;
    static final Set<String> DARK_CLASSES = Set.of("dark", "dark-mode", "theme-dark");
    static final List<String> THEME_ATTRIBUTES = List.of(
            "data-theme", "data-color-mode", "data-bs-theme", "data-mode",
            "data-color-scheme", "data-mantine-color-scheme");
    static final String APP_ROOTS = "#__next, #root, #app, #__nuxt, #___gatsby, main";

    private ColorSchemeDetector() {}

    public record SchemeResult(ColorScheme scheme, String pageBackground, List<BackgroundCandidate> candidates) {
        public static SchemeResult light() {
            return new SchemeResult(ColorScheme.LIGHT, null, List.of());
        }
    }

    public static SchemeResult detect(PageAccessor page, Function<String, String> namedColors) {
        Optional<PageElement> html = page.documentElement();
        Optional<PageElement> body = page.body();

        boolean explicitDark = html.map(ColorSchemeDetector::isMarkedDark).orElse(false)
                || body.map(ColorSchemeDetector::isMarkedDark).orElse(false);

        List<BackgroundCandidate> candidates = new ArrayList<>();
        String bodyBg = body.map(el -> background(el, "body", candidates, namedColors)).orElse(null);
        String htmlBg = html.map(el -> background(el, "html", candidates, namedColors)).orElse(null);

        String containerBg = null;
        for (PageElement el : page.querySelectorAll(APP_ROOTS)) {
            String source = el.attribute("id") != null && !el.attribute("id").isBlank()
                    ? "#" + el.attribute("id")
                    : el.tagName();
            String bg = background(el, source, candidates, namedColors);
            if (containerBg == null) containerBg = bg;
        }

        String pageBackground = bodyBg != null ? bodyBg : (htmlBg != null ? htmlBg : containerBg);

        ColorScheme scheme;
        if (explicitDark) {
            scheme = ColorScheme.DARK;
        } else if (pageBackground == null) {
            scheme = ColorScheme.LIGHT;
        } else {
            scheme = CssColors.relativeLuminance(pageBackground) < DARK_LUMINANCE ? ColorScheme.DARK : ColorScheme.LIGHT;
        }
        return new SchemeResult(scheme, pageBackground, candidates);
    }

    static boolean isMarkedDark(PageElement el) {
        String classes = el.className();
        if (classes != null) {
            for (String token : classes.toLowerCase(Locale.ROOT).split("\\s+")) {
                if (DARK_CLASSES.contains(token)) return true;
            }
        }
        for (String attr : THEME_ATTRIBUTES) {
            String value = el.attribute(attr);
            if (value != null && value.trim().equalsIgnoreCase("dark")) return true;
        }
        return false;
    }

    // 투명하지 않은 배경이면 후보로 기록하고 hex 반환
    private static String background(PageElement el, String source, List<BackgroundCandidate> candidates,
                                     Function<String, String> namedColors) {
        String hex = CssColors.hexify(el.computedStyle("background-color"), namedColors);
        if (hex == null || CssColors.isTransparent(hex)) return null;
        candidates.add(new BackgroundCandidate(source, hex, el.box().area()));
        return hex;
    }
}
