package com.dubbi.brandtrail.collect.service;

import com.dubbi.brandtrail.collect.domain.CssData;
import com.dubbi.brandtrail.collect.domain.CssSkip;
import com.dubbi.brandtrail.collect.web.CssRuleView;
import com.dubbi.brandtrail.collect.web.PageAccessor;
import com.dubbi.brandtrail.collect.web.StyleSheetView;
import com.dubbi.brandtrail.common.util.CssColors;
import com.dubbi.brandtrail.common.util.CssUnits;
import com.dubbi.brandtrail.common.util.FontNames;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 스타일시트 규칙에서 색상, radius, spacing, CSS 변수, 폰트를 수집
 * 읽을 수 없는 시트/규칙은 CssSkip 으로 기록하고 나머지는 계속 수집한다.
 */
public class CssDataCollector {
    private static final Logger log = LoggerFactory.getLogger(CssDataCollector.class);

    static final List<String> COLOR_PROPERTIES = List.of(
            "color", "background-color", "border-color", "fill", "stroke");
    static final List<String> RADIUS_PROPERTIES = List.of(
            "border-radius",
            "border-top-left-radius", "border-top-right-radius",
            "border-bottom-left-radius", "border-bottom-right-radius");
    static final List<String> SPACING_PROPERTIES = List.of(
            "margin", "margin-top", "margin-right", "margin-bottom", "margin-left",
            "padding", "padding-top", "padding-right", "padding-bottom", "padding-left",
            "gap", "row-gap", "column-gap");

    private CssDataCollector() {}

    public static CssData collect(
            PageAccessor page,
            double rootFontSize,
            double bodyFontSize,
            Function<String, String> namedColors
    ) {
        Accumulator acc = new Accumulator(rootFontSize, bodyFontSize, namedColors);

        for (StyleSheetView sheet : page.styleSheets()) {
            List<CssRuleView> rules;
            try {
                rules = sheet.cssRules();
            } catch (Exception e) {
                acc.skipped.add(CssSkip.sheet(sheet.href(), e.getMessage()));
                log.debug("Skipping stylesheet {}: {}", sheet.href(), e.getMessage());
                continue;
            }
            if (rules == null) continue;

            for (int i = 0; i < rules.size(); i++) {
                CssRuleView rule = rules.get(i);
                try {
                    // 읽기 실패는 규칙 종류와 상관없이 CssSkip 으로 남긴다
                    Map<String, String> declarations = rule.declarations();
                    switch (rule.type()) {
                        case STYLE -> acc.readStyleRule(declarations);
                        case FONT_FACE -> acc.readFontFace(declarations);
                        default -> {
                            // @media, @keyframes 등은 대상 아님
                        }
                    }
                } catch (Exception e) {
                    acc.skipped.add(CssSkip.rule(sheet.href(), i, e.getMessage()));
                    log.debug("Skipping rule #{} of {}: {}", i, sheet.href(), e.getMessage());
                }
            }
        }

        return new CssData(acc.colors, acc.radii, acc.spacings, acc.cssVars, acc.fonts, acc.skipped);
    }

    private static final class Accumulator {
        final double rootFontSize;
        final double bodyFontSize;
        final Function<String, String> namedColors;
        final Set<String> colors = new LinkedHashSet<>();
        final Set<Double> radii = new LinkedHashSet<>();
        final Set<Double> spacings = new LinkedHashSet<>();
        final Map<String, String> cssVars = new LinkedHashMap<>();
        final List<String> fonts = new ArrayList<>();
        final List<CssSkip> skipped = new ArrayList<>();

        Accumulator(double rootFontSize, double bodyFontSize, Function<String, String> namedColors) {
            this.rootFontSize = rootFontSize;
            this.bodyFontSize = bodyFontSize;
            this.namedColors = namedColors;
        }

        void readStyleRule(Map<String, String> declarations) {
            if (declarations == null) return;
            for (Map.Entry<String, String> e : declarations.entrySet()) {
                if (e.getKey() != null && e.getKey().startsWith("--")) {
                    String value = e.getValue() == null ? "" : e.getValue().trim();
                    cssVars.put(e.getKey(), value);
                    pushColor(value);
                }
            }
            for (String prop : COLOR_PROPERTIES) {
                pushColor(declarations.get(prop));
            }
            fonts.addAll(FontNames.parseStack(declarations.get("font-family")));
            for (String prop : RADIUS_PROPERTIES) {
                pushPositive(radii, declarations.get(prop));
            }
            for (String prop : SPACING_PROPERTIES) {
                pushPositive(spacings, declarations.get(prop));
            }
        }

        void readFontFace(Map<String, String> declarations) {
            if (declarations == null) return;
            String family = declarations.get("font-family");
            if (family == null) return;
            String cleaned = FontNames.cleanNextJsFontName(family.replace("\"", "").replace("'", "").trim());
            if (cleaned != null && !cleaned.isEmpty()) fonts.add(cleaned);
        }

        private void pushColor(String value) {
            String hex = CssColors.hexify(value, namedColors);
            if (hex != null) colors.add(hex);
        }

        private void pushPositive(Set<Double> target, String value) {
            Double px = CssUnits.toPx(value, rootFontSize, bodyFontSize);
            if (px != null && px != 0) target.add(px);
        }
    }
}
