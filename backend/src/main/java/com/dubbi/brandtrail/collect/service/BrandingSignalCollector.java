package com.dubbi.brandtrail.collect.service;

import com.dubbi.brandtrail.collect.domain.CssData;
import com.dubbi.brandtrail.collect.domain.ImageRef;
import com.dubbi.brandtrail.collect.domain.ImageType;
import com.dubbi.brandtrail.collect.domain.RawBrandingRecord;
import com.dubbi.brandtrail.collect.domain.StyleSnapshot;
import com.dubbi.brandtrail.collect.domain.TypographySignals;
import com.dubbi.brandtrail.collect.web.PageAccessor;
import com.dubbi.brandtrail.collect.web.PageElement;
import com.dubbi.brandtrail.common.util.CssUnits;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 렌더링된 페이지에서 브랜딩 신호를 한 번에 수집해 RawBrandingRecord 를 만든다.
 * 페이지를 변경하지 않으며, 단계별 실패는 해당 단계의 빈 값으로 대체된다.
 */
@Component
public class BrandingSignalCollector {
    private static final Logger log = LoggerFactory.getLogger(BrandingSignalCollector.class);

    private static final String[] TITLE_SEPARATORS = {" | ", " - ", " — ", " – ", " : "};

    public RawBrandingRecord collect(PageAccessor page) {
        Function<String, String> namedColors = memoize(page::canvasFillStyle);

        double rootFontSize = stage("root font size",
                () -> page.documentElement().map(el -> CssUnits.fontSizeOrDefault(el.computedStyle("font-size"))).orElse(null),
                CssUnits.DEFAULT_FONT_SIZE);
        double bodyFontSize = stage("body font size",
                () -> page.body().map(el -> CssUnits.fontSizeOrDefault(el.computedStyle("font-size"))).orElse(null),
                CssUnits.DEFAULT_FONT_SIZE);

        CssData cssData = stage("stylesheets",
                () -> CssDataCollector.collect(page, rootFontSize, bodyFontSize, namedColors), CssData.empty());
        List<StyleSnapshot> snapshots = stage("element snapshots",
                () -> ElementSampler.snapshots(page, rootFontSize, bodyFontSize), List.of());

        List<ImageRef> images = new ArrayList<>();
        images.addAll(stage("meta images", () -> metaImages(page), List.<ImageRef>of()));
        LogoFinder.LogoFindings logos = stage("logos", () -> LogoFinder.find(page), LogoFinder.LogoFindings.empty());
        images.addAll(logos.images());

        ColorSchemeDetector.SchemeResult scheme = stage("color scheme",
                () -> ColorSchemeDetector.detect(page, namedColors), ColorSchemeDetector.SchemeResult.light());
        TypographySignals typography = stage("typography",
                () -> ElementSampler.typography(page), TypographySignals.empty());
        Set<String> frameworkHints = stage("framework hints", () -> FrameworkHintDetector.detect(page), Set.of());
        String brandName = stage("brand name", () -> brandName(page), null);

        if (!cssData.skipped().isEmpty()) {
            log.info("Skipped {} stylesheet item(s) during branding collection", cssData.skipped().size());
        }

        return new RawBrandingRecord(
                cssData,
                snapshots,
                images,
                scheme.scheme(),
                scheme.pageBackground(),
                typography,
                frameworkHints,
                scheme.candidates(),
                logos.candidates(),
                brandName);
    }

    static List<ImageRef> metaImages(PageAccessor page) {
        List<ImageRef> images = new ArrayList<>();
        page.querySelector("link[rel*=icon]")
                .map(el -> el.urlProperty("href"))
                .ifPresent(src -> push(images, ImageType.FAVICON, src));
        page.querySelector("meta[property=\"og:image\"]")
                .map(el -> el.attribute("content"))
                .ifPresent(src -> push(images, ImageType.OG, src));
        page.querySelector("meta[name=\"twitter:image\"]")
                .map(el -> el.attribute("content"))
                .ifPresent(src -> push(images, ImageType.TWITTER, src));
        return images;
    }

    private static void push(List<ImageRef> images, ImageType type, String src) {
        if (src != null && !src.isBlank()) images.add(new ImageRef(type, src.trim()));
    }

    /**
     * og:site_name → application-name → 제목의 첫 구간
     */
    static String brandName(PageAccessor page) {
        for (String selector : List.of("meta[property=\"og:site_name\"]", "meta[name=\"application-name\"]")) {
            String content = page.querySelector(selector).map(el -> el.attribute("content")).orElse(null);
            if (content != null && !content.isBlank()) return content.trim();
        }

        String title = page.title();
        if (title == null || title.isBlank()) return null;
        String name = title.trim();
        for (String sep : TITLE_SEPARATORS) {
            int idx = name.indexOf(sep);
            if (idx > 0) name = name.substring(0, idx).trim();
        }
        return name.isEmpty() ? null : name;
    }

    private static <T> T stage(String name, Supplier<T> step, T fallback) {
        try {
            T value = step.get();
            return value == null ? fallback : value;
        } catch (RuntimeException e) {
            log.warn("Branding collection stage '{}' failed, using fallback: {}", name, e.getMessage());
            return fallback;
        }
    }

    // 같은 색상 이름으로 브라우저를 반복 호출하지 않도록 캐시
    private static Function<String, String> memoize(Function<String, String> resolver) {
        Map<String, String> cache = new HashMap<>();
        return value -> {
            if (cache.containsKey(value)) return cache.get(value);
            String resolved;
            try {
                resolved = resolver.apply(value);
            } catch (RuntimeException e) {
                log.debug("Named color lookup failed for {}: {}", value, e.getMessage());
                resolved = null;
            }
            cache.put(value, resolved);
            return resolved;
        };
    }
}
