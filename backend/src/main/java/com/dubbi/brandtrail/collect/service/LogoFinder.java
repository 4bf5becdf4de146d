package com.dubbi.brandtrail.collect.service;

import com.dubbi.brandtrail.collect.domain.ImageRef;
import com.dubbi.brandtrail.collect.domain.ImageType;
import com.dubbi.brandtrail.collect.domain.LogoCandidate;
import com.dubbi.brandtrail.collect.web.PageAccessor;
import com.dubbi.brandtrail.collect.web.PageElement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 로고 탐색
 * 1순위: header/nav/banner 영역 링크 안의 img 또는 svg
 * 2순위: alt/src/컨테이너에 "logo" 가 들어간 img (header 안 우선, 그 다음 위쪽)
 * 3순위: id/class 에 "logo" 가 들어간 인라인 svg (같은 순위 규칙)
 * testimonial/client/partner 섹션 안의 로고는 다른 회사 로고이므로 제외한다.
 */
public class LogoFinder {
    static final String HEADER_LINK_LOGO = "header a img, header a svg, nav a img, nav a svg, "
            + "[role=banner] a img, [role=banner] a svg, .header a img, .header a svg";
    static final String HEADER_REGION = "header, nav, [role=banner]";
    static final String LOGO_CONTAINER = "[class*=logo]";
    static final String EXCLUDED_SECTIONS = "[class*=testimonial], [class*=client], [class*=partner]";
    static final int MAX_CANDIDATES = 10;

    private static final Pattern LOGO = Pattern.compile("logo", Pattern.CASE_INSENSITIVE);

    private LogoFinder() {}

    public record LogoFindings(List<ImageRef> images, List<LogoCandidate> candidates) {
        public static LogoFindings empty() {
            return new LogoFindings(List.of(), List.of());
        }
    }

    private record Located(PageElement element, boolean svg, boolean inHeader, boolean insideHeaderLink, PageElement.ElementBox box) {}

    private static final Comparator<Located> HEADER_FIRST_THEN_TOP = Comparator
            .comparing((Located l) -> !l.inHeader())
            .thenComparingDouble(l -> l.box().top());

    public static LogoFindings find(PageAccessor page) {
        List<ImageRef> images = new ArrayList<>();

        List<Located> headerLinked = new ArrayList<>();
        for (PageElement el : page.querySelectorAll(HEADER_LINK_LOGO)) {
            headerLinked.add(locate(el, true));
        }

        List<Located> imgLogos = new ArrayList<>();
        List<Located> svgLogos = new ArrayList<>();

        if (!headerLinked.isEmpty()) {
            Located first = headerLinked.get(0);
            push(images, first);
        } else {
            for (PageElement img : page.querySelectorAll("img")) {
                if (isLogoImage(img) && !img.hasAncestor(EXCLUDED_SECTIONS)) {
                    imgLogos.add(locate(img, false));
                }
            }
            imgLogos.sort(HEADER_FIRST_THEN_TOP);
            if (!imgLogos.isEmpty()) push(images, imgLogos.get(0));

            for (PageElement svg : page.querySelectorAll("svg")) {
                if (isLogoSvg(svg) && !svg.hasAncestor(EXCLUDED_SECTIONS)) {
                    svgLogos.add(locate(svg, false));
                }
            }
            svgLogos.sort(HEADER_FIRST_THEN_TOP);
            if (!svgLogos.isEmpty()) push(images, svgLogos.get(0));
        }

        return new LogoFindings(images, rankCandidates(headerLinked, imgLogos, svgLogos));
    }

    private static boolean isLogoImage(PageElement img) {
        String alt = img.attribute("alt");
        String src = img.urlProperty("src");
        return (alt != null && LOGO.matcher(alt).find())
                || (src != null && LOGO.matcher(src).find())
                || img.hasAncestor(LOGO_CONTAINER);
    }

    private static boolean isLogoSvg(PageElement svg) {
        String id = svg.attribute("id");
        String classes = svg.className();
        return (id != null && LOGO.matcher(id).find()) || (classes != null && LOGO.matcher(classes).find());
    }

    private static Located locate(PageElement el, boolean insideHeaderLink) {
        boolean svg = "svg".equals(el.tagName());
        return new Located(el, svg, insideHeaderLink || el.hasAncestor(HEADER_REGION), insideHeaderLink, el.box());
    }

    private static void push(List<ImageRef> images, Located logo) {
        String src = source(logo);
        if (src == null || src.isBlank()) return;
        images.add(new ImageRef(logo.svg() ? ImageType.LOGO_SVG : ImageType.LOGO, src));
    }

    private static String source(Located logo) {
        return logo.svg() ? SvgStyleInliner.toDataUri(logo.element()) : logo.element().urlProperty("src");
    }

    private static List<LogoCandidate> rankCandidates(List<Located> headerLinked, List<Located> imgLogos, List<Located> svgLogos) {
        Map<Object, Located> unique = new LinkedHashMap<>();
        for (List<Located> group : List.of(headerLinked, imgLogos, svgLogos)) {
            for (Located l : group) {
                unique.putIfAbsent(l.element().identity(), l);
            }
        }

        List<Located> ranked = new ArrayList<>(unique.values());
        ranked.sort(Comparator.comparing((Located l) -> !l.insideHeaderLink()).thenComparing(HEADER_FIRST_THEN_TOP));

        List<LogoCandidate> out = new ArrayList<>();
        for (Located l : ranked) {
            if (out.size() >= MAX_CANDIDATES) break;
            String src = source(l);
            if (src == null || src.isBlank()) continue;
            String alt = l.svg()
                    ? firstNonBlank(l.element().attribute("id"), l.element().className())
                    : l.element().attribute("alt");
            out.add(new LogoCandidate(src, alt, l.svg(), l.inHeader(), l.insideHeaderLink(),
                    l.box().top(), l.box().width(), l.box().height()));
        }
        return out;
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) return a;
        return b == null || b.isBlank() ? null : b;
    }
}
