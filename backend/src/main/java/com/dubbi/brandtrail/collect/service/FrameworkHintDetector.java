package com.dubbi.brandtrail.collect.service;

import com.dubbi.brandtrail.collect.web.PageAccessor;
import com.dubbi.brandtrail.collect.web.PageElement;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * generator 메타 태그, script src, UI 라이브러리 class 흔적으로 사용 중인 도구를 추정.
 * 힌트일 뿐이므로 아무것도 못 찾아도 빈 집합을 돌려준다.
 */
public class FrameworkHintDetector {
    private static final Logger log = LoggerFactory.getLogger(FrameworkHintDetector.class);

    private static final Map<String, String> GENERATORS = new LinkedHashMap<>();
    private static final Map<String, String> SCRIPT_FINGERPRINTS = new LinkedHashMap<>();
    private static final Map<String, String> UI_LIBRARIES = new LinkedHashMap<>();

    static {
        GENERATORS.put("wordpress", "wordpress");
        GENERATORS.put("webflow", "webflow");
        GENERATORS.put("wix", "wix");
        GENERATORS.put("squarespace", "squarespace");
        GENERATORS.put("shopify", "shopify");
        GENERATORS.put("ghost", "ghost");
        GENERATORS.put("hugo", "hugo");
        GENERATORS.put("jekyll", "jekyll");
        GENERATORS.put("gatsby", "gatsby");
        GENERATORS.put("next.js", "nextjs");
        GENERATORS.put("astro", "astro");
        GENERATORS.put("docusaurus", "docusaurus");
        GENERATORS.put("framer", "framer");
        GENERATORS.put("drupal", "drupal");
        GENERATORS.put("joomla", "joomla");

        SCRIPT_FINGERPRINTS.put("/_next/", "nextjs");
        SCRIPT_FINGERPRINTS.put("/_nuxt/", "nuxt");
        SCRIPT_FINGERPRINTS.put("/_app/immutable/", "sveltekit");
        SCRIPT_FINGERPRINTS.put("gatsby", "gatsby");
        SCRIPT_FINGERPRINTS.put("wp-content", "wordpress");
        SCRIPT_FINGERPRINTS.put("wp-includes", "wordpress");
        SCRIPT_FINGERPRINTS.put("cdn.shopify.com", "shopify");
        SCRIPT_FINGERPRINTS.put("webflow", "webflow");
        SCRIPT_FINGERPRINTS.put("framerusercontent", "framer");
        SCRIPT_FINGERPRINTS.put("squarespace", "squarespace");
        SCRIPT_FINGERPRINTS.put("wixstatic", "wix");
        SCRIPT_FINGERPRINTS.put("hubspot", "hubspot");
        SCRIPT_FINGERPRINTS.put("bootstrap", "bootstrap");
        SCRIPT_FINGERPRINTS.put("jquery", "jquery");

        UI_LIBRARIES.put("[class*=chakra-]", "chakra-ui");
        UI_LIBRARIES.put("[class*=MuiButton], [class*=MuiBox]", "material-ui");
        UI_LIBRARIES.put("[class*=ant-btn], [class*=ant-layout]", "ant-design");
        UI_LIBRARIES.put("[class*=mantine-]", "mantine");
        UI_LIBRARIES.put("[data-radix-collection-item], [data-radix-popper-content-wrapper]", "radix-ui");
    }

    private FrameworkHintDetector() {}

    public static Set<String> detect(PageAccessor page) {
        Set<String> hints = new LinkedHashSet<>();

        try {
            page.querySelector("meta[name=generator]").ifPresent(meta -> {
                String content = meta.attribute("content");
                if (content == null || content.isBlank()) return;
                String lower = content.toLowerCase(Locale.ROOT);
                hints.add("generator:" + content.trim());
                GENERATORS.forEach((needle, hint) -> {
                    if (lower.contains(needle)) hints.add(hint);
                });
            });
        } catch (RuntimeException e) {
            log.debug("generator meta lookup failed: {}", e.getMessage());
        }

        try {
            for (PageElement script : page.querySelectorAll("script[src]")) {
                String src = script.attribute("src");
                if (src == null) continue;
                String lower = src.toLowerCase(Locale.ROOT);
                SCRIPT_FINGERPRINTS.forEach((needle, hint) -> {
                    if (lower.contains(needle)) hints.add(hint);
                });
            }
        } catch (RuntimeException e) {
            log.debug("script fingerprint lookup failed: {}", e.getMessage());
        }

        UI_LIBRARIES.forEach((selector, hint) -> {
            try {
                if (page.querySelector(selector).isPresent()) hints.add(hint);
            } catch (RuntimeException e) {
                log.debug("UI library probe {} failed: {}", hint, e.getMessage());
            }
        });

        return hints;
    }
}
