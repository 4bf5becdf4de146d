package com.dubbi.brandtrail.collect.service;

import com.dubbi.brandtrail.collect.web.JsoupPageAccessor;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FrameworkHintDetectorTest {

    @Test
    void detectsGeneratorScriptsAndUiLibraries() {
        JsoupPageAccessor page = new JsoupPageAccessor("""
                <html><head>
                  <meta name="generator" content="WordPress 6.4">
                  <script src="/_next/static/chunks/main.js"></script>
                </head><body><button class="chakra-button">Go</button></body></html>
                """);

        Set<String> hints = FrameworkHintDetector.detect(page);

        assertTrue(hints.contains("generator:WordPress 6.4"));
        assertTrue(hints.contains("wordpress"));
        assertTrue(hints.contains("nextjs"));
        assertTrue(hints.contains("chakra-ui"));
    }

    @Test
    void plainPageHasNoHints() {
        assertTrue(FrameworkHintDetector.detect(new JsoupPageAccessor("<html><body><p>hi</p></body></html>")).isEmpty());
    }
}
