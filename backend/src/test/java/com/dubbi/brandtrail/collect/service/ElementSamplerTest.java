package com.dubbi.brandtrail.collect.service;

import com.dubbi.brandtrail.collect.domain.StyleSnapshot;
import com.dubbi.brandtrail.collect.domain.TypographySignals;
import com.dubbi.brandtrail.collect.web.JsoupPageAccessor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ElementSamplerTest {

    @Test
    void elementsMatchingSeveralGroupsAreSampledOnce() {
        JsoupPageAccessor page = new JsoupPageAccessor("""
                <html><body>
                  <a class="btn" href="/signup">Sign up</a>
                  <p>Hello</p>
                </body></html>
                """);

        List<StyleSnapshot> snapshots = ElementSampler.snapshots(page, 16, 16);

        assertEquals(2, snapshots.size());
        StyleSnapshot link = snapshots.get(0);
        assertEquals("a", link.tag());
        assertTrue(link.isButton());
        assertTrue(link.isLink());
        assertFalse(link.isInput());
    }

    @Test
    void buttonSampleIsBounded() {
        StringBuilder html = new StringBuilder("<html><body>");
        for (int i = 0; i < 60; i++) html.append("<button>Go ").append(i).append("</button>");
        html.append("</body></html>");

        assertEquals(ElementSampler.MAX_BUTTONS, ElementSampler.sample(new JsoupPageAccessor(html.toString())).size());
    }

    @Test
    void snapshotCapturesComputedStyleAndFlags() {
        String longText = "x".repeat(150);
        JsoupPageAccessor page = new JsoupPageAccessor(
                "<html><body><button class=\"Primary Big\" data-variant=\"primary\">" + longText + "</button></body></html>")
                .style("button", "background-color", "rgb(0, 102, 255)")
                .style("button", "color", "rgb(255, 255, 255)")
                .style("button", "border-radius", "0.5rem")
                .style("button", "border-top-width", "1px")
                .style("button", "font-family", "\"Inter\", sans-serif")
                .style("button", "font-weight", "bold")
                .box("button", 160, 44, 300);

        StyleSnapshot s = ElementSampler.snapshots(page, 16, 16).get(0);

        assertEquals("primary big", s.classes());
        assertEquals(ElementSampler.MAX_TEXT_LENGTH, s.text().length());
        assertEquals("rgb(0, 102, 255)", s.colors().background());
        assertEquals(1.0, s.colors().borderWidth());
        assertEquals(8.0, s.radius());
        assertEquals("Inter", s.typography().family());
        assertEquals(List.of("Inter", "sans-serif"), s.typography().fontStack());
        assertEquals(700, s.typography().weight());
        assertEquals(160 * 44, s.rect().area());
        assertTrue(s.hasCtaIndicator());
        assertNull(s.shadow());
    }

    @Test
    void ctaIndicatorFromClassOrAttribute() {
        JsoupPageAccessor page = new JsoupPageAccessor("""
                <html><body>
                  <button id="a" class="hero-cta">A</button>
                  <button id="b" data-cta>B</button>
                  <button id="c">C</button>
                  <button id="d" class="octagon selectable-row">D</button>
                  <button id="e" class="cta_primary">E</button>
                </body></html>
                """);

        List<StyleSnapshot> s = ElementSampler.snapshots(page, 16, 16);

        assertTrue(s.get(0).hasCtaIndicator());
        assertTrue(s.get(1).hasCtaIndicator());
        assertFalse(s.get(2).hasCtaIndicator());
        assertFalse(s.get(3).hasCtaIndicator());
        assertTrue(s.get(4).hasCtaIndicator());
    }

    @Test
    void classesMerelyContainingCtaAreNotButtons() {
        JsoupPageAccessor page = new JsoupPageAccessor("""
                <html><body>
                  <div class="selectable-row">Row</div>
                  <span class="octagon">Shape</span>
                  <div class="spectator dictation">Quote</div>
                  <div class="pricing-cta">Buy now</div>
                </body></html>
                """);

        List<StyleSnapshot> s = ElementSampler.snapshots(page, 16, 16);

        assertEquals(1, s.size());
        assertEquals("pricing-cta", s.get(0).classes());
        assertTrue(s.get(0).isButton());
        assertTrue(s.get(0).hasCtaIndicator());
        assertFalse(ElementSampler.hasCtaClass("selectable-row octagon spectator"));
        assertTrue(ElementSampler.hasCtaClass("btn cta"));
    }

    @Test
    void typographySignalsFallBackToBody() {
        JsoupPageAccessor page = new JsoupPageAccessor("<html><body><h1>Title</h1></body></html>")
                .style("body", "font-family", "Inter, system-ui")
                .style("h1", "font-family", "\"Cal Sans\", Inter")
                .style("h1", "font-size", "48px");

        TypographySignals t = ElementSampler.typography(page);

        assertEquals(List.of("Inter", "system-ui"), t.bodyStack());
        assertEquals(List.of("Cal Sans", "Inter"), t.headingStack());
        assertEquals("48px", t.h1Size());
        assertEquals("48px", t.h2Size());
        assertEquals("16px", t.bodySize());
    }
}
