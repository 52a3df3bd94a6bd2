package com.designauditor.crawl.extract;

import com.designauditor.color.ColorObservation;
import com.designauditor.color.ColorUsage;
import com.designauditor.crawl.model.ContrastIssue;
import com.designauditor.crawl.model.ElementCategory;
import com.designauditor.crawl.model.ExtractionRecord;
import com.designauditor.crawl.model.HttpFetchResult;
import com.designauditor.crawl.render.JsoupRenderSession;
import com.designauditor.crawl.render.ReadyState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class StyleColorCollectorTest {
    static final String PAGE = """
        <html><head>
          <meta name="viewport" content="width=device-width, initial-scale=1, maximum-scale=1">
          <style>
            body { background-color: #ffffff; color: #222222; }
            .hero { background-color: #000000; }
            .faint { color: #aaaaaa; }
            a.btn { background-color: #ff0000; color: #ffffff; height: 30px; width: 120px; }
            p.tiny { font-size: 10px; }
          </style>
        </head>
        <body>
          <header><h1>Brand</h1></header>
          <section id="hero" class="hero" data-section-id="s1">
            <div data-block-id="b1"><h2 style="color: #ffffff">Welcome</h2><p class="faint">Faint on dark</p></div>
          </section>
          <main>
            <p class="faint">Faint on white</p>
            <p class="tiny">Fine print</p>
            <a class="btn" href="/buy">Buy</a>
            <img src="photo.png" alt="">
          </main>
        </body></html>
        """;

    private final StyleColorCollector collector = new StyleColorCollector();

    @Test
    void collectsElementsPerCategory() {
        ExtractionRecord record = collector.collect(session(PAGE));

        assertThat(record.url()).isEqualTo("https://example.com/");
        assertThat(record.instances(ElementCategory.HEADINGS)).hasSize(2);
        assertThat(record.instances(ElementCategory.PARAGRAPHS)).hasSize(3);
        assertThat(record.instances(ElementCategory.BUTTONS)).hasSize(1);
        assertThat(record.instances(ElementCategory.LINKS)).hasSize(1);
        assertThat(record.instances(ElementCategory.IMAGES)).hasSize(1);
        assertThat(record.instances(ElementCategory.HEADINGS).get(0).style()).containsEntry("color", "#222222");
        assertThat(record.mobileOnly()).isFalse();
    }

    @Test
    void recordsTextAndBackgroundColorsOncePerElement() {
        ExtractionRecord record = collector.collect(session(PAGE));

        assertThat(record.colorObservations())
            .filteredOn(observation -> observation.elementTag().equals("A"))
            .extracting(ColorObservation::hex, ColorObservation::usedAs)
            .containsExactlyInAnyOrder(
                tuple("#ffffff", ColorUsage.TEXT),
                tuple("#ff0000", ColorUsage.BACKGROUND)
            );
        assertThat(record.colorObservations()).noneMatch(observation -> observation.elementTag().equals("IMG"));
        assertThat(record.colorObservations())
            .filteredOn(observation -> observation.usedAs() == ColorUsage.BACKGROUND)
            .extracting(ColorObservation::hex)
            .doesNotContain("transparent");
    }

    @Test
    void flagsTextBelowTheContrastMinimum() {
        ExtractionRecord record = collector.collect(session(PAGE));

        assertThat(record.contrastIssues())
            .extracting(ContrastIssue::selector)
            .containsExactlyInAnyOrder("body > main > p.faint", "body > main > a.btn");
        ContrastIssue faint = record.contrastIssues().stream()
            .filter(issue -> issue.selector().endsWith("p.faint"))
            .findFirst()
            .orElseThrow();
        assertThat(faint.foregroundHex()).isEqualTo("#aaaaaa");
        assertThat(faint.backgroundHex()).isEqualTo("#ffffff");
        assertThat(faint.ratio()).isEqualTo(2.32);
        assertThat(faint.requiredRatio()).isEqualTo(4.5);
        assertThat(faint.section()).isEqualTo("main");
        assertThat(faint.largeText()).isFalse();
    }

    @Test
    void largeTextUsesTheLowerThreshold() {
        ExtractionRecord record = collector.collect(session("""
            <body style="background-color: #ffffff">
              <h1 style="color: #888888; font-size: 32px">Large grey</h1>
              <p style="color: #888888">Small grey</p>
            </body>
            """));

        assertThat(record.contrastIssues()).extracting(ContrastIssue::selector).containsExactly("html > body > p");
    }

    static JsoupRenderSession session(String html) {
        HttpFetchResult fetch = new HttpFetchResult(
            "https://example.com/",
            null,
            200,
            html,
            null,
            "text/html",
            null,
            Instant.now(),
            Duration.ZERO,
            null,
            null
        );
        JsoupRenderSession session = new JsoupRenderSession("https://example.com/", CompletableFuture.completedFuture(fetch));
        assertThat(session.pollReady()).isEqualTo(ReadyState.READY);
        return session;
    }
}
