package org.smileyface.newscrawler.extractor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.smileyface.newscrawler.crawler.CrawlerProperties;
import org.smileyface.newscrawler.model.NewsRecord;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

class PageExtractorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    private CrawlerProperties props;
    private PageExtractor extractor;

    @BeforeEach
    void setUp() {
        props = new CrawlerProperties();
        extractor = new PageExtractor(props, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void dailyStarPage_titleFromTitleTag_tagsFromSourceTable() {
        String html = """
                <html><head>
                  <title>Flood Update</title>
                  <meta name="description" content="Water levels rise across the northern districts.">
                </head><body><p>short</p></body></html>
                """;

        NewsRecord r = extractor.extract("https://www.thedailystar.net/", html).record();

        assertThat(r.getUrl()).isEqualTo("https://www.thedailystar.net/");
        assertThat(r.getTitle()).isEqualTo("Flood Update");
        assertThat(r.getDescription()).isEqualTo("Water levels rise across the northern districts.");
        assertThat(r.getTags()).contains("bangladesh");
        assertThat(r.getSource()).isEqualTo("The Daily Star");
        assertThat(r.isApproved()).isFalse();
        assertThat(r.getTimestamp()).isEqualTo("2024-05-01T10:15:30Z");
        assertThat(r.getImage()).as("local source without image gets the local default")
                .isEqualTo(props.getLocalDefaultImage());
    }

    @Test
    void emptyMarkup_yieldsSentinelsNeverEmptyStrings() {
        NewsRecord r = extractor.extract("https://www.example.net/x", "").record();

        assertThat(r.getTitle()).isEqualTo(NewsRecord.NO_TITLE);
        assertThat(r.getDescription()).isEqualTo(NewsRecord.NO_DESCRIPTION);
        assertThat(r.getTags()).containsExactly(NewsRecord.DEFAULT_TAG);
        assertThat(r.getSource()).isEqualTo(NewsRecord.UNKNOWN_SOURCE);
        assertThat(r.getImage()).isEqualTo(props.getGlobalDefaultImage());
    }

    @Test
    void headlineMarkup_winsOverTitleTag() {
        String html = """
                <html><head><title>BBC News - Home</title></head>
                <body><article><h1>Markets rally after rate decision</h1></article></body></html>
                """;
        NewsRecord r = extractor.extract("https://www.bbc.com/news/business-1", html).record();
        assertThat(r.getTitle()).isEqualTo("Markets rally after rate decision");
    }

    @Test
    void tooShortHeadline_fallsThroughToNextCandidate() {
        String html = """
                <html><head><title>Election results announced</title></head>
                <body><h1>Live</h1></body></html>
                """;
        NewsRecord r = extractor.extract("https://www.bbc.com/news/live", html).record();
        assertThat(r.getTitle()).isEqualTo("Election results announced");
    }

    @Test
    void description_skipsBoilerplateParagraphs() {
        String html = """
                <html><body>
                  <p>Copyright 2024 Some Publisher. All rights reserved worldwide.</p>
                  <p>tiny</p>
                  <p>The health ministry reported a sharp drop in new cases this week.</p>
                </body></html>
                """;
        NewsRecord r = extractor.extract("https://www.who.int/news/item/1", html).record();
        assertThat(r.getDescription()).isEqualTo("The health ministry reported a sharp drop in new cases this week.");
    }

    @Test
    void description_truncatedWhenLimitConfigured() {
        props.setDescriptionMaxLength(20);
        PageExtractor limited = new PageExtractor(props, Clock.fixed(NOW, ZoneOffset.UTC));
        String html = "<html><head><meta property='og:description' content='A very long social preview text here'></head></html>";

        NewsRecord r = limited.extract("https://www.bbc.com/a", html).record();
        assertThat(r.getDescription()).hasSize(20).endsWith("...");
    }

    @Test
    void image_socialPreviewResolvedAgainstBaseUrl() {
        String html = """
                <html><head><meta property="og:image" content="/media/lead.jpg"></head>
                <body><article><img src="/media/other.jpg"></article></body></html>
                """;
        ExtractedPage page = extractor.extract("https://www.aljazeera.com/news/1",
                "https://www.aljazeera.com/news/2024/1", html);
        assertThat(page.record().getImage()).isEqualTo("https://www.aljazeera.com/media/lead.jpg");
        assertThat(page.record().getUrl()).isEqualTo("https://www.aljazeera.com/news/1");
    }

    @Test
    void image_articleImageWhenNoMeta() {
        String html = "<html><body><main><img src='pic.png'></main></body></html>";
        NewsRecord r = extractor.extract("https://www.reuters.com/world/story", html).record();
        assertThat(r.getImage()).isEqualTo("https://www.reuters.com/world/pic.png");
    }

    @Test
    void links_articlesFirstThenOthers() {
        String html = """
                <html><body>
                  <a href="/about">About</a>
                  <a href="/news/one">One</a>
                  <a href="https://www.bbc.com/sport">Sport</a>
                  <a href="/news/two">Two</a>
                </body></html>
                """;
        ExtractedPage page = extractor.extract("https://www.bbc.com/", html);
        assertThat(page.links()).containsExactly(
                "https://www.bbc.com/news/one",
                "https://www.bbc.com/news/two",
                "https://www.bbc.com/about",
                "https://www.bbc.com/sport");
    }
}
