package org.smileyface.newscrawler.fetch;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.smileyface.newscrawler.crawler.CrawlerProperties;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * {@link PageFetcher} on top of the Jsoup HTTP connection. Redirects are followed and HTTP error
 * statuses are reported through {@link FetchResult#statusCode()}. Body read failures, which Jsoup
 * reports unchecked, surface as {@link IOException}.
 */
public class JsoupPageFetcher implements PageFetcher {

    private final CrawlerProperties properties;

    public JsoupPageFetcher(CrawlerProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @Override
    public FetchResult fetch(String url) throws IOException {
        Instant start = Instant.now();
        Connection conn = Jsoup.connect(url)
                .userAgent(Objects.toString(properties.getUserAgent(), "SmileyfaceNewsCrawler/0.1"))
                .timeout(Math.max(0, properties.getRequestTimeoutMs()))
                .followRedirects(true)
                .ignoreHttpErrors(true);

        Connection.Response res = conn.execute();
        String body;
        try {
            body = res.body();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        return new FetchResult(
                res.statusCode(),
                body,
                res.url().toString(),
                res.contentType(),
                Duration.between(start, Instant.now()));
    }
}
