package org.smileyface.newscrawler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.smileyface.newscrawler.crawler.CrawlerProperties;
import org.smileyface.newscrawler.enrichment.BackoffPolicy;
import org.smileyface.newscrawler.enrichment.EnrichmentService;
import org.smileyface.newscrawler.enrichment.GoogleTranslateClient;
import org.smileyface.newscrawler.enrichment.RetryExecutor;
import org.smileyface.newscrawler.enrichment.Sleeper;
import org.smileyface.newscrawler.enrichment.TranslationClient;
import org.smileyface.newscrawler.enrichment.TranslationProperties;
import org.smileyface.newscrawler.extractor.PageExtractor;
import org.smileyface.newscrawler.fetch.JsoupPageFetcher;
import org.smileyface.newscrawler.fetch.PageFetcher;
import org.smileyface.newscrawler.store.JsonFileRecordStore;
import org.smileyface.newscrawler.store.RecordStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the crawl pipeline and the translation client. The fetcher, record store and translation
 * client are interfaces so tests can swap in local implementations.
 */
@Configuration
public class BeanConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PageFetcher pageFetcher(CrawlerProperties properties) {
        return new JsoupPageFetcher(properties);
    }

    @Bean
    public PageExtractor pageExtractor(CrawlerProperties properties, Clock clock) {
        return new PageExtractor(properties, clock);
    }

    /**
     * The crawl output file, {@code crawler.output-file} (default result.json).
     */
    @Bean
    public RecordStore recordStore(CrawlerProperties properties, ObjectMapper objectMapper) {
        return new JsonFileRecordStore(Path.of(properties.getOutputFile()), objectMapper);
    }

    @Bean
    public TranslationClient translationClient(TranslationProperties properties, ObjectMapper objectMapper) {
        return new GoogleTranslateClient(properties, objectMapper);
    }

    @Bean
    public RetryExecutor retryExecutor(TranslationProperties properties) {
        return new RetryExecutor(BackoffPolicy.from(properties), Sleeper.THREAD);
    }

    @Bean
    public EnrichmentService enrichmentService(TranslationClient translationClient,
                                               RetryExecutor retryExecutor,
                                               ObjectMapper objectMapper) {
        return new EnrichmentService(translationClient, retryExecutor, objectMapper);
    }
}
