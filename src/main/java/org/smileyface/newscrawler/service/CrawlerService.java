package org.smileyface.newscrawler.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.newscrawler.crawler.CrawlSession;
import org.smileyface.newscrawler.crawler.CrawlerProperties;
import org.smileyface.newscrawler.crawler.Frontier;
import org.smileyface.newscrawler.crawler.InMemoryLinkQueue;
import org.smileyface.newscrawler.crawler.VisitedSet;
import org.smileyface.newscrawler.extractor.ExtractedPage;
import org.smileyface.newscrawler.extractor.PageExtractionException;
import org.smileyface.newscrawler.extractor.PageExtractor;
import org.smileyface.newscrawler.fetch.FetchResult;
import org.smileyface.newscrawler.fetch.PageFetcher;
import org.smileyface.newscrawler.model.CrawlSummary;
import org.smileyface.newscrawler.model.UrlState;
import org.smileyface.newscrawler.processor.ProcessorManager;
import org.smileyface.newscrawler.store.RecordStore;
import org.smileyface.newscrawler.store.RecordStoreException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Runs a crawl: seeds a fresh {@link CrawlSession}, lets the {@link ProcessorManager} workers
 * drain it and persists every extracted page through the {@link RecordStore}.
 *
 * <p>Each URL moves through {@code DISCOVERED -> FETCHING -> EXTRACTED -> PERSISTED ->
 * LINKS_ENQUEUED}. A URL that loses the dispatch race, or is rejected by the frontier, ends
 * {@code SKIPPED}; fetch, extraction or persistence errors end it {@code FAILED} and never stop
 * the run.</p>
 */
@Service
public class CrawlerService {

    private static final Logger log = LoggerFactory.getLogger(CrawlerService.class);

    private final CrawlerProperties properties;
    private final PageFetcher fetcher;
    private final PageExtractor extractor;
    private final RecordStore store;
    private final ProcessorManager processorManager;

    private volatile CrawlSession currentSession;
    private volatile Instant startedAt;

    public CrawlerService(CrawlerProperties properties,
                          PageFetcher fetcher,
                          PageExtractor extractor,
                          RecordStore store,
                          ProcessorManager processorManager) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.store = Objects.requireNonNull(store, "store");
        this.processorManager = Objects.requireNonNull(processorManager, "processorManager");
    }

    /**
     * Starts a crawl from the given seeds, or from the configured seeds when none are given.
     *
     * @param seeds             entry URLs
     * @param waitForCompletion if true, blocks until the queue drains or the crawl timeout elapses
     * @return the summary of the finished run, or a snapshot of the running one when not waiting
     */
    public synchronized CrawlSummary crawl(List<String> seeds, boolean waitForCompletion) {
        if (processorManager.isRunning()) {
            throw new IllegalStateException("A crawl is already running");
        }
        List<String> entries = seeds == null || seeds.isEmpty() ? properties.getSeedUrls() : seeds;

        CrawlSession session = new CrawlSession(
                new Frontier(properties, new VisitedSet()), new InMemoryLinkQueue());
        currentSession = session;
        startedAt = Instant.now();

        int accepted = 0;
        for (String seed : entries) {
            if (session.offer(seed)) {
                accepted++;
            } else {
                log.warn("Seed rejected by crawl policy: {}", seed);
            }
        }
        if (accepted == 0) {
            log.warn("No usable seed URL among {}", entries);
            return summarize(session, true);
        }

        int workers = Math.max(1, properties.getWorkerCount());
        processorManager.start(workers, session, url -> processPage(session, url), properties.getPollIntervalMs());
        log.info("Crawl started: seeds={}, workers={}, maxPages={}", accepted, workers, properties.getMaxPages());
        if (!waitForCompletion) {
            return summarize(session, false);
        }
        return awaitCompletion();
    }

    /**
     * Waits for the running crawl. When the crawl timeout elapses first, workers are asked to stop
     * after their current page and interrupted after the grace period.
     */
    public CrawlSummary awaitCompletion() {
        CrawlSession session = currentSession;
        if (session == null) {
            throw new IllegalStateException("No crawl has been started");
        }
        long budget = properties.getCrawlTimeoutMs();
        Duration remaining = budget <= 0 ? null
                : Duration.ofMillis(Math.max(0, budget - Duration.between(startedAt, Instant.now()).toMillis()));
        boolean completed = processorManager.awaitAll(remaining);
        if (!completed) {
            log.warn("Crawl timeout of {} ms reached, stopping workers", budget);
            processorManager.stopAll(Duration.ofMillis(Math.max(0, properties.getStopGracePeriodMs())));
        }
        CrawlSummary summary = summarize(session, completed);
        log.info("Crawl finished: completed={}, visited={}, newRecords={}, duplicates={}, states={}, elapsed={} ms",
                summary.completed(), summary.visited(), summary.newRecords(), summary.duplicates(),
                summary.stateCounts(), summary.elapsed().toMillis());
        return summary;
    }

    /**
     * Handles one dequeued URL end to end. Never throws for page-level problems.
     */
    void processPage(CrawlSession session, String url) {
        Frontier frontier = session.getFrontier();
        if (!frontier.tryDispatch(url)) {
            session.transition(url, UrlState.DISCOVERED, UrlState.SKIPPED);
            return;
        }
        session.transition(url, UrlState.DISCOVERED, UrlState.FETCHING);

        FetchResult result;
        try {
            result = fetcher.fetch(url);
        } catch (IOException e) {
            log.warn("Fetch failed for {}: {}", url, e.getMessage());
            session.transition(url, UrlState.FETCHING, UrlState.FAILED);
            return;
        } catch (RuntimeException e) {
            log.error("Unexpected error fetching {}", url, e);
            session.transition(url, UrlState.FETCHING, UrlState.FAILED);
            return;
        }
        if (!result.isSuccessful()) {
            log.warn("Fetch of {} returned HTTP {}", url, result.statusCode());
            session.transition(url, UrlState.FETCHING, UrlState.FAILED);
            return;
        }

        ExtractedPage page;
        try {
            page = extractor.extract(url, result.finalUrl(), result.body());
        } catch (PageExtractionException e) {
            log.warn("Extraction failed for {}", url, e);
            session.transition(url, UrlState.FETCHING, UrlState.FAILED);
            return;
        }
        session.transition(url, UrlState.FETCHING, UrlState.EXTRACTED);

        boolean added;
        try {
            added = store.merge(page.record());
        } catch (RecordStoreException e) {
            log.error("Could not persist record for {}", url, e);
            session.transition(url, UrlState.EXTRACTED, UrlState.FAILED);
            return;
        }
        session.recordMerge(added);
        session.transition(url, UrlState.EXTRACTED, UrlState.PERSISTED);

        int enqueued = 0;
        for (String link : page.links()) {
            if (frontier.atCapacity()) break;
            if (session.offer(link)) enqueued++;
        }
        log.debug("{}: {} of {} links enqueued", url, enqueued, page.links().size());
        session.transition(url, UrlState.PERSISTED, UrlState.LINKS_ENQUEUED);
    }

    private CrawlSummary summarize(CrawlSession session, boolean completed) {
        return new CrawlSummary(session.stateCounts(), session.newRecords(), session.duplicates(),
                session.getFrontier().visitedCount(), completed, Duration.between(startedAt, Instant.now()));
    }
}
