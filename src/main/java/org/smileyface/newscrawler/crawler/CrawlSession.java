package org.smileyface.newscrawler.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.newscrawler.model.UrlState;
import org.smileyface.newscrawler.util.CrawlerUtils;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * State of one crawl run, shared by its workers: the frontier, the pending queue and the
 * per-state counters.
 *
 * <p>{@code pending} counts URLs that are queued or being processed. It is raised before a URL
 * enters the queue and lowered only after the worker holding it is done, so a worker that finds
 * the queue empty can tell "nothing left" (pending is zero) from "others may still discover
 * links".</p>
 */
public class CrawlSession {

    private static final Logger log = LoggerFactory.getLogger(CrawlSession.class);

    private final Frontier frontier;
    private final LinkQueue queue;
    private final AtomicInteger pending = new AtomicInteger();
    private final Map<UrlState, AtomicLong> counters = new EnumMap<>(UrlState.class);
    private final AtomicLong newRecords = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();

    public CrawlSession(Frontier frontier, LinkQueue queue) {
        this.frontier = Objects.requireNonNull(frontier, "frontier");
        this.queue = Objects.requireNonNull(queue, "queue");
        for (UrlState s : UrlState.values()) {
            counters.put(s, new AtomicLong());
        }
    }

    public Frontier getFrontier() {
        return frontier;
    }

    /**
     * Offers a seed or discovered link. Nothing is created once the frontier is at capacity;
     * URLs the frontier rejects are counted as skipped. Accepted URLs are queued in normalized form.
     *
     * @return true if the URL entered the queue as {@link UrlState#DISCOVERED}
     */
    public boolean offer(String url) {
        if (frontier.atCapacity()) {
            return false;
        }
        if (!frontier.shouldVisit(url)) {
            transition(url, UrlState.DISCOVERED, UrlState.SKIPPED);
            return false;
        }
        String key = CrawlerUtils.normalizeUrl(url);
        pending.incrementAndGet();
        if (queue.enqueue(key)) {
            counters.get(UrlState.DISCOVERED).incrementAndGet();
            return true;
        }
        pending.decrementAndGet();
        return false;
    }

    /**
     * @return the next queued URL, or null when the queue is momentarily empty
     */
    public String next() {
        return queue.deQueue();
    }

    /**
     * Releases a URL obtained from {@link #next()}. Must be called exactly once per URL.
     */
    public void complete(String url) {
        int left = pending.decrementAndGet();
        if (left < 0) {
            log.warn("Pending counter went negative after completing {}", url);
        }
    }

    /**
     * @return true when no URL is queued or in flight
     */
    public boolean isDrained() {
        return pending.get() <= 0;
    }

    public void transition(String url, UrlState from, UrlState to) {
        counters.get(to).incrementAndGet();
        log.debug("{}: {} -> {}", url, from, to);
    }

    public void recordMerge(boolean added) {
        if (added) newRecords.incrementAndGet();
        else duplicates.incrementAndGet();
    }

    public Map<UrlState, Long> stateCounts() {
        Map<UrlState, Long> out = new EnumMap<>(UrlState.class);
        counters.forEach((k, v) -> out.put(k, v.get()));
        return out;
    }

    public long newRecords() {
        return newRecords.get();
    }

    public long duplicates() {
        return duplicates.get();
    }
}
