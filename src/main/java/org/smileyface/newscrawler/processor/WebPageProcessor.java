package org.smileyface.newscrawler.processor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.newscrawler.crawler.CrawlSession;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Worker that pulls URLs from a {@link CrawlSession} and hands each to a page handler. It waits
 * while the queue is empty but other workers still hold pending pages, and completes once the
 * session is drained. {@link #stop()} prevents the next dequeue; the page in hand is finished.
 */
public class WebPageProcessor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(WebPageProcessor.class);

    private final String id;
    private final CrawlSession session;
    private final Consumer<String> pageHandler;
    private final long pollIntervalMs;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicLong processedCount = new AtomicLong(0);

    private volatile ProcessorState state = ProcessorState.NEW;
    private volatile String lastUrl;
    private volatile String lastError;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    public WebPageProcessor(String id, CrawlSession session, Consumer<String> pageHandler, long pollIntervalMs) {
        this.id = Objects.requireNonNull(id, "id");
        this.session = Objects.requireNonNull(session, "session");
        this.pageHandler = Objects.requireNonNull(pageHandler, "pageHandler");
        this.pollIntervalMs = Math.max(1, pollIntervalMs);
    }

    public void stop() {
        stopRequested.set(true);
        if (state == ProcessorState.NEW) {
            transitionTo(ProcessorState.STOPPED, null);
        }
    }

    public ProcessorStatus getStatus() {
        return new ProcessorStatus(id, state, processedCount.get(), lastUrl, lastError, startedAt, finishedAt);
    }

    @Override
    public void run() {
        if (state == ProcessorState.STOPPED) {
            return;
        }
        transitionTo(ProcessorState.RUNNING, null);
        try {
            for (;;) {
                if (stopRequested.get()) {
                    transitionTo(ProcessorState.STOPPED, null);
                    return;
                }
                String url = session.next();
                if (url == null) {
                    if (session.isDrained()) {
                        transitionTo(ProcessorState.COMPLETED, null);
                        return;
                    }
                    // others are still working and may enqueue links
                    Thread.sleep(pollIntervalMs);
                    continue;
                }
                lastUrl = url;
                try {
                    pageHandler.accept(url);
                } finally {
                    session.complete(url);
                }
                processedCount.incrementAndGet();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            transitionTo(ProcessorState.STOPPED, null);
        } catch (Throwable t) {
            lastError = t.getMessage();
            transitionTo(ProcessorState.ERROR, t);
        }
    }

    /**
     * Centralized state transition with structured logging. Ensures timestamps are set
     * and duration is included for terminal states (STOPPED/COMPLETED/ERROR).
     */
    private void transitionTo(ProcessorState newState, Throwable error) {
        ProcessorState old = this.state;
        if (newState == ProcessorState.RUNNING) {
            if (this.startedAt == null) {
                this.startedAt = Instant.now();
            }
            this.state = ProcessorState.RUNNING;
            log.info("Processor {} state {} -> {} (startedAt={})", id, old, this.state, startedAt);
            return;
        }

        this.finishedAt = Instant.now();
        this.state = newState;
        long dur = startedAt != null ? Math.max(0, finishedAt.toEpochMilli() - startedAt.toEpochMilli()) : 0L;
        long count = processedCount.get();
        switch (newState) {
            case STOPPED -> log.info("Processor {} state {} -> STOPPED after {} ms (processed={}, lastUrl={})", id, old, dur, count, lastUrl);
            case COMPLETED -> log.info("Processor {} state {} -> COMPLETED after {} ms (processed={})", id, old, dur, count);
            case ERROR -> log.error("Processor {} state {} -> ERROR after {} ms (processed={}, lastUrl={}, error={})",
                    id, old, dur, count, lastUrl, lastError, error);
            default -> log.info("Processor {} state {} -> {}", id, old, newState);
        }
    }
}
