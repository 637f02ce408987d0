package org.smileyface.newscrawler.processor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.newscrawler.crawler.CrawlSession;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs a bounded pool of {@link WebPageProcessor} workers over one {@link CrawlSession}.
 * Provides APIs to start, stop and query statuses of processors.
 */
@Component
public class ProcessorManager {

    private static final Logger log = LogManager.getLogger();

    private final List<WebPageProcessor> processors = new CopyOnWriteArrayList<>();
    private final List<Future<?>> futures = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ExecutorService executor;

    /**
     * Starts {@code numWorkers} processors over {@code session}. A previous run whose workers have
     * all exited, for instance one nobody waited for, is released first.
     *
     * @throws IllegalStateException if workers of a previous run are still active
     */
    public synchronized void start(int numWorkers, CrawlSession session, Consumer<String> pageHandler,
                                   long pollIntervalMs) {
        if (running.get()) {
            if (isRunning()) {
                throw new IllegalStateException("ProcessorManager already running");
            }
            releaseFinishedRun();
        }
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(pageHandler, "pageHandler");
        int n = Math.max(1, numWorkers);
        processors.clear();
        futures.clear();
        executor = Executors.newFixedThreadPool(n, workerThreadFactory());
        for (int i = 0; i < n; i++) {
            WebPageProcessor p = new WebPageProcessor("proc-" + (i + 1), session, pageHandler, pollIntervalMs);
            processors.add(p);
            futures.add(executor.submit(p));
        }
        running.set(true);
        log.info("ProcessorManager STARTED with {} workers", n);
    }

    /**
     * Asks every worker to stop after its current page and waits up to {@code grace} for them.
     * Workers still busy after that are interrupted.
     *
     * @return true if all workers finished within the grace period
     */
    public synchronized boolean stopAll(Duration grace) {
        for (WebPageProcessor p : processors) {
            p.stop();
        }
        boolean finished = awaitFutures(grace);
        if (executor != null) {
            if (finished) {
                executor.shutdown();
            } else {
                log.warn("ProcessorManager workers still busy after {} ms, interrupting", grace.toMillis());
                executor.shutdownNow();
            }
        }
        running.set(false);
        logAggregate("STOPPED");
        return finished;
    }

    public List<ProcessorStatus> getStatuses() {
        List<ProcessorStatus> list = new ArrayList<>(processors.size());
        for (WebPageProcessor p : processors) {
            list.add(p.getStatus());
        }
        return list;
    }

    public boolean isRunning() {
        if (!running.get()) return false;
        for (Future<?> f : futures) {
            if (!f.isDone()) return true;
        }
        return false;
    }

    /**
     * Wait until all processors exit or the timeout elapses.
     *
     * @param timeout maximum wait, null for no limit
     * @return true if all processors finished before timeout, false otherwise.
     */
    public boolean awaitAll(Duration timeout) {
        if (!awaitFutures(timeout)) {
            logAggregate("AWAIT TIMEOUT");
            return false;
        }
        if (executor != null) {
            executor.shutdown();
        }
        running.set(false);
        logAggregate("ALL COMPLETED");
        return true;
    }

    private void releaseFinishedRun() {
        if (executor != null) {
            executor.shutdown();
        }
        running.set(false);
        logAggregate("RELEASED");
    }

    private boolean awaitFutures(Duration timeout) {
        long remainingMs = timeout == null ? Long.MAX_VALUE / 2_000_000L : Math.max(0, timeout.toMillis());
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(remainingMs);
        for (Future<?> f : futures) {
            long nanosLeft = deadline - System.nanoTime();
            try {
                f.get(Math.max(0, nanosLeft), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } catch (ExecutionException e) {
                // WebPageProcessor catches everything itself; reaching here means it was cancelled or crashed
                log.warn("Processor task ended abnormally", e.getCause());
            }
        }
        return true;
    }

    private void logAggregate(String event) {
        int completed = 0;
        int stopped = 0;
        int error = 0;
        long processed = 0L;
        List<ProcessorStatus> statuses = getStatuses();
        for (ProcessorStatus s : statuses) {
            processed += s.processedCount();
            ProcessorState st = s.state();
            if (st == ProcessorState.COMPLETED) completed++;
            else if (st == ProcessorState.STOPPED) stopped++;
            else if (st == ProcessorState.ERROR) error++;
        }
        log.info("ProcessorManager {}: processors -> completed={}, stopped={}, error={}, totalProcessed={} (workers={})",
                event, completed, stopped, error, processed, statuses.size());
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "crawl-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
