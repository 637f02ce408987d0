package org.smileyface.newscrawler.enrichment;

import java.time.Duration;

/**
 * Blocks the calling thread. Replaced in tests to observe backoff delays without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
