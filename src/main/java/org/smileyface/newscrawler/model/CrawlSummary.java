package org.smileyface.newscrawler.model;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable outcome of one crawl run.
 *
 * @param stateCounts  how many URLs reached each state
 * @param newRecords   records appended to the store
 * @param duplicates   extracted records discarded because their URL was already stored
 * @param visited      size of the visited set at the end of the run
 * @param completed    false when the run was stopped by the crawl timeout
 * @param elapsed      wall-clock duration of the run
 */
public record CrawlSummary(Map<UrlState, Long> stateCounts,
                           long newRecords,
                           long duplicates,
                           int visited,
                           boolean completed,
                           Duration elapsed) {

    public CrawlSummary {
        EnumMap<UrlState, Long> copy = new EnumMap<>(UrlState.class);
        if (stateCounts != null) copy.putAll(stateCounts);
        stateCounts = Collections.unmodifiableMap(copy);
    }

    public long count(UrlState state) {
        return stateCounts.getOrDefault(state, 0L);
    }
}
