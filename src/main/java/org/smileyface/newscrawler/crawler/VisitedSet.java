package org.smileyface.newscrawler.crawler;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * URLs already dispatched during one crawl run. Grows monotonically and is owned by the run,
 * so independent runs never share state.
 */
public final class VisitedSet {

    private final Set<String> urls = ConcurrentHashMap.newKeySet();

    /**
     * Adds the URL. Idempotent.
     *
     * @return true if the URL was not yet present
     */
    public synchronized boolean markVisited(String url) {
        if (url == null || url.isBlank()) return false;
        return urls.add(url);
    }

    /**
     * Adds the URL only while the set holds fewer than {@code ceiling} entries. The size check and
     * the insert happen atomically so concurrent workers cannot overshoot the ceiling.
     *
     * @return true if the URL was added by this call
     */
    public synchronized boolean tryMarkVisited(String url, int ceiling) {
        if (url == null || url.isBlank()) return false;
        if (urls.size() >= ceiling) return false;
        return urls.add(url);
    }

    public boolean contains(String url) {
        return url != null && urls.contains(url);
    }

    public int size() {
        return urls.size();
    }
}
