package org.smileyface.newscrawler.crawler;

import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory {@link LinkQueue}: a {@link ConcurrentLinkedQueue} for FIFO order and a concurrent
 * set so the same URL is queued at most once per run. Dequeued URLs stay in the set.
 */
public class InMemoryLinkQueue implements LinkQueue {

    private final Queue<String> queue = new ConcurrentLinkedQueue<>();
    private final Set<String> seen = ConcurrentHashMap.newKeySet();

    @Override
    public boolean enqueue(String url) {
        if (url == null || url.isBlank()) return false;
        if (seen.add(url)) {
            queue.add(url);
            return true;
        }
        return false;
    }

    @Override
    public String deQueue() {
        return queue.poll();
    }

    @Override
    public void init() {
        queue.clear();
        seen.clear();
    }

    @Override
    public int size() {
        return queue.size();
    }
}
