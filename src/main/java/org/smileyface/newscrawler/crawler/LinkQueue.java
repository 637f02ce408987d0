package org.smileyface.newscrawler.crawler;

/**
 * Pending work of a crawl run: URLs discovered but not yet dispatched.
 */
public interface LinkQueue {

    /**
     * Enqueue a URL string for later processing. Implementations may apply deduplication.
     *
     * @param url absolute URL
     * @return true if the URL was added, false if it was blank or already seen
     */
    boolean enqueue(String url);

    /**
     * Dequeue the next URL for processing in FIFO order.
     * This is a non-blocking operation and returns null when the queue is empty.
     *
     * @return next URL or null if none
     */
    String deQueue();

    /**
     * Clear all enqueued elements and any deduplication tracking.
     */
    void init();

    /**
     * @return number of URLs waiting to be dequeued
     */
    int size();
}
