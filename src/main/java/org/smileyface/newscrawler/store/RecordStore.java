package org.smileyface.newscrawler.store;

import org.smileyface.newscrawler.model.NewsRecord;

import java.util.List;

/**
 * Persisted collection of {@link NewsRecord}s keyed by URL, in first-seen order.
 */
public interface RecordStore {

    /**
     * Appends the record unless one with the same URL is already stored. The stored record is
     * never replaced (first write wins).
     *
     * @return true if the record was appended
     * @throws RecordStoreException if the collection cannot be written
     */
    boolean merge(NewsRecord record);

    /**
     * Replaces the stored record with the same URL in place, or appends it when absent. Used to
     * write enriched records back.
     *
     * @throws RecordStoreException if the collection cannot be written
     */
    void update(NewsRecord record);

    /**
     * @return a snapshot of all records in insertion order; empty when nothing is stored yet
     */
    List<NewsRecord> loadAll();
}
