package org.smileyface.newscrawler.model;

/**
 * Lifecycle of a single URL inside one crawl run.
 */
public enum UrlState {
    /** Seeded or found as an outbound link, not yet dispatched. */
    DISCOVERED,

    /** Marked visited and handed to the fetcher. */
    FETCHING,

    /** Markup fetched and turned into a record. */
    EXTRACTED,

    /** Record merged into the store. */
    PERSISTED,

    /** Outbound links offered to the frontier. */
    LINKS_ENQUEUED,

    /** Rejected by the frontier (policy, already visited or capacity). */
    SKIPPED,

    /** Fetch, extraction or persistence failed; nothing stored, no links followed. */
    FAILED;

    public boolean isTerminal() {
        return this == LINKS_ENQUEUED || this == SKIPPED || this == FAILED;
    }
}
