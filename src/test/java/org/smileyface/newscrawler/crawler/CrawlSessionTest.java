package org.smileyface.newscrawler.crawler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.smileyface.newscrawler.model.UrlState;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CrawlSessionTest {

    private CrawlerProperties props;
    private CrawlSession session;

    @BeforeEach
    void setUp() {
        props = new CrawlerProperties();
        props.setAllowedDomains(List.of("bbc.com"));
        props.setMaxPages(2);
        session = new CrawlSession(new Frontier(props, new VisitedSet()), new InMemoryLinkQueue());
    }

    @Test
    void offer_queuesNormalizedUrlOnce() {
        assertThat(session.offer("HTTPS://BBC.com/news/a")).isTrue();
        assertThat(session.offer("https://bbc.com/news/a")).isFalse();

        assertThat(session.next()).isEqualTo("https://bbc.com/news/a");
        assertThat(session.next()).isNull();
        assertThat(session.stateCounts()).containsEntry(UrlState.DISCOVERED, 1L);
    }

    @Test
    void offer_rejectedUrlCountsAsSkipped() {
        assertThat(session.offer("https://elsewhere.org/")).isFalse();
        assertThat(session.stateCounts()).containsEntry(UrlState.SKIPPED, 1L);
        assertThat(session.isDrained()).isTrue();
    }

    @Test
    void drainedOnlyAfterEveryQueuedUrlCompletes() {
        session.offer("https://bbc.com/1");
        session.offer("https://bbc.com/2");
        assertThat(session.isDrained()).isFalse();

        String first = session.next();
        String second = session.next();
        assertThat(session.next()).isNull();
        assertThat(session.isDrained()).as("URLs are in flight").isFalse();

        session.complete(first);
        assertThat(session.isDrained()).isFalse();
        session.complete(second);
        assertThat(session.isDrained()).isTrue();
    }

    @Test
    void offer_noNewWorkOnceAtCapacity() {
        Frontier frontier = session.getFrontier();
        frontier.tryDispatch("https://bbc.com/x");
        frontier.tryDispatch("https://bbc.com/y");

        assertThat(session.offer("https://bbc.com/z")).isFalse();
        assertThat(session.stateCounts().get(UrlState.SKIPPED)).as("capacity is not a policy skip").isZero();
    }

    @Test
    void recordMerge_countsNewAndDuplicate() {
        session.recordMerge(true);
        session.recordMerge(false);
        session.recordMerge(true);
        assertThat(session.newRecords()).isEqualTo(2);
        assertThat(session.duplicates()).isEqualTo(1);
    }
}
