package org.smileyface.newscrawler.crawler;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class InMemoryLinkQueueTest {

    @Test
    void fifoOrder_andDedupSurvivesDequeue() {
        LinkQueue queue = new InMemoryLinkQueue();
        assertThat(queue.enqueue("https://a.test/1")).isTrue();
        assertThat(queue.enqueue("https://a.test/2")).isTrue();
        assertThat(queue.enqueue("https://a.test/1")).isFalse();
        assertThat(queue.size()).isEqualTo(2);

        assertThat(queue.deQueue()).isEqualTo("https://a.test/1");
        assertThat(queue.enqueue("https://a.test/1")).as("already seen in this run").isFalse();
        assertThat(queue.deQueue()).isEqualTo("https://a.test/2");
        assertThat(queue.deQueue()).isNull();
    }

    @Test
    void blankUrlsAreIgnored() {
        LinkQueue queue = new InMemoryLinkQueue();
        assertThat(queue.enqueue(null)).isFalse();
        assertThat(queue.enqueue("  ")).isFalse();
        assertThat(queue.size()).isZero();
    }

    @Test
    void init_clearsQueueAndSeenSet() {
        LinkQueue queue = new InMemoryLinkQueue();
        queue.enqueue("https://a.test/1");
        queue.init();
        assertThat(queue.size()).isZero();
        assertThat(queue.enqueue("https://a.test/1")).isTrue();
    }
}
