package org.smileyface.newscrawler.enrichment;

import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class BackoffPolicyTest {

    @Test
    void delayGrowsExponentially_withoutJitter() {
        BackoffPolicy policy = new BackoffPolicy(5, Duration.ofMillis(100), 2.0,
                Duration.ofSeconds(10), Duration.ZERO, new Random(1));

        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.delayFor(2)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.delayFor(3)).isEqualTo(Duration.ofMillis(400));
    }

    @RepeatedTest(20)
    void delayNeverExceedsMaxDelay() {
        BackoffPolicy policy = new BackoffPolicy(10, Duration.ofMillis(500), 3.0,
                Duration.ofMillis(2_000), Duration.ofMillis(1_000), new Random());

        for (int attempt = 1; attempt <= 10; attempt++) {
            assertThat(policy.delayFor(attempt)).isLessThanOrEqualTo(Duration.ofMillis(2_000));
        }
    }

    @Test
    void jitterStaysWithinBound() {
        BackoffPolicy policy = new BackoffPolicy(3, Duration.ofMillis(100), 1.0,
                Duration.ofSeconds(1), Duration.ofMillis(50), new Random(42));
        for (int i = 0; i < 100; i++) {
            assertThat(policy.delayFor(1).toMillis()).isBetween(100L, 150L);
        }
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThatThrownBy(() -> new BackoffPolicy(0, Duration.ZERO, 2.0, Duration.ZERO, Duration.ZERO, new Random()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffPolicy(3, Duration.ZERO, 0.5, Duration.ZERO, Duration.ZERO, new Random()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffPolicy(3, Duration.ofMillis(-1), 2.0, Duration.ZERO, Duration.ZERO, new Random()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromProperties() {
        TranslationProperties props = new TranslationProperties();
        props.setMaxAttempts(4);
        props.setJitterMs(0);
        BackoffPolicy policy = BackoffPolicy.from(props);

        assertThat(policy.getMaxAttempts()).isEqualTo(4);
        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofMillis(props.getBaseDelayMs()));
    }
}
