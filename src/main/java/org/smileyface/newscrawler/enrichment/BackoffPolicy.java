package org.smileyface.newscrawler.enrichment;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Exponential backoff with additive jitter, capped at {@code maxDelay}:
 * {@code delay(k) = min(maxDelay, baseDelay * factor^(k-1) + jitter)} where {@code k} is the
 * number of the attempt that just failed and jitter is uniform in {@code [0, maxJitter]}.
 */
public class BackoffPolicy {

    private final int maxAttempts;
    private final Duration baseDelay;
    private final double factor;
    private final Duration maxDelay;
    private final Duration maxJitter;
    private final Random random;

    public BackoffPolicy(int maxAttempts, Duration baseDelay, double factor, Duration maxDelay,
                         Duration maxJitter, Random random) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        if (factor < 1.0) {
            throw new IllegalArgumentException("factor must be >= 1: " + factor);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = nonNegative(baseDelay, "baseDelay");
        this.factor = factor;
        this.maxDelay = nonNegative(maxDelay, "maxDelay");
        this.maxJitter = nonNegative(maxJitter, "maxJitter");
        this.random = Objects.requireNonNull(random, "random");
    }

    public static BackoffPolicy from(TranslationProperties props) {
        return new BackoffPolicy(props.getMaxAttempts(),
                Duration.ofMillis(props.getBaseDelayMs()),
                props.getFactor(),
                Duration.ofMillis(props.getMaxDelayMs()),
                Duration.ofMillis(props.getJitterMs()),
                new Random());
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * @param failedAttempt 1-based number of the attempt that failed
     * @return how long to wait before the next attempt, never more than {@code maxDelay}
     */
    public Duration delayFor(int failedAttempt) {
        int k = Math.max(1, failedAttempt);
        double exponential = baseDelay.toMillis() * Math.pow(factor, k - 1);
        long jitter = maxJitter.isZero() ? 0L : (long) (random.nextDouble() * (maxJitter.toMillis() + 1));
        double total = exponential + jitter;
        long capped = (long) Math.min(maxDelay.toMillis(), total);
        return Duration.ofMillis(capped);
    }

    private static Duration nonNegative(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return d;
    }
}
