package org.smileyface.newscrawler.enrichment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Runs a translation call under a {@link BackoffPolicy}. Transient failures are retried until the
 * policy's attempt budget is spent; other failures are rethrown at once.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    @FunctionalInterface
    public interface TranslationCall<T> {
        T call() throws TranslationException;
    }

    private final BackoffPolicy policy;
    private final Sleeper sleeper;

    public RetryExecutor(BackoffPolicy policy, Sleeper sleeper) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public BackoffPolicy getPolicy() {
        return policy;
    }

    /**
     * @param operation name used in log lines
     * @return the first successful result
     * @throws TranslationException the last failure once retries are exhausted, the first
     *                              non-transient failure, or an UNEXPECTED failure on interruption
     */
    public <T> T execute(String operation, TranslationCall<T> call) throws TranslationException {
        int maxAttempts = policy.getMaxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                return call.call();
            } catch (TranslationException e) {
                if (!e.isTransient()) {
                    log.warn("{} failed with {} (not retried): {}", operation, e.getKind(), e.getMessage());
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    log.warn("{} failed with {} after {} attempts: {}", operation, e.getKind(), attempt, e.getMessage());
                    throw e;
                }
                Duration delay = policy.delayFor(attempt);
                log.info("{} attempt {}/{} failed with {}, retrying in {} ms",
                        operation, attempt, maxAttempts, e.getKind(), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new TranslationException(TranslationException.Kind.UNEXPECTED,
                            operation + " interrupted during backoff", ie);
                }
            }
        }
    }
}
