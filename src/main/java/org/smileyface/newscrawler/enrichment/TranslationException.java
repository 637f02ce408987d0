package org.smileyface.newscrawler.enrichment;

/**
 * Failure of a translation call. The {@link Kind} decides whether the call is worth retrying.
 */
public class TranslationException extends Exception {

    public enum Kind {
        /** HTTP 429. */
        RATE_LIMITED(true),
        /** HTTP 5xx. */
        SERVER_ERROR(true),
        /** Connection refused, reset or timed out. */
        UNAVAILABLE(true),
        /** HTTP 401/403, missing or rejected API key. */
        AUTHENTICATION(false),
        /** Any other HTTP 4xx. */
        INVALID_INPUT(false),
        /** Unparseable response, interruption or anything unclassified. */
        UNEXPECTED(false);

        private final boolean transientFailure;

        Kind(boolean transientFailure) {
            this.transientFailure = transientFailure;
        }

        public boolean isTransient() {
            return transientFailure;
        }
    }

    private final Kind kind;
    private final int statusCode;

    public TranslationException(Kind kind, String message) {
        this(kind, message, -1, null);
    }

    public TranslationException(Kind kind, String message, Throwable cause) {
        this(kind, message, -1, cause);
    }

    public TranslationException(Kind kind, String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return HTTP status of the failed call, or -1 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isTransient() {
        return kind.isTransient();
    }
}
