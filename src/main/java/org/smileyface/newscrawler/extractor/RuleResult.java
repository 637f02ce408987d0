package org.smileyface.newscrawler.extractor;

import java.util.Objects;

/**
 * Outcome of one {@link CandidateRule}: a matched value, a plain miss, or an unexpected failure.
 */
public final class RuleResult {

    public enum Status { MATCHED, MISSED, FAILED }

    private static final RuleResult MISS = new RuleResult(Status.MISSED, null, null);

    private final Status status;
    private final String value;
    private final Throwable error;

    private RuleResult(Status status, String value, Throwable error) {
        this.status = status;
        this.value = value;
        this.error = error;
    }

    public static RuleResult matched(String value) {
        Objects.requireNonNull(value, "value");
        return new RuleResult(Status.MATCHED, value, null);
    }

    /**
     * @return MATCHED with the trimmed text, or MISSED when the text is null or blank
     */
    public static RuleResult ofText(String text) {
        if (text == null || text.isBlank()) return MISS;
        return matched(text.trim());
    }

    public static RuleResult missed() {
        return MISS;
    }

    public static RuleResult failed(Throwable error) {
        return new RuleResult(Status.FAILED, null, Objects.requireNonNull(error, "error"));
    }

    public Status getStatus() { return status; }
    public String getValue() { return value; }
    public Throwable getError() { return error; }

    public boolean isMatched() {
        return status == Status.MATCHED;
    }

    @Override
    public String toString() {
        return switch (status) {
            case MATCHED -> "MATCHED(" + value + ")";
            case MISSED -> "MISSED";
            case FAILED -> "FAILED(" + error + ")";
        };
    }
}
