package org.smileyface.newscrawler.enrichment;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the translation client and its retry policy.
 */
@ConfigurationProperties(prefix = "translation")
public class TranslationProperties {

    /** Cloud Translation API key. */
    private String apiKey = "";

    private String baseUrl = "https://translation.googleapis.com";

    private int timeoutMs = 15000;

    /** Total calls per text, first call included. */
    private int maxAttempts = 3;

    private long baseDelayMs = 1000L;

    private double factor = 2.0;

    private long maxDelayMs = 30_000L;

    /** Upper bound of the random delay added to each backoff. */
    private long jitterMs = 250L;

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public int getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(int timeoutMs) { this.timeoutMs = timeoutMs; }

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

    public long getBaseDelayMs() { return baseDelayMs; }
    public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }

    public double getFactor() { return factor; }
    public void setFactor(double factor) { this.factor = factor; }

    public long getMaxDelayMs() { return maxDelayMs; }
    public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }

    public long getJitterMs() { return jitterMs; }
    public void setJitterMs(long jitterMs) { this.jitterMs = jitterMs; }
}
