package org.smileyface.newscrawler.fetch;

import java.time.Duration;

/**
 * Raw response of a page fetch.
 *
 * @param statusCode  HTTP status code
 * @param body        response body decoded as text, may be empty
 * @param finalUrl    URL after redirects; relative links resolve against it
 * @param contentType response content type, may be null
 * @param duration    fetch latency
 */
public record FetchResult(int statusCode, String body, String finalUrl, String contentType, Duration duration) {

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
