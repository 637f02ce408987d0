package org.smileyface.newscrawler.fetch;

import java.io.IOException;

/**
 * Transport used by the crawl to download a page.
 */
@FunctionalInterface
public interface PageFetcher {

    /**
     * Downloads the URL. HTTP error statuses are returned, not thrown.
     *
     * @throws IOException on network failure, timeout or an unsupported content type
     */
    FetchResult fetch(String url) throws IOException;
}
