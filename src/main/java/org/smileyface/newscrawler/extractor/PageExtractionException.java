package org.smileyface.newscrawler.extractor;

/**
 * Unexpected failure while turning a page into a record; the page is skipped.
 */
public class PageExtractionException extends RuntimeException {

    public PageExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
