package org.smileyface.newscrawler.store;

/**
 * The record collection could not be written.
 */
public class RecordStoreException extends RuntimeException {

    public RecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
