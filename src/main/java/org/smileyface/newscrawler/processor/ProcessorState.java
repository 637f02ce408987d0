package org.smileyface.newscrawler.processor;

/**
 * Lifecycle state of a WebPageProcessor.
 */
public enum ProcessorState {
    NEW,
    RUNNING,
    STOPPED,
    COMPLETED,
    ERROR
}
