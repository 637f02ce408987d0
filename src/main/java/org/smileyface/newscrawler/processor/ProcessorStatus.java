package org.smileyface.newscrawler.processor;

import java.time.Instant;

/**
 * Immutable snapshot of a processor's status.
 */
public record ProcessorStatus(String id,
                              ProcessorState state,
                              long processedCount,
                              String lastUrl,
                              String lastError,
                              Instant startedAt,
                              Instant finishedAt) {
}
