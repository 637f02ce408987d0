package org.smileyface.newscrawler.enrichment;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Outcome of translating a record file.
 *
 * @param records   entries read from the input
 * @param attempted fields a translation was attempted for
 * @param succeeded fields translated successfully
 * @param failed    fields that received a failure marker
 * @param output    file the enriched records were written to
 * @param elapsed   wall-clock duration
 */
public record EnrichmentSummary(int records,
                                long attempted,
                                long succeeded,
                                long failed,
                                Path output,
                                Duration elapsed) {
}
