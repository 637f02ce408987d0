package org.smileyface.newscrawler.enrichment;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.newscrawler.model.NewsRecord;
import org.smileyface.newscrawler.store.JsonFileRecordStore;
import org.smileyface.newscrawler.store.RecordStore;
import org.smileyface.newscrawler.store.RecordStoreException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Adds machine-translated title and description fields to stored records.
 *
 * <p>Translation never touches an existing field: results go to {@code translated_<field>_<lang>}
 * keys, and a key that is already present is left alone. A field whose translation fails gets a
 * failure marker instead of being omitted, so "not attempted" (key absent) and "attempted and
 * failed" (marker) stay distinguishable.</p>
 */
public class EnrichmentService {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentService.class);

    public static final String RATE_LIMIT_EXHAUSTED = "[Translation Failed: rate limit exhausted]";
    public static final String TRANSLATION_ERROR = "[Translation Failed: translation error]";
    public static final String UNEXPECTED_ERROR = "[Translation Failed: unexpected error]";

    private static final TypeReference<List<NewsRecord>> RECORD_LIST = new TypeReference<>() {};

    static final List<String> FIELDS = List.of("title", "description");

    private final TranslationClient client;
    private final RetryExecutor retryExecutor;
    private final ObjectMapper mapper;

    public EnrichmentService(TranslationClient client, RetryExecutor retryExecutor, ObjectMapper mapper) {
        this.client = Objects.requireNonNull(client, "client");
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * @return a copy of the record carrying the translated fields; the argument is not modified
     */
    public NewsRecord enrich(NewsRecord record, String targetLanguage) {
        return enrich(record, targetLanguage, new Tally());
    }

    /**
     * Translates every record of {@code input} and writes the results into {@code output}, one
     * record at a time. Per-record failures are logged and never abort the run.
     *
     * @throws NoSuchFileException if the input file does not exist
     * @throws IOException          if the input file cannot be read or is not a JSON array of records
     */
    public EnrichmentSummary enrichAll(Path input, String targetLanguage, Path output) throws IOException {
        requireLanguage(targetLanguage);
        if (!Files.isRegularFile(input)) {
            throw new NoSuchFileException(input.toString());
        }
        Instant start = Instant.now();
        List<NewsRecord> records = readInput(input);
        RecordStore target = new JsonFileRecordStore(output, mapper);
        log.info("Translating {} records from {} into '{}', output {}", records.size(), input, targetLanguage, output);

        Tally tally = new Tally();
        int index = 0;
        for (NewsRecord record : records) {
            index++;
            log.info("Processing entry {}/{}: {}", index, records.size(), record.getUrl());
            NewsRecord enriched = enrich(record, targetLanguage, tally);
            try {
                target.update(enriched);
            } catch (RecordStoreException e) {
                log.error("Could not write enriched record {}", record.getUrl(), e);
            }
        }

        EnrichmentSummary summary = new EnrichmentSummary(records.size(), tally.attempted.get(),
                tally.succeeded.get(), tally.failed.get(), output, Duration.between(start, Instant.now()));
        log.info("Translation finished: records={}, attempted={}, succeeded={}, failed={}, elapsed={} ms",
                summary.records(), summary.attempted(), summary.succeeded(), summary.failed(),
                summary.elapsed().toMillis());
        return summary;
    }

    private NewsRecord enrich(NewsRecord record, String targetLanguage, Tally tally) {
        Objects.requireNonNull(record, "record");
        requireLanguage(targetLanguage);
        NewsRecord copy = new NewsRecord(record);
        for (String field : FIELDS) {
            String text = "title".equals(field) ? record.getTitle() : record.getDescription();
            if (text == null || text.isBlank()) continue;
            if (copy.getTranslated(field, targetLanguage) != null) {
                log.debug("{} already has {}", record.getUrl(), NewsRecord.translatedKey(field, targetLanguage));
                continue;
            }
            tally.attempted.incrementAndGet();
            String value = translateField(record.getUrl(), field, text, targetLanguage);
            if (isFailureMarker(value)) tally.failed.incrementAndGet();
            else tally.succeeded.incrementAndGet();
            copy.addTranslated(field, targetLanguage, value);
        }
        return copy;
    }

    private String translateField(String url, String field, String text, String targetLanguage) {
        try {
            String source = retryExecutor.execute("detect " + field, () -> client.detectLanguage(text));
            log.debug("{}: detected '{}' for {}", url, source, field);
            return retryExecutor.execute("translate " + field, () -> client.translate(text, source, targetLanguage));
        } catch (TranslationException e) {
            log.warn("{}: {} translation failed ({}, HTTP {}): {}", url, field, e.getKind(),
                    e.getStatusCode() < 0 ? "n/a" : e.getStatusCode(), e.getMessage());
            return markerFor(e.getKind());
        } catch (RuntimeException e) {
            log.error("{}: unexpected error translating {}", url, field, e);
            return UNEXPECTED_ERROR;
        }
    }

    private List<NewsRecord> readInput(Path input) throws IOException {
        List<NewsRecord> parsed = mapper.readValue(input.toFile(), RECORD_LIST);
        if (parsed == null) {
            throw new JsonMappingException(null, "Input file " + input + " does not hold a JSON array");
        }
        List<NewsRecord> records = new ArrayList<>(parsed.size());
        for (NewsRecord r : parsed) {
            if (r != null && r.getUrl() != null && !r.getUrl().isBlank()) {
                records.add(r);
            } else {
                log.warn("Skipping input entry without url in {}", input);
            }
        }
        return records;
    }

    static String markerFor(TranslationException.Kind kind) {
        return switch (kind) {
            case RATE_LIMITED -> RATE_LIMIT_EXHAUSTED;
            case UNEXPECTED -> UNEXPECTED_ERROR;
            default -> TRANSLATION_ERROR;
        };
    }

    public static boolean isFailureMarker(String value) {
        return RATE_LIMIT_EXHAUSTED.equals(value) || TRANSLATION_ERROR.equals(value) || UNEXPECTED_ERROR.equals(value);
    }

    private static void requireLanguage(String targetLanguage) {
        if (targetLanguage == null || targetLanguage.isBlank()) {
            throw new IllegalArgumentException("Target language code is required");
        }
    }

    private static final class Tally {
        final AtomicLong attempted = new AtomicLong();
        final AtomicLong succeeded = new AtomicLong();
        final AtomicLong failed = new AtomicLong();
    }
}
