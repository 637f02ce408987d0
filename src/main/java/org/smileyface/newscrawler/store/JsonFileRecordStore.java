package org.smileyface.newscrawler.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.newscrawler.model.NewsRecord;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link RecordStore} backed by a UTF-8 JSON array file.
 *
 * <p>Every write is a full read-modify-write of the file under a single lock. The new content goes
 * to a sibling temp file which is then renamed over the target, so a crash mid-write leaves the
 * previous file intact. A missing, empty or malformed file reads as an empty collection; in the
 * malformed case the old content is replaced on the next write.</p>
 */
public class JsonFileRecordStore implements RecordStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileRecordStore.class);
    private static final TypeReference<List<NewsRecord>> RECORD_LIST = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper mapper;
    private final ObjectWriter writer;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonFileRecordStore(Path file, ObjectMapper mapper) {
        this.file = Objects.requireNonNull(file, "file");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.writer = mapper.writer()
                .with(SerializationFeature.INDENT_OUTPUT)
                .without(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    public Path getFile() {
        return file;
    }

    @Override
    public boolean merge(NewsRecord record) {
        requireUrl(record);
        lock.lock();
        try {
            List<NewsRecord> records = read();
            for (NewsRecord existing : records) {
                if (record.getUrl().equals(existing.getUrl())) {
                    log.debug("Record for {} already stored, keeping the first one", record.getUrl());
                    return false;
                }
            }
            records.add(record);
            write(records);
            log.debug("Saved {} total entries to {}", records.size(), file);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void update(NewsRecord record) {
        requireUrl(record);
        lock.lock();
        try {
            List<NewsRecord> records = read();
            boolean replaced = false;
            for (int i = 0; i < records.size(); i++) {
                if (record.getUrl().equals(records.get(i).getUrl())) {
                    records.set(i, record);
                    replaced = true;
                    break;
                }
            }
            if (!replaced) {
                records.add(record);
            }
            write(records);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<NewsRecord> loadAll() {
        lock.lock();
        try {
            return read();
        } finally {
            lock.unlock();
        }
    }

    private List<NewsRecord> read() {
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        try {
            String json = Files.readString(file, StandardCharsets.UTF_8);
            if (json.isBlank()) {
                return new ArrayList<>();
            }
            List<NewsRecord> records = mapper.readValue(json, RECORD_LIST);
            List<NewsRecord> out = new ArrayList<>(records == null ? 0 : records.size());
            if (records != null) {
                for (NewsRecord r : records) {
                    if (r != null && r.getUrl() != null) out.add(r);
                }
            }
            return out;
        } catch (JsonProcessingException e) {
            log.warn("Store file {} is malformed, treating it as empty: {}", file, e.getOriginalMessage());
            return new ArrayList<>();
        } catch (IOException e) {
            log.warn("Store file {} could not be read, treating it as empty: {}", file, e.getMessage());
            return new ArrayList<>();
        }
    }

    private void write(List<NewsRecord> records) {
        Path tmp = null;
        try {
            Path dir = file.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            Files.write(tmp, writer.writeValueAsBytes(records));
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            log.error("Failed to write {} records to {}", records.size(), file, e);
            throw new RecordStoreException("Failed to write records to " + file, e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not delete temp file {}: {}", tmp, e.getMessage());
        }
    }

    private static void requireUrl(NewsRecord record) {
        Objects.requireNonNull(record, "record");
        if (record.getUrl() == null || record.getUrl().isBlank()) {
            throw new IllegalArgumentException("record url must not be null/blank");
        }
    }
}
