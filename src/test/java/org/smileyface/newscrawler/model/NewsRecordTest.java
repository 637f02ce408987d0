package org.smileyface.newscrawler.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class NewsRecordTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private NewsRecord sample() {
        return new NewsRecord("https://www.thedailystar.net/news/flood", "Flood Update", "Rivers keep rising",
                "https://img/1.jpg", List.of("news", "bangladesh"), "The Daily Star", "2024-05-01T10:00:00Z");
    }

    @Test
    void newRecord_isNotApproved() {
        assertThat(sample().isApproved()).isFalse();
    }

    @Test
    void serialization_keepsFieldOrderAndUnknownKeys() throws Exception {
        String json = """
                {"url":"https://a.test/x","title":"T","description":"D","tags":["general"],
                 "approved":true,"timestamp":"2024-01-01T00:00:00Z","translated_title_bn":"টি","extra":42}
                """;
        NewsRecord record = mapper.readValue(json, NewsRecord.class);

        assertThat(record.isApproved()).isTrue();
        assertThat(record.getTranslated("title", "bn")).isEqualTo("টি");
        assertThat(record.getAdditional()).containsEntry("extra", 42);

        JsonNode out = mapper.readTree(mapper.writeValueAsString(record));
        List<String> names = new ArrayList<>();
        Iterator<String> it = out.fieldNames();
        it.forEachRemaining(names::add);
        assertThat(names).containsExactly("title", "url", "description", "tags", "approved", "timestamp",
                "translated_title_bn", "extra");
        assertThat(out.has("image")).as("null fields are omitted").isFalse();
    }

    @Test
    void addTranslated_neverOverwrites() {
        NewsRecord record = sample();
        assertThat(record.addTranslated("title", "bn", "first")).isTrue();
        assertThat(record.addTranslated("title", "bn", "second")).isFalse();
        assertThat(record.getTranslated("title", "bn")).isEqualTo("first");
        assertThat(NewsRecord.translatedKey("description", "es")).isEqualTo("translated_description_es");
    }

    @Test
    void copy_isIndependentOfOriginal() {
        NewsRecord original = sample();
        NewsRecord copy = new NewsRecord(original);
        copy.addTranslated("title", "bn", "x");
        copy.getTags().add("extra");

        assertThat(original.getAdditional()).isEmpty();
        assertThat(original.getTags()).containsExactly("news", "bangladesh");
        assertThat(copy).isEqualTo(original);
    }

    @Test
    void additional_isReadOnlyView() {
        NewsRecord record = sample();
        assertThatThrownBy(() -> record.getAdditional().put("k", "v"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
