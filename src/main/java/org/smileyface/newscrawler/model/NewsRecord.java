package org.smileyface.newscrawler.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Normalized summary of one crawled news page, as persisted in the record store.
 * Identity is the canonical absolute URL.
 *
 * <p>Keys not mapped to a field (for example {@code translated_title_bn}) are kept in
 * insertion order and written back unchanged, so a record read from disk and written
 * again never loses data it did not understand.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"title", "url", "description", "image", "tags", "source", "approved", "timestamp"})
public class NewsRecord {

    public static final String NO_TITLE = "No Title";
    public static final String NO_DESCRIPTION = "No description available";
    public static final String UNKNOWN_SOURCE = "Unknown Source";
    public static final String DEFAULT_TAG = "general";

    private static final String TRANSLATED_PREFIX = "translated_";

    private String url;                // Canonical absolute URL, unique key
    private String title;
    private String description;
    private String image;              // Absolute image URL or regional default
    private List<String> tags;         // Never empty once extracted
    private String source;             // Publisher display name
    private boolean approved;          // Moderation flag, never set by the crawler
    private String timestamp;          // ISO-8601 UTC, set once at creation

    private final Map<String, Object> additional = new LinkedHashMap<>();

    public NewsRecord() {
        // for JSON mapping
    }

    public NewsRecord(String url, String title, String description, String image,
                      List<String> tags, String source, String timestamp) {
        this.url = url;
        this.title = title;
        this.description = description;
        this.image = image;
        this.tags = tags != null ? new ArrayList<>(tags) : null;
        this.source = source;
        this.approved = false;
        this.timestamp = timestamp;
    }

    /**
     * Copy constructor. Lists and additional keys are copied, so changes on the copy do not
     * leak into the original.
     */
    public NewsRecord(NewsRecord other) {
        this(other.url, other.title, other.description, other.image, other.tags, other.source, other.timestamp);
        this.approved = other.approved;
        this.additional.putAll(other.additional);
    }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getImage() { return image; }
    public void setImage(String image) { this.image = image; }

    public List<String> getTags() { return tags; }
    public void setTags(List<String> tags) { this.tags = tags != null ? new ArrayList<>(tags) : null; }

    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }

    public boolean isApproved() { return approved; }
    public void setApproved(boolean approved) { this.approved = approved; }

    public String getTimestamp() { return timestamp; }
    public void setTimestamp(String timestamp) { this.timestamp = timestamp; }

    @JsonAnyGetter
    public Map<String, Object> getAdditional() {
        return Collections.unmodifiableMap(additional);
    }

    @JsonAnySetter
    public void putAdditional(String key, Object value) {
        additional.put(key, value);
    }

    /**
     * Name of the key holding the translation of {@code field} into {@code langCode},
     * e.g. {@code translated_title_bn}.
     */
    public static String translatedKey(String field, String langCode) {
        return TRANSLATED_PREFIX + field + "_" + langCode;
    }

    @JsonIgnore
    public String getTranslated(String field, String langCode) {
        Object v = additional.get(translatedKey(field, langCode));
        return v == null ? null : v.toString();
    }

    /**
     * Adds a translated value. Existing keys, including previously written translations,
     * are never replaced.
     *
     * @return true if the key was added
     */
    public boolean addTranslated(String field, String langCode, String value) {
        return additional.putIfAbsent(translatedKey(field, langCode), value) == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NewsRecord that = (NewsRecord) o;
        return Objects.equals(url, that.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url);
    }

    @Override
    public String toString() {
        return "NewsRecord{" +
                "url='" + url + '\'' +
                ", title='" + title + '\'' +
                ", source='" + source + '\'' +
                ", tags=" + tags +
                ", approved=" + approved +
                ", timestamp='" + timestamp + '\'' +
                ", additionalKeys=" + additional.keySet() +
                '}';
    }
}
