package org.smileyface.newscrawler.extractor;

import org.smileyface.newscrawler.crawler.CrawlerProperties.SourceConfig;
import org.smileyface.newscrawler.model.NewsRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Static domain table: maps a host to the publisher name and tags of the first entry whose
 * domain is a substring of the host, and tells whether the host belongs to the local region.
 */
public class SourceCatalog {

    /**
     * @param name  publisher display name
     * @param tags  non-empty tag list
     * @param local whether the host is one of the configured local domains
     */
    public record Source(String name, List<String> tags, boolean local) {
        public Source {
            tags = (tags == null || tags.isEmpty()) ? List.of(NewsRecord.DEFAULT_TAG) : List.copyOf(tags);
        }
    }

    private final List<SourceConfig> entries;
    private final List<String> localDomains;

    public SourceCatalog(List<SourceConfig> entries, List<String> localDomains) {
        this.entries = entries == null ? List.of() : new ArrayList<>(entries);
        this.localDomains = localDomains == null ? List.of() : localDomains.stream()
                .filter(d -> d != null && !d.isBlank())
                .map(d -> d.trim().toLowerCase(Locale.ROOT))
                .toList();
    }

    public Source lookup(String host) {
        String h = host == null ? "" : host.toLowerCase(Locale.ROOT);
        boolean local = !h.isEmpty() && localDomains.stream().anyMatch(h::contains);
        if (!h.isEmpty()) {
            for (SourceConfig entry : entries) {
                String domain = entry.getDomain();
                if (domain == null || domain.isBlank()) continue;
                if (h.contains(domain.trim().toLowerCase(Locale.ROOT))) {
                    String name = (entry.getName() == null || entry.getName().isBlank())
                            ? NewsRecord.UNKNOWN_SOURCE : entry.getName();
                    return new Source(name, entry.getTags(), local);
                }
            }
        }
        return new Source(NewsRecord.UNKNOWN_SOURCE, List.of(NewsRecord.DEFAULT_TAG), local);
    }
}
