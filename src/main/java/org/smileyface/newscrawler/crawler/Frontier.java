package org.smileyface.newscrawler.crawler;

import org.smileyface.newscrawler.util.CrawlerUtils;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Decides which URLs may be crawled: allowlisted http(s) hosts, bounded URL length, no
 * excluded keyword and not yet visited. The {@link VisitedSet} it wraps is the single record of
 * what has been dispatched; a URL only reaches the fetcher through {@link #tryDispatch(String)}.
 */
public class Frontier {

    private final VisitedSet visited;
    private final List<String> allowedDomains;
    private final List<String> excludeKeywords;
    private final int maxUrlLength;
    private final int maxPages;

    public Frontier(CrawlerProperties properties, VisitedSet visited) {
        Objects.requireNonNull(properties, "properties");
        this.visited = Objects.requireNonNull(visited, "visited");
        this.allowedDomains = lowerCased(properties.getAllowedDomains());
        this.excludeKeywords = lowerCased(properties.getExcludeKeywords());
        this.maxUrlLength = properties.getMaxUrlLength();
        this.maxPages = Math.max(1, properties.getMaxPages());
    }

    /**
     * @return true if the URL passes every policy check and has not been visited yet
     */
    public boolean shouldVisit(String url) {
        if (!isAllowedByPolicy(url)) return false;
        return !visited.contains(CrawlerUtils.normalizeUrl(url));
    }

    /**
     * Marks the URL as visited. Idempotent.
     *
     * @return true if this call added it
     */
    public boolean markVisited(String url) {
        String key = CrawlerUtils.normalizeUrl(url);
        return key != null && visited.markVisited(key);
    }

    public boolean atCapacity() {
        return visited.size() >= maxPages;
    }

    /**
     * Atomically checks the URL against the policy, the capacity ceiling and the visited set, and
     * marks it visited when all pass. Two workers calling this for the same URL get exactly one
     * {@code true}.
     */
    public boolean tryDispatch(String url) {
        if (!isAllowedByPolicy(url)) return false;
        String key = CrawlerUtils.normalizeUrl(url);
        return key != null && visited.tryMarkVisited(key, maxPages);
    }

    public int visitedCount() {
        return visited.size();
    }

    private boolean isAllowedByPolicy(String url) {
        if (url == null || url.isBlank()) return false;
        String raw = url.trim();
        if (raw.length() > maxUrlLength) return false;

        String lower = raw.toLowerCase(Locale.ROOT);
        for (String keyword : excludeKeywords) {
            if (lower.contains(keyword)) return false;
        }
        if (CrawlerUtils.normalizeUrl(raw) == null) return false; // non-http(s) or malformed

        String host = CrawlerUtils.hostOf(raw);
        if (host == null) return false;
        for (String domain : allowedDomains) {
            if (host.contains(domain)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> lowerCased(List<String> values) {
        if (values == null) return List.of();
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(v -> v.trim().toLowerCase(Locale.ROOT))
                .toList();
    }
}
