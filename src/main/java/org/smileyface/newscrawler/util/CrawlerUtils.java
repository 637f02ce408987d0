package org.smileyface.newscrawler.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public class CrawlerUtils {

    private CrawlerUtils() {
        // No instanciation
    }

    /**
     * Normalizes an absolute http(s) URL so it can be used as a visited-set and store key:
     * lower-cased scheme and host, default port removed, fragment removed and an empty
     * path resolved to "/".
     *
     * @return the normalized URL, or null if the input is blank, not http(s) or malformed
     */
    public static String normalizeUrl(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            URI uri = new URI(raw.trim());
            String scheme = uri.getScheme();
            if (scheme == null) return null;
            String lowerScheme = scheme.toLowerCase(Locale.ROOT);
            if (!lowerScheme.equals("http") && !lowerScheme.equals("https")) {
                return null;
            }
            String host = uri.getHost();
            if (host == null) return null;
            String path = uri.getRawPath();
            if (path == null || path.isBlank()) path = "/";
            String query = uri.getRawQuery();

            StringBuilder sb = new StringBuilder();
            sb.append(lowerScheme).append("://").append(host.toLowerCase(Locale.ROOT));
            if (uri.getPort() != -1 && uri.getPort() != defaultPort(lowerScheme)) {
                sb.append(':').append(uri.getPort());
            }
            sb.append(path);
            if (query != null && !query.isBlank()) sb.append('?').append(query);
            return sb.toString();
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * @return the lower-cased host of the URL, or null when it cannot be parsed
     */
    public static String hostOf(String url) {
        if (url == null || url.isBlank()) return null;
        try {
            String host = new URI(url.trim()).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * @return the lower-cased path of the URL, "/" when it has none, or null when it cannot be parsed
     */
    public static String pathOf(String url) {
        if (url == null || url.isBlank()) return null;
        try {
            String path = new URI(url.trim()).getPath();
            return (path == null || path.isEmpty()) ? "/" : path.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * Shortens text to at most {@code maxLength} characters, ending with "..." when cut.
     * A non-positive limit leaves the text unchanged.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null || maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        if (maxLength <= 3) {
            return text.substring(0, maxLength);
        }
        return text.substring(0, maxLength - 3).trim() + "...";
    }

    private static int defaultPort(String scheme) {
        return "https".equals(scheme) ? 443 : 80;
    }
}
