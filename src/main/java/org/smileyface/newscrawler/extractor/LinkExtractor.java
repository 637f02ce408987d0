package org.smileyface.newscrawler.extractor;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.smileyface.newscrawler.util.CrawlerUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Collects outbound links of a page. Every {@code a[href]} is resolved against the page URL;
 * links whose path contains an article keyword come first (up to {@code articleLimit}), followed
 * by up to {@code otherLimit} remaining links. Order within each group is document order.
 */
public class LinkExtractor {

    private final List<String> articleKeywords;
    private final int articleLimit;
    private final int otherLimit;

    public LinkExtractor(List<String> articleKeywords, int articleLimit, int otherLimit) {
        this.articleKeywords = articleKeywords == null ? List.of() : articleKeywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.toLowerCase(Locale.ROOT))
                .toList();
        this.articleLimit = Math.max(0, articleLimit);
        this.otherLimit = Math.max(0, otherLimit);
    }

    public List<String> extractLinks(Document doc) {
        Set<String> seen = new LinkedHashSet<>();
        for (Element a : doc.select("a[href]")) {
            String abs = a.attr("abs:href").trim();
            if (!abs.isEmpty()) {
                seen.add(abs);
            }
        }

        List<String> articles = new ArrayList<>();
        List<String> others = new ArrayList<>();
        for (String link : seen) {
            if (isArticle(link)) {
                if (articles.size() < articleLimit) articles.add(link);
            } else if (others.size() < otherLimit) {
                others.add(link);
            }
        }
        List<String> out = new ArrayList<>(articles.size() + others.size());
        out.addAll(articles);
        out.addAll(others);
        return out;
    }

    boolean isArticle(String link) {
        String path = CrawlerUtils.pathOf(link);
        if (path == null) return false;
        for (String keyword : articleKeywords) {
            if (path.contains(keyword)) return true;
        }
        return false;
    }
}
