package org.smileyface.newscrawler.extractor;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Text of the first element matching a CSS selector whose trimmed text is longer than
 * {@code minLength}.
 */
public final class SelectorTextRule implements CandidateRule {

    private final String selector;
    private final int minLength;

    public SelectorTextRule(String selector) {
        this(selector, 0);
    }

    public SelectorTextRule(String selector, int minLength) {
        if (selector == null || selector.isBlank()) {
            throw new IllegalArgumentException("selector must not be null/blank");
        }
        this.selector = selector.trim();
        this.minLength = Math.max(0, minLength);
    }

    @Override
    public RuleResult tryExtract(Document document) {
        for (Element el : document.select(selector)) {
            String text = el.text().trim();
            if (!text.isEmpty() && text.length() > minLength) {
                return RuleResult.matched(text);
            }
        }
        return RuleResult.missed();
    }

    @Override
    public String describe() {
        return "text(" + selector + ")";
    }
}
