package org.smileyface.newscrawler.extractor;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Value of an attribute on the first element matching a CSS selector that carries a non-blank
 * value longer than {@code minLength}. Prefix the attribute with {@code abs:} to resolve it against the page URL, e.g.
 * {@code new SelectorAttributeRule("article img[src]", "abs:src")}.
 */
public final class SelectorAttributeRule implements CandidateRule {

    private final String selector;
    private final String attribute;
    private final int minLength;

    public SelectorAttributeRule(String selector, String attribute) {
        this(selector, attribute, 0);
    }

    public SelectorAttributeRule(String selector, String attribute, int minLength) {
        if (selector == null || selector.isBlank()) {
            throw new IllegalArgumentException("selector must not be null/blank");
        }
        if (attribute == null || attribute.isBlank()) {
            throw new IllegalArgumentException("attribute must not be null/blank");
        }
        this.selector = selector.trim();
        this.attribute = attribute.trim();
        this.minLength = Math.max(0, minLength);
    }

    /**
     * Shorthand for the {@code content} attribute of a meta tag.
     */
    public static SelectorAttributeRule meta(String selector) {
        return new SelectorAttributeRule(selector, "content");
    }

    @Override
    public RuleResult tryExtract(Document document) {
        for (Element el : document.select(selector)) {
            RuleResult r = RuleResult.ofText(el.attr(attribute));
            if (r.isMatched() && r.getValue().length() > minLength) return r;
        }
        return RuleResult.missed();
    }

    @Override
    public String describe() {
        return "attr(" + selector + "@" + attribute + ")";
    }
}
