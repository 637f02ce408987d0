package org.smileyface.newscrawler.extractor;

import org.jsoup.nodes.Element;

/**
 * Matches elements by tag name, case-insensitively.
 */
public final class TagNameContentRule implements ContentRule {

    private final String tagName;

    /**
     * @param tagName the HTML tag name to match (e.g., "p", "h1"). Must not be null/blank.
     */
    public TagNameContentRule(String tagName) {
        if (tagName == null || tagName.isBlank()) {
            throw new IllegalArgumentException("tagName must not be null/blank");
        }
        this.tagName = tagName.trim();
    }

    public String getTagName() {
        return tagName;
    }

    @Override
    public boolean isMatched(Element element) {
        if (element == null) return false;
        return element.tagName().equalsIgnoreCase(tagName);
    }
}
