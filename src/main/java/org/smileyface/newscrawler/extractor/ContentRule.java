package org.smileyface.newscrawler.extractor;

import org.jsoup.nodes.Element;

/**
 * A predicate over a single HTML element, combined by {@link ParagraphScanRule} to describe
 * which element is an acceptable description fallback.
 */
@FunctionalInterface
public interface ContentRule {
    /**
     * Returns true if the provided element matches this rule.
     *
     * @param element a Jsoup Element from the parsed HTML document
     * @return true if matched
     */
    boolean isMatched(Element element);
}
