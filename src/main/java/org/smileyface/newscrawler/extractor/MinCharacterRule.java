package org.smileyface.newscrawler.extractor;

import org.jsoup.nodes.Element;

/**
 * A ContentRule that matches elements whose visible text length (after trimming) is
 * at least a specified minimum number of characters.
 */
public final class MinCharacterRule implements ContentRule {

    private final int minChars;

    /**
     * @param minChars minimum number of characters required to match; negative values are treated as zero
     */
    public MinCharacterRule(int minChars) {
        this.minChars = Math.max(0, minChars);
    }

    public int getMinChars() {
        return minChars;
    }

    @Override
    public boolean isMatched(Element element) {
        if (element == null) return false;
        return element.text().trim().length() >= minChars;
    }
}
