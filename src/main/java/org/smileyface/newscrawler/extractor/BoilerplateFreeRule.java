package org.smileyface.newscrawler.extractor;

import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Locale;

/**
 * Matches elements whose text does not start with one of the configured boilerplate prefixes
 * (copyright lines, advertisement labels, cookie notices). Comparison is case-insensitive.
 */
public final class BoilerplateFreeRule implements ContentRule {

    private final List<String> prefixes;

    public BoilerplateFreeRule(List<String> prefixes) {
        this.prefixes = prefixes == null ? List.of() : prefixes.stream()
                .filter(p -> p != null && !p.isBlank())
                .map(p -> p.trim().toLowerCase(Locale.ROOT))
                .toList();
    }

    @Override
    public boolean isMatched(Element element) {
        if (element == null) return false;
        String text = element.text().trim().toLowerCase(Locale.ROOT);
        for (String prefix : prefixes) {
            if (text.startsWith(prefix)) return false;
        }
        return true;
    }
}
