package org.smileyface.newscrawler.extractor;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Collection;
import java.util.List;

/**
 * Scans the document body in document order and returns the text of the first element that
 * matches all of the given {@link ContentRule}s.
 */
public final class ParagraphScanRule implements CandidateRule {

    private final List<ContentRule> matchAllRules;

    public ParagraphScanRule(Collection<ContentRule> matchAllRules) {
        if (matchAllRules == null || matchAllRules.isEmpty()) {
            throw new IllegalArgumentException("matchAllRules must not be null/empty");
        }
        this.matchAllRules = List.copyOf(matchAllRules);
    }

    @Override
    public RuleResult tryExtract(Document document) {
        Element root = document.body() != null ? document.body() : document;
        for (Element el : root.getAllElements()) {
            if (matchesAll(el)) {
                return RuleResult.ofText(el.text());
            }
        }
        return RuleResult.missed();
    }

    private boolean matchesAll(Element el) {
        for (ContentRule r : matchAllRules) {
            if (!r.isMatched(el)) return false;
        }
        return true;
    }

    @Override
    public String describe() {
        return "scan(" + matchAllRules.size() + " rules)";
    }
}
