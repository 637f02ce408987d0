package org.smileyface.newscrawler.extractor;

import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Ordered list of {@link CandidateRule}s for one record field. The first MATCHED result wins.
 * A miss falls through silently; a failure (returned or thrown) is logged and also falls through.
 */
public final class RuleChain {

    private static final Logger log = LoggerFactory.getLogger(RuleChain.class);

    private final String field;
    private final List<CandidateRule> rules;

    public RuleChain(String field, List<CandidateRule> rules) {
        this.field = field;
        this.rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public Optional<String> evaluate(Document document) {
        for (CandidateRule rule : rules) {
            RuleResult result = apply(rule, document);
            switch (result.getStatus()) {
                case MATCHED -> {
                    return Optional.of(result.getValue());
                }
                case FAILED -> log.warn("Rule {} for field '{}' failed on {}: {}",
                        rule.describe(), field, document.location(), result.getError().toString());
                case MISSED -> { }
            }
        }
        return Optional.empty();
    }

    /**
     * Evaluates the chain and returns {@code fallback} when no rule matches.
     */
    public String evaluate(Document document, String fallback) {
        return evaluate(document).orElse(fallback);
    }

    private static RuleResult apply(CandidateRule rule, Document document) {
        try {
            RuleResult r = rule.tryExtract(document);
            return r != null ? r : RuleResult.missed();
        } catch (RuntimeException e) {
            return RuleResult.failed(e);
        }
    }
}
