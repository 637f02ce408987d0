package org.smileyface.newscrawler.extractor;

import org.jsoup.nodes.Document;

/**
 * One candidate in an ordered extraction chain. Implementations return
 * {@link RuleResult#missed()} when the document simply has no match; an exception thrown out of
 * {@link #tryExtract(Document)} is treated by {@link RuleChain} as {@link RuleResult.Status#FAILED}.
 */
@FunctionalInterface
public interface CandidateRule {

    RuleResult tryExtract(Document document);

    default String describe() {
        return getClass().getSimpleName();
    }
}
