package org.smileyface.newscrawler.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class RuleChainTest {

    private final Document doc = Jsoup.parse("""
            <html><head><meta name="description" content="  From meta  "></head>
            <body><h2>Sub heading text</h2></body></html>
            """);

    @Test
    void firstMatchingRuleWins() {
        RuleChain chain = new RuleChain("description", List.of(
                new SelectorTextRule("h1"),
                SelectorAttributeRule.meta("meta[name=description]"),
                new SelectorTextRule("h2")));

        assertThat(chain.evaluate(doc)).contains("From meta");
    }

    @Test
    void failingRuleIsSkipped_laterRuleStillEvaluated() {
        AtomicInteger calls = new AtomicInteger();
        CandidateRule broken = d -> {
            calls.incrementAndGet();
            throw new IllegalStateException("boom");
        };
        CandidateRule failedResult = d -> RuleResult.failed(new RuntimeException("reported"));
        RuleChain chain = new RuleChain("title", List.of(broken, failedResult, new SelectorTextRule("h2")));

        assertThat(chain.evaluate(doc)).contains("Sub heading text");
        assertThat(calls).hasValue(1);
    }

    @Test
    void noMatch_usesFallback() {
        RuleChain chain = new RuleChain("title", List.of(new SelectorTextRule("h1"), d -> null));
        assertThat(chain.evaluate(doc)).isEmpty();
        assertThat(chain.evaluate(doc, "No Title")).isEqualTo("No Title");
    }

    @Test
    void selectorTextRule_respectsMinimumLength() {
        assertThat(new SelectorTextRule("h2", 16).tryExtract(doc).isMatched()).isFalse();
        assertThat(new SelectorTextRule("h2", 15).tryExtract(doc).getValue()).isEqualTo("Sub heading text");
    }

    @Test
    void ruleResult_blankTextIsAMiss() {
        assertThat(RuleResult.ofText("   ").getStatus()).isEqualTo(RuleResult.Status.MISSED);
        assertThat(RuleResult.ofText(" x ").getValue()).isEqualTo("x");
        assertThat(RuleResult.failed(new RuntimeException()).getStatus()).isEqualTo(RuleResult.Status.FAILED);
    }
}
