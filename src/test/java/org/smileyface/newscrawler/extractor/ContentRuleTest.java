package org.smileyface.newscrawler.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ContentRuleTest {

    @Test
    void minCharacterRule_trimsAndCompares() {
        Element div = Jsoup.parse("<div>   abc  </div>").selectFirst("div");
        assertThat(new MinCharacterRule(3).isMatched(div)).isTrue();
        assertThat(new MinCharacterRule(4).isMatched(div)).isFalse();
        assertThat(new MinCharacterRule(-5).getMinChars()).isZero();
        assertThat(new MinCharacterRule(0).isMatched(null)).isFalse();
    }

    @Test
    void tagNameRule_caseInsensitive() {
        Element p = Jsoup.parse("<P>text</P>").selectFirst("p");
        assertThat(new TagNameContentRule("P").isMatched(p)).isTrue();
        assertThat(new TagNameContentRule("div").isMatched(p)).isFalse();
        assertThatThrownBy(() -> new TagNameContentRule(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void boilerplateRule_rejectsConfiguredPrefixes() {
        BoilerplateFreeRule rule = new BoilerplateFreeRule(List.of("Copyright", "advertisement"));
        Document doc = Jsoup.parse("""
                <p id="a">COPYRIGHT 2024 Publisher</p>
                <p id="b">Advertisement - scroll to continue</p>
                <p id="c">Prices climbed, copyright aside.</p>
                """);
        assertThat(rule.isMatched(doc.getElementById("a"))).isFalse();
        assertThat(rule.isMatched(doc.getElementById("b"))).isFalse();
        assertThat(rule.isMatched(doc.getElementById("c"))).isTrue();
    }

    @Test
    void paragraphScan_returnsFirstElementMatchingAllRules() {
        Document doc = Jsoup.parse("""
                <div>Long text in a div that should be ignored entirely</div>
                <p>short</p>
                <p>A paragraph that is long enough to be chosen</p>
                """);
        ParagraphScanRule rule = new ParagraphScanRule(List.of(
                new TagNameContentRule("p"), new MinCharacterRule(20)));

        assertThat(rule.tryExtract(doc).getValue()).isEqualTo("A paragraph that is long enough to be chosen");
        assertThatThrownBy(() -> new ParagraphScanRule(List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
