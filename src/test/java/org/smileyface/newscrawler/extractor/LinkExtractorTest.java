package org.smileyface.newscrawler.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class LinkExtractorTest {

    private static Document page(int articles, int others) {
        StringBuilder sb = new StringBuilder("<html><body>");
        for (int i = 0; i < others; i++) sb.append("<a href='/section").append(i).append("'>o</a>");
        for (int i = 0; i < articles; i++) sb.append("<a href='/news/").append(i).append("'>a</a>");
        sb.append("</body></html>");
        return Jsoup.parse(sb.toString(), "https://www.bbc.com/");
    }

    @Test
    void capsArticleAndOtherLinksSeparately() {
        LinkExtractor extractor = new LinkExtractor(List.of("/news/"), 3, 2);
        List<String> links = extractor.extractLinks(page(5, 4));

        assertThat(links).containsExactly(
                "https://www.bbc.com/news/0",
                "https://www.bbc.com/news/1",
                "https://www.bbc.com/news/2",
                "https://www.bbc.com/section0",
                "https://www.bbc.com/section1");
    }

    @Test
    void resolvesRelativeAndDropsDuplicates() {
        Document doc = Jsoup.parse("""
                <a href="story/1">x</a>
                <a href="https://www.bbc.com/world/story/1">dup</a>
                <a>no href</a>
                """, "https://www.bbc.com/world/");
        LinkExtractor extractor = new LinkExtractor(List.of("/story"), 10, 10);

        assertThat(extractor.extractLinks(doc)).containsExactly("https://www.bbc.com/world/story/1");
    }

    @Test
    void isArticle_matchesKeywordInPathOnly() {
        LinkExtractor extractor = new LinkExtractor(List.of("/News/"), 1, 1);
        assertThat(extractor.isArticle("https://www.bbc.com/NEWS/x")).isTrue();
        assertThat(extractor.isArticle("https://news.bbc.com/x")).isFalse();
    }
}
