package org.smileyface.newscrawler.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.smileyface.newscrawler.crawler.CrawlerProperties;
import org.smileyface.newscrawler.model.NewsRecord;
import org.smileyface.newscrawler.util.CrawlerUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns fetched markup into a {@link NewsRecord} plus outbound links. Title, description and
 * image each come from an ordered {@link RuleChain} built from {@link CrawlerProperties}; tags and
 * the publisher name come from the {@link SourceCatalog}.
 */
public class PageExtractor {

    private final RuleChain titleChain;
    private final RuleChain descriptionChain;
    private final RuleChain imageChain;
    private final SourceCatalog sourceCatalog;
    private final LinkExtractor linkExtractor;
    private final int descriptionMaxLength;
    private final String localDefaultImage;
    private final String globalDefaultImage;
    private final Clock clock;

    public PageExtractor(CrawlerProperties properties, Clock clock) {
        Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.titleChain = titleChain(properties);
        this.descriptionChain = descriptionChain(properties);
        this.imageChain = imageChain(properties);
        this.sourceCatalog = new SourceCatalog(properties.getSources(), properties.getLocalDomains());
        this.linkExtractor = new LinkExtractor(properties.getArticleKeywords(),
                properties.getArticleLinkLimit(), properties.getOtherLinkLimit());
        this.descriptionMaxLength = properties.getDescriptionMaxLength();
        this.localDefaultImage = properties.getLocalDefaultImage();
        this.globalDefaultImage = properties.getGlobalDefaultImage();
    }

    /**
     * Extracts a page whose links resolve against its own URL.
     */
    public ExtractedPage extract(String url, String html) {
        return extract(url, url, html);
    }

    /**
     * @param url     key of the record
     * @param baseUrl URL relative links and images resolve against (the post-redirect URL)
     * @param html    raw markup, may be null or empty
     * @throws PageExtractionException on any unexpected failure
     */
    public ExtractedPage extract(String url, String baseUrl, String html) {
        try {
            Document doc = Jsoup.parse(html == null ? "" : html, baseUrl == null ? url : baseUrl);

            String title = titleChain.evaluate(doc, NewsRecord.NO_TITLE);
            String description = CrawlerUtils.truncate(
                    descriptionChain.evaluate(doc, NewsRecord.NO_DESCRIPTION), descriptionMaxLength);
            SourceCatalog.Source source = sourceCatalog.lookup(CrawlerUtils.hostOf(url));
            String image = imageChain.evaluate(doc)
                    .orElse(source.local() ? localDefaultImage : globalDefaultImage);

            NewsRecord record = new NewsRecord(url, title, description, image,
                    source.tags(), source.name(), Instant.now(clock).toString());
            return new ExtractedPage(record, linkExtractor.extractLinks(doc));
        } catch (RuntimeException e) {
            throw new PageExtractionException("Failed to extract page " + url, e);
        }
    }

    static RuleChain titleChain(CrawlerProperties p) {
        int min = p.getMinTitleLength();
        List<CandidateRule> rules = new ArrayList<>();
        for (String selector : p.getTitleSelectors()) {
            rules.add(new SelectorTextRule(selector, min));
        }
        rules.add(new SelectorAttributeRule("meta[property=og:title]", "content", min));
        rules.add(new SelectorTextRule("title", min));
        return new RuleChain("title", rules);
    }

    static RuleChain descriptionChain(CrawlerProperties p) {
        int min = p.getMinParagraphLength();
        List<CandidateRule> rules = new ArrayList<>();
        rules.add(SelectorAttributeRule.meta("meta[name=description]"));
        rules.add(SelectorAttributeRule.meta("meta[property=og:description]"));
        for (String selector : p.getDescriptionSelectors()) {
            rules.add(new SelectorTextRule(selector, min));
        }
        rules.add(new ParagraphScanRule(List.of(
                new TagNameContentRule("p"),
                new MinCharacterRule(min + 1),
                new BoilerplateFreeRule(p.getBoilerplatePrefixes()))));
        return new RuleChain("description", rules);
    }

    static RuleChain imageChain(CrawlerProperties p) {
        List<CandidateRule> rules = new ArrayList<>();
        rules.add(new SelectorAttributeRule("meta[property=og:image]", "abs:content"));
        rules.add(new SelectorAttributeRule("meta[name=twitter:image]", "abs:content"));
        rules.add(new SelectorAttributeRule("meta[name=twitter:image:src]", "abs:content"));
        for (String selector : p.getImageSelectors()) {
            rules.add(new SelectorAttributeRule(selector, "abs:src"));
        }
        return new RuleChain("image", rules);
    }
}
