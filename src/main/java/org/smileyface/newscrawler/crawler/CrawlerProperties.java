package org.smileyface.newscrawler.crawler;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of the news crawl: seeds, frontier policy, extraction selectors and the
 * domain source table.
 */
@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {

    private static final Logger log = LogManager.getLogger(CrawlerProperties.class);

    static final String DEFAULTS_RESOURCE = "NewsCrawlerConfig.json";

    /** Entry points of a crawl when none are given on the command line. */
    private List<String> seedUrls = new ArrayList<>();

    /** A URL is crawled only if its host contains one of these domains. */
    private List<String> allowedDomains = new ArrayList<>();

    /** Case-insensitive substrings that reject a URL (fragments, pseudo schemes, non-content paths). */
    private List<String> excludeKeywords = new ArrayList<>(List.of("#", "javascript:", "mailto:", "tel:"));

    /** Ceiling on the number of URLs dispatched in one run. */
    private int maxPages = 150;

    private int maxUrlLength = 300;

    private String userAgent = "SmileyfaceNewsCrawler/0.1";

    /** Fetch timeout in milliseconds. */
    private int requestTimeoutMs = 10000;

    private int workerCount = 4;

    /** Global crawl timeout; once elapsed no new page is dispatched. */
    private long crawlTimeoutMs = 600_000L;

    /** Time granted to in-flight pages after the crawl timeout before workers are interrupted. */
    private long stopGracePeriodMs = 10_000L;

    /** How long an idle worker waits for other workers to discover links. */
    private long pollIntervalMs = 200L;

    /** JSON file the records are merged into. */
    private String outputFile = "result.json";

    private int articleLinkLimit = 20;
    private int otherLinkLimit = 5;

    /** Path fragments marking a link as a likely article. */
    private List<String> articleKeywords = new ArrayList<>();

    /** Maximum description length, 0 for unlimited. */
    private int descriptionMaxLength = 0;

    /** A title candidate must be longer than this. */
    private int minTitleLength = 5;

    /** A fallback paragraph must be longer than this. */
    private int minParagraphLength = 30;

    /** Paragraphs starting with one of these (case-insensitive) are not used as descriptions. */
    private List<String> boilerplatePrefixes = new ArrayList<>();

    /** Headline selectors tried before the og:title and title tags. */
    private List<String> titleSelectors = new ArrayList<>(List.of("h1"));

    /** Article body / lead zones tried after the description meta tags. */
    private List<String> descriptionSelectors = new ArrayList<>();

    /** Zones whose first image is used when no preview image meta tag exists. */
    private List<String> imageSelectors = new ArrayList<>(List.of("article img[src]", "main img[src]"));

    /** Domains whose pages fall back to {@link #localDefaultImage}. */
    private List<String> localDomains = new ArrayList<>();

    private String localDefaultImage;
    private String globalDefaultImage;

    /** Domain table used to derive tags and the publisher name. */
    private List<SourceConfig> sources = new ArrayList<>();

    /**
     * Loads default values from classpath resource NewsCrawlerConfig.json if available.
     * Spring still binds/overrides values from application properties as usual.
     */
    public CrawlerProperties() {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                NewsCrawlerConfig cfg = new ObjectMapper().readValue(in, NewsCrawlerConfig.class);
                apply(cfg);
            }
        } catch (Exception e) {
            // Keep built-in defaults when the file is malformed; do not fail application startup
            log.error("Failed to load default crawler configuration from classpath resource {}", DEFAULTS_RESOURCE, e);
        }
    }

    private void apply(NewsCrawlerConfig cfg) {
        if (cfg.seedUrls != null) this.seedUrls = new ArrayList<>(cfg.seedUrls);
        if (cfg.allowedDomains != null) this.allowedDomains = new ArrayList<>(cfg.allowedDomains);
        if (cfg.excludeKeywords != null) this.excludeKeywords = new ArrayList<>(cfg.excludeKeywords);
        if (cfg.maxPages != null && cfg.maxPages > 0) this.maxPages = cfg.maxPages;
        if (cfg.maxUrlLength != null && cfg.maxUrlLength > 0) this.maxUrlLength = cfg.maxUrlLength;
        if (cfg.userAgent != null && !cfg.userAgent.isBlank()) this.userAgent = cfg.userAgent;
        if (cfg.articleLinkLimit != null) this.articleLinkLimit = cfg.articleLinkLimit;
        if (cfg.otherLinkLimit != null) this.otherLinkLimit = cfg.otherLinkLimit;
        if (cfg.articleKeywords != null) this.articleKeywords = new ArrayList<>(cfg.articleKeywords);
        if (cfg.boilerplatePrefixes != null) this.boilerplatePrefixes = new ArrayList<>(cfg.boilerplatePrefixes);
        if (cfg.titleSelectors != null) this.titleSelectors = new ArrayList<>(cfg.titleSelectors);
        if (cfg.descriptionSelectors != null) this.descriptionSelectors = new ArrayList<>(cfg.descriptionSelectors);
        if (cfg.imageSelectors != null) this.imageSelectors = new ArrayList<>(cfg.imageSelectors);
        if (cfg.localDomains != null) this.localDomains = new ArrayList<>(cfg.localDomains);
        if (cfg.localDefaultImage != null && !cfg.localDefaultImage.isBlank()) this.localDefaultImage = cfg.localDefaultImage;
        if (cfg.globalDefaultImage != null && !cfg.globalDefaultImage.isBlank()) this.globalDefaultImage = cfg.globalDefaultImage;
        if (cfg.sources != null) this.sources = new ArrayList<>(cfg.sources);
    }

    public List<String> getSeedUrls() { return seedUrls; }
    public void setSeedUrls(List<String> seedUrls) { this.seedUrls = seedUrls != null ? seedUrls : new ArrayList<>(); }

    public List<String> getAllowedDomains() { return allowedDomains; }
    public void setAllowedDomains(List<String> allowedDomains) {
        this.allowedDomains = allowedDomains != null ? allowedDomains : new ArrayList<>();
    }

    public List<String> getExcludeKeywords() { return excludeKeywords; }
    public void setExcludeKeywords(List<String> excludeKeywords) {
        this.excludeKeywords = excludeKeywords != null ? excludeKeywords : new ArrayList<>();
    }

    public int getMaxPages() { return maxPages; }
    public void setMaxPages(int maxPages) { this.maxPages = maxPages; }

    public int getMaxUrlLength() { return maxUrlLength; }
    public void setMaxUrlLength(int maxUrlLength) { this.maxUrlLength = maxUrlLength; }

    public String getUserAgent() { return userAgent; }
    public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

    public int getRequestTimeoutMs() { return requestTimeoutMs; }
    public void setRequestTimeoutMs(int requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

    public int getWorkerCount() { return workerCount; }
    public void setWorkerCount(int workerCount) { this.workerCount = workerCount; }

    public long getCrawlTimeoutMs() { return crawlTimeoutMs; }
    public void setCrawlTimeoutMs(long crawlTimeoutMs) { this.crawlTimeoutMs = crawlTimeoutMs; }

    public long getStopGracePeriodMs() { return stopGracePeriodMs; }
    public void setStopGracePeriodMs(long stopGracePeriodMs) { this.stopGracePeriodMs = stopGracePeriodMs; }

    public long getPollIntervalMs() { return pollIntervalMs; }
    public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }

    public String getOutputFile() { return outputFile; }
    public void setOutputFile(String outputFile) {
        this.outputFile = (outputFile == null || outputFile.isBlank()) ? "result.json" : outputFile;
    }

    public int getArticleLinkLimit() { return articleLinkLimit; }
    public void setArticleLinkLimit(int articleLinkLimit) { this.articleLinkLimit = articleLinkLimit; }

    public int getOtherLinkLimit() { return otherLinkLimit; }
    public void setOtherLinkLimit(int otherLinkLimit) { this.otherLinkLimit = otherLinkLimit; }

    public List<String> getArticleKeywords() { return articleKeywords; }
    public void setArticleKeywords(List<String> articleKeywords) {
        this.articleKeywords = articleKeywords != null ? articleKeywords : new ArrayList<>();
    }

    public int getDescriptionMaxLength() { return descriptionMaxLength; }
    public void setDescriptionMaxLength(int descriptionMaxLength) { this.descriptionMaxLength = descriptionMaxLength; }

    public int getMinTitleLength() { return minTitleLength; }
    public void setMinTitleLength(int minTitleLength) { this.minTitleLength = minTitleLength; }

    public int getMinParagraphLength() { return minParagraphLength; }
    public void setMinParagraphLength(int minParagraphLength) { this.minParagraphLength = minParagraphLength; }

    public List<String> getBoilerplatePrefixes() { return boilerplatePrefixes; }
    public void setBoilerplatePrefixes(List<String> boilerplatePrefixes) {
        this.boilerplatePrefixes = boilerplatePrefixes != null ? boilerplatePrefixes : new ArrayList<>();
    }

    public List<String> getTitleSelectors() { return titleSelectors; }
    public void setTitleSelectors(List<String> titleSelectors) {
        this.titleSelectors = titleSelectors != null ? titleSelectors : new ArrayList<>();
    }

    public List<String> getDescriptionSelectors() { return descriptionSelectors; }
    public void setDescriptionSelectors(List<String> descriptionSelectors) {
        this.descriptionSelectors = descriptionSelectors != null ? descriptionSelectors : new ArrayList<>();
    }

    public List<String> getImageSelectors() { return imageSelectors; }
    public void setImageSelectors(List<String> imageSelectors) {
        this.imageSelectors = imageSelectors != null ? imageSelectors : new ArrayList<>();
    }

    public List<String> getLocalDomains() { return localDomains; }
    public void setLocalDomains(List<String> localDomains) {
        this.localDomains = localDomains != null ? localDomains : new ArrayList<>();
    }

    public String getLocalDefaultImage() { return localDefaultImage; }
    public void setLocalDefaultImage(String localDefaultImage) { this.localDefaultImage = localDefaultImage; }

    public String getGlobalDefaultImage() { return globalDefaultImage; }
    public void setGlobalDefaultImage(String globalDefaultImage) { this.globalDefaultImage = globalDefaultImage; }

    public List<SourceConfig> getSources() { return sources; }
    public void setSources(List<SourceConfig> sources) { this.sources = sources != null ? sources : new ArrayList<>(); }

    // --------- Nested config DTOs for JSON mapping ---------
    public static class NewsCrawlerConfig {
        public List<String> seedUrls;
        public List<String> allowedDomains;
        public List<String> excludeKeywords;
        public Integer maxPages;
        public Integer maxUrlLength;
        public String userAgent;
        public Integer articleLinkLimit;
        public Integer otherLinkLimit;
        public List<String> articleKeywords;
        public List<String> boilerplatePrefixes;
        public List<String> titleSelectors;
        public List<String> descriptionSelectors;
        public List<String> imageSelectors;
        public List<String> localDomains;
        public String localDefaultImage;
        public String globalDefaultImage;
        public List<SourceConfig> sources;
    }

    /**
     * One row of the domain table: a host substring, the publisher name and its tags.
     */
    public static class SourceConfig {

        private String domain;
        private String name;
        private List<String> tags = new ArrayList<>();

        public SourceConfig() {} // for JSON mapping and property binding

        public SourceConfig(String domain, String name, List<String> tags) {
            this.domain = domain;
            this.name = name;
            this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
        }

        public String getDomain() { return domain; }
        public void setDomain(String domain) { this.domain = domain; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public List<String> getTags() { return tags; }
        public void setTags(List<String> tags) { this.tags = tags != null ? tags : new ArrayList<>(); }
    }
}
