package org.smileyface.newscrawler.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.newscrawler.model.CrawlSummary;
import org.smileyface.newscrawler.model.UrlState;
import org.smileyface.newscrawler.service.CrawlerService;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Runs the {@code crawl} command when it is the first program argument. Further arguments are
 * seed URLs; without them the configured seeds are used.
 */
@Component
public class CrawlCliRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    static final String COMMAND = "crawl";

    private final CrawlerService crawlerService;
    private int exitCode;

    public CrawlCliRunner(CrawlerService crawlerService) {
        this.crawlerService = crawlerService;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> raw = Arrays.asList(args.getSourceArgs());
        if (raw.isEmpty()) {
            log.info("Usage: crawl [seedUrl...] | {}", TranslateArguments.USAGE);
            return;
        }
        if (!COMMAND.equals(raw.get(0))) {
            return;
        }
        List<String> seeds = raw.subList(1, raw.size()).stream()
                .filter(s -> !s.startsWith("--"))
                .toList();
        CrawlSummary summary = crawlerService.crawl(seeds, true);
        log.info("Crawling finished: {} new records, {} duplicates, {} failed, {} skipped",
                summary.newRecords(), summary.duplicates(),
                summary.count(UrlState.FAILED), summary.count(UrlState.SKIPPED));
        if (!summary.completed()) {
            exitCode = 3;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
