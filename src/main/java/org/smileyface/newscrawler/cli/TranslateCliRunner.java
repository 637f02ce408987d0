package org.smileyface.newscrawler.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.newscrawler.enrichment.EnrichmentService;
import org.smileyface.newscrawler.enrichment.EnrichmentSummary;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.Arrays;
import java.util.List;

/**
 * Runs the {@code translate} command when it is the first program argument.
 */
@Component
public class TranslateCliRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(TranslateCliRunner.class);

    static final String COMMAND = "translate";

    private final EnrichmentService enrichmentService;
    private int exitCode;

    public TranslateCliRunner(EnrichmentService enrichmentService) {
        this.enrichmentService = enrichmentService;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> raw = Arrays.asList(args.getSourceArgs());
        if (raw.isEmpty() || !COMMAND.equals(raw.get(0))) {
            return;
        }
        TranslateArguments arguments;
        try {
            arguments = TranslateArguments.parse(raw.subList(1, raw.size()));
        } catch (IllegalArgumentException e) {
            log.error("{}. Usage: {}", e.getMessage(), TranslateArguments.USAGE);
            exitCode = 2;
            return;
        }
        log.info("Input file: {}, target language: {}, output file: {}",
                arguments.input(), arguments.language(), arguments.output());
        try {
            EnrichmentSummary summary = enrichmentService.enrichAll(
                    arguments.input(), arguments.language(), arguments.output());
            log.info("Translated fields: {} of {} attempted ({} failed) over {} entries in {} ms, saved to {}",
                    summary.succeeded(), summary.attempted(), summary.failed(), summary.records(),
                    summary.elapsed().toMillis(), summary.output());
        } catch (NoSuchFileException e) {
            log.error("Input file '{}' not found", e.getFile());
            exitCode = 1;
        } catch (IOException e) {
            log.error("Could not read input file '{}': {}", arguments.input(), e.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
