package org.smileyface.newscrawler.extractor;

import org.smileyface.newscrawler.model.NewsRecord;

import java.util.List;

/**
 * Result of extracting one page: its record and the candidate outbound links.
 */
public record ExtractedPage(NewsRecord record, List<String> links) {

    public ExtractedPage {
        links = links == null ? List.of() : List.copyOf(links);
    }
}
