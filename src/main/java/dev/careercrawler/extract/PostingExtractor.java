package dev.careercrawler.extract;

import dev.careercrawler.model.CandidatePosting;

import java.util.List;

/**
 * Turns a fetched career page into candidate postings.
 * Site-specific extractors implement this interface next to the default heuristic.
 */
public interface PostingExtractor {

    /**
     * Name used to select this extractor from a target's configuration.
     */
    String getName();

    /**
     * Extract candidate postings from page content.
     *
     * @param content raw page content
     * @param baseUrl URL the content was fetched from, used to resolve relative links
     * @return candidates found, empty when nothing matched
     */
    List<CandidatePosting> extract(String content, String baseUrl);
}
