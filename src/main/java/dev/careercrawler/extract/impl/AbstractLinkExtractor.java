package dev.careercrawler.extract.impl;

import dev.careercrawler.extract.PostingExtractor;
import dev.careercrawler.model.CandidatePosting;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Base for extractors that turn anchors of a parsed page into candidates.
 */
@Slf4j
public abstract class AbstractLinkExtractor implements PostingExtractor {

    static final String NO_TITLE = "(No Title Text)";

    /**
     * Select the anchors worth considering on the page.
     */
    protected abstract Elements selectLinks(Document document);

    /**
     * Decide whether a resolved link is a candidate posting.
     */
    protected abstract boolean isCandidate(String title, String resolvedUrl);

    @Override
    public List<CandidatePosting> extract(String content, String baseUrl) {
        if (content == null || content.isBlank()) {
            return List.of();
        }

        Document document = Jsoup.parse(content, baseUrl);
        Elements links = selectLinks(document);
        List<CandidatePosting> candidates = new ArrayList<>();

        for (Element link : links) {
            String href = link.attr("href").trim();
            if (href.isEmpty() || isFragmentOrScript(href)) {
                continue;
            }

            String resolvedUrl = link.absUrl("href");
            if (resolvedUrl.isBlank()) {
                log.debug("Skipping unresolvable link: {}", href);
                continue;
            }

            String title = link.text().trim();
            if (title.isEmpty()) {
                title = NO_TITLE;
            }

            if (isCandidate(title, resolvedUrl)) {
                candidates.add(CandidatePosting.builder()
                        .title(title)
                        .url(resolvedUrl)
                        .build());
                log.debug("Potential job found: {} - {}", title, resolvedUrl);
            } else {
                log.debug("Skipping link: {} - {}", title, resolvedUrl);
            }
        }

        if (candidates.isEmpty() && !links.isEmpty()) {
            log.warn("No potential jobs identified by {} on {}. Review parsing logic or site structure.",
                    getName(), baseUrl);
        } else if (links.isEmpty()) {
            log.warn("No links found at all on {}. Page might be empty, require JS, or structure is unexpected.",
                    baseUrl);
        }
        return candidates;
    }

    private static boolean isFragmentOrScript(String href) {
        return href.startsWith("#") || href.toLowerCase(Locale.ROOT).startsWith("javascript:");
    }
}
