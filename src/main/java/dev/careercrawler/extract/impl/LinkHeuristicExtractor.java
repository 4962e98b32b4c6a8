package dev.careercrawler.extract.impl;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Site-agnostic extractor: every link whose text or URL looks job-related is a candidate.
 * A provisional heuristic; targets with a known structure should configure a selector.
 */
@Slf4j
@Component
public class LinkHeuristicExtractor extends AbstractLinkExtractor {

    public static final String NAME = "link-heuristic";

    private static final List<String> TEXT_KEYWORDS = List.of("job", "career", "openings", "position");
    private static final List<String> URL_KEYWORDS = List.of("job", "career", "posting", "requisition");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected Elements selectLinks(Document document) {
        Elements links = document.select("a[href]");
        log.debug("Using basic link extraction for {}. Found {} links.", document.location(), links.size());
        return links;
    }

    @Override
    protected boolean isCandidate(String title, String resolvedUrl) {
        String text = title.toLowerCase(Locale.ROOT);
        String url = resolvedUrl.toLowerCase(Locale.ROOT);
        return TEXT_KEYWORDS.stream().anyMatch(text::contains)
                || URL_KEYWORDS.stream().anyMatch(url::contains);
    }
}
