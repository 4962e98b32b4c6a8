package dev.careercrawler.extract.impl;

import org.jsoup.nodes.Document;
import org.jsoup.select.Elements;

/**
 * Extractor for targets with a known page structure: every element matched by the
 * configured CSS selector that carries an href is a candidate.
 */
public class SelectorPostingExtractor extends AbstractLinkExtractor {

    private final String selector;

    public SelectorPostingExtractor(String selector) {
        if (selector == null || selector.isBlank()) {
            throw new IllegalArgumentException("selector must not be blank");
        }
        this.selector = selector.trim();
    }

    @Override
    public String getName() {
        return "selector[" + selector + "]";
    }

    @Override
    protected Elements selectLinks(Document document) {
        return document.select(selector).select("[href]");
    }

    @Override
    protected boolean isCandidate(String title, String resolvedUrl) {
        return true;
    }
}
