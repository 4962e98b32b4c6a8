package dev.careercrawler.extract;

import dev.careercrawler.config.ScrapingConfig.Target;
import dev.careercrawler.extract.impl.LinkHeuristicExtractor;
import dev.careercrawler.extract.impl.SelectorPostingExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Picks the extractor for a target: its CSS selector if configured, then a named extractor,
 * then the link heuristic.
 */
@Slf4j
@Component
public class PostingExtractorResolver {

    private final Map<String, PostingExtractor> extractors;
    private final PostingExtractor defaultExtractor;

    public PostingExtractorResolver(List<PostingExtractor> extractors) {
        this.extractors = extractors.stream()
                .collect(Collectors.toMap(PostingExtractor::getName, Function.identity(), (a, b) -> a));
        PostingExtractor heuristic = this.extractors.get(LinkHeuristicExtractor.NAME);
        this.defaultExtractor = heuristic != null ? heuristic : new LinkHeuristicExtractor();
        log.info("Registered posting extractors: {}", this.extractors.keySet());
    }

    public PostingExtractor resolve(Target target) {
        if (target.getSelector() != null && !target.getSelector().isBlank()) {
            return new SelectorPostingExtractor(target.getSelector());
        }
        String name = target.getExtractor();
        if (name == null || name.isBlank()) {
            return defaultExtractor;
        }
        PostingExtractor extractor = extractors.get(name.trim());
        if (extractor == null) {
            log.warn("Unknown extractor '{}' for {}. Falling back to {}", name, target.getName(),
                    defaultExtractor.getName());
            return defaultExtractor;
        }
        return extractor;
    }
}
