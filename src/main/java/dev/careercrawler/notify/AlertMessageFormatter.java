package dev.careercrawler.notify;

import dev.careercrawler.entity.Posting;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;

import java.util.Locale;

/**
 * Renders the alert text for one posting.
 * Messages never exceed Discord's content limit, otherwise the posting would be rejected on every run.
 */
@Component
@RequiredArgsConstructor
public class AlertMessageFormatter {

    static final String TEMPLATE = "alerts/posting-alert";
    static final String UNKNOWN_LOCATION = "unknown";
    static final int MAX_MESSAGE_LENGTH = 2000;
    static final int MAX_TITLE_LENGTH = 256;
    static final int MAX_LOCATION_LENGTH = 200;
    private static final String ELLIPSIS = "...";

    private final TemplateEngine alertTemplateEngine;

    public String format(Posting posting) {
        String location = posting.getLocation() != null && !posting.getLocation().isBlank()
                ? posting.getLocation()
                : UNKNOWN_LOCATION;

        Context context = new Context(Locale.ROOT);
        context.setVariable("company", truncate(posting.getCompany(), MAX_TITLE_LENGTH));
        context.setVariable("title", truncate(posting.getTitle(), MAX_TITLE_LENGTH));
        context.setVariable("location", truncate(location, MAX_LOCATION_LENGTH));
        context.setVariable("url", posting.getUrl());
        return truncate(alertTemplateEngine.process(TEMPLATE, context).strip(), MAX_MESSAGE_LENGTH);
    }

    static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
    }
}
