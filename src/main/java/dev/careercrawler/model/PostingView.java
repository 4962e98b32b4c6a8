package dev.careercrawler.model;

import java.util.Locale;

/**
 * Status buckets the stored postings are listed by.
 */
public enum PostingView {
    ACTIVE,
    APPLIED,
    IGNORED;

    /**
     * Parse a view name, falling back to {@link #ACTIVE} for blank or unknown values.
     */
    public static PostingView fromParam(String value) {
        if (value == null || value.isBlank()) {
            return ACTIVE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ACTIVE;
        }
    }
}
