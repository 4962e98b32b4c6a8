package dev.careercrawler.web;

import dev.careercrawler.entity.Posting;

import java.time.LocalDateTime;

/**
 * JSON view of a stored posting.
 */
public record PostingResponse(
        Long id,
        String company,
        String title,
        String url,
        String location,
        LocalDateTime postedAt,
        LocalDateTime scrapedAt,
        boolean notified,
        boolean applied,
        boolean ignored) {

    public static PostingResponse from(Posting posting) {
        return new PostingResponse(
                posting.getId(),
                posting.getCompany(),
                posting.getTitle(),
                posting.getUrl(),
                posting.getLocation(),
                posting.getPostedAt(),
                posting.getScrapedAt(),
                posting.isNotified(),
                posting.isApplied(),
                posting.isIgnored());
    }
}
