package dev.careercrawler.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * A posting found on a career page, before preference filtering and persistence.
 */
@Data
@Builder
public class CandidatePosting {
    private String title;
    private String url;
    private String company;

    // Unknown for link-based extraction
    private String location;
    private String description;
    private LocalDateTime postedAt;
}
