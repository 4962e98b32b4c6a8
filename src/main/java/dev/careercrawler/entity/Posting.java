package dev.careercrawler.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A job posting accepted by the preference filter.
 * The URL is the identity used for deduplication across runs.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "postings", indexes = {
        @Index(name = "idx_postings_company", columnList = "company"),
        @Index(name = "idx_postings_title", columnList = "title"),
        @Index(name = "idx_postings_notified", columnList = "notified"),
        @Index(name = "idx_postings_applied", columnList = "applied"),
        @Index(name = "idx_postings_ignored", columnList = "ignored")
})
public class Posting {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 2048)
    private String url;

    @Column(nullable = false)
    private String company;

    @Column(nullable = false, length = 1000)
    private String title;

    @Column(length = 500)
    private String location;

    @Column(length = 8000)
    private String description;

    private LocalDateTime postedAt;

    @Column(nullable = false, updatable = false)
    private LocalDateTime scrapedAt;

    @Column(nullable = false)
    private boolean notified;

    @Column(nullable = false)
    private boolean applied;

    @Column(nullable = false)
    private boolean ignored;
}
