package dev.careercrawler.repository;

import dev.careercrawler.entity.Posting;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Set;

/**
 * Repository for stored job postings.
 */
@Repository
public interface PostingRepository extends JpaRepository<Posting, Long> {

    /**
     * Check if a posting URL is already stored.
     */
    boolean existsByUrl(String url);

    /**
     * Find all stored URLs.
     */
    @Query("SELECT p.url FROM Posting p")
    Set<String> findAllUrls();

    /**
     * Postings still waiting for an alert, newest first.
     */
    List<Posting> findByNotifiedFalseAndIgnoredFalseAndAppliedFalseOrderByScrapedAtDesc();

    long countByNotifiedFalseAndIgnoredFalseAndAppliedFalse();

    List<Posting> findByAppliedFalseAndIgnoredFalseOrderByScrapedAtDesc();

    List<Posting> findByAppliedTrueOrderByScrapedAtDesc();

    List<Posting> findByIgnoredTrueOrderByScrapedAtDesc();
}
