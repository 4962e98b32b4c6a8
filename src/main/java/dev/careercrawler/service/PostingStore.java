package dev.careercrawler.service;

import dev.careercrawler.entity.Posting;
import dev.careercrawler.model.CandidatePosting;
import dev.careercrawler.model.PostingView;
import dev.careercrawler.repository.PostingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable store of accepted postings. The unique URL constraint is the deduplication authority.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PostingStore {

    private final PostingRepository postingRepository;
    private final Clock clock;

    /**
     * Result of an insert attempt.
     */
    public record InsertResult(Status status, Posting posting) {

        public enum Status {
            CREATED,
            DUPLICATE
        }

        public static InsertResult created(Posting posting) {
            return new InsertResult(Status.CREATED, posting);
        }

        public static InsertResult duplicate() {
            return new InsertResult(Status.DUPLICATE, null);
        }

        public boolean isCreated() {
            return status == Status.CREATED;
        }
    }

    /**
     * All stored URLs, loaded once per run to skip already-seen candidates early.
     *
     * @return mutable copy of the stored URL set
     */
    public Set<String> knownUrls() {
        Set<String> urls = new HashSet<>(postingRepository.findAllUrls());
        log.info("Loaded {} existing posting URLs", urls.size());
        return urls;
    }

    /**
     * Persist the candidate unless a posting with the same URL exists.
     * A concurrent insert of the same URL is reported as a duplicate, not an error.
     *
     * @param candidate accepted candidate, company already set
     * @return InsertResult with the stored posting, or DUPLICATE
     */
    public InsertResult insertIfAbsent(CandidatePosting candidate) {
        if (candidate.getUrl() == null || candidate.getCompany() == null || candidate.getTitle() == null) {
            throw new IllegalArgumentException("company, title and url are required: " + candidate);
        }

        if (postingRepository.existsByUrl(candidate.getUrl())) {
            log.debug("Posting already exists (URL: {}). Skipping.", candidate.getUrl());
            return InsertResult.duplicate();
        }

        Posting posting = Posting.builder()
                .url(candidate.getUrl())
                .company(candidate.getCompany())
                .title(candidate.getTitle())
                .location(candidate.getLocation())
                .description(candidate.getDescription())
                .postedAt(candidate.getPostedAt())
                .scrapedAt(LocalDateTime.now(clock))
                .build();

        try {
            Posting saved = postingRepository.saveAndFlush(posting);
            log.info("Added new posting: {} - {}", saved.getCompany(), saved.getTitle());
            return InsertResult.created(saved);
        } catch (DataIntegrityViolationException e) {
            // Only a URL that now exists means another writer won; any other constraint is a real error
            if (!postingRepository.existsByUrl(candidate.getUrl())) {
                throw e;
            }
            log.debug("Posting inserted concurrently (URL: {}). Treating as duplicate.", candidate.getUrl());
            return InsertResult.duplicate();
        }
    }

    /**
     * Postings not yet alerted and neither applied nor ignored, newest first.
     */
    public List<Posting> selectUnnotifiedAcceptable() {
        return postingRepository.findByNotifiedFalseAndIgnoredFalseAndAppliedFalseOrderByScrapedAtDesc();
    }

    public long countUnnotifiedAcceptable() {
        return postingRepository.countByNotifiedFalseAndIgnoredFalseAndAppliedFalse();
    }

    /**
     * Mark a posting as alerted. Never reverted.
     *
     * @param id posting id
     * @return false if no posting has this id
     */
    @Transactional
    public boolean markNotified(Long id) {
        Optional<Posting> posting = postingRepository.findById(id);
        if (posting.isEmpty()) {
            log.warn("Could not mark posting as notified: ID {} not found", id);
            return false;
        }
        posting.get().setNotified(true);
        log.debug("Marked posting ID {} as notified", id);
        return true;
    }

    /**
     * Change the applied and/or ignored flags. Setting one to true clears the other.
     *
     * @param id      posting id
     * @param applied new applied flag, or null to keep it
     * @param ignored new ignored flag, or null to keep it
     * @return false if no change was requested or no posting has this id
     */
    @Transactional
    public boolean updateStatus(Long id, Boolean applied, Boolean ignored) {
        if (applied == null && ignored == null) {
            log.warn("No status change provided for posting ID {}", id);
            return false;
        }
        if (Boolean.TRUE.equals(applied) && Boolean.TRUE.equals(ignored)) {
            throw new IllegalArgumentException("A posting cannot be both applied and ignored");
        }

        Optional<Posting> found = postingRepository.findById(id);
        if (found.isEmpty()) {
            log.warn("Could not update status: posting ID {} not found", id);
            return false;
        }

        Posting posting = found.get();
        if (applied != null) {
            posting.setApplied(applied);
            if (applied) {
                posting.setIgnored(false);
            }
            log.info("Set posting ID {} applied status to: {}", id, applied);
        }
        if (ignored != null) {
            posting.setIgnored(ignored);
            if (ignored) {
                posting.setApplied(false);
            }
            log.info("Set posting ID {} ignored status to: {}", id, ignored);
        }
        return true;
    }

    /**
     * Postings in the given status bucket, newest first.
     */
    public List<Posting> selectByStatus(PostingView view) {
        return switch (view) {
            case APPLIED -> postingRepository.findByAppliedTrueOrderByScrapedAtDesc();
            case IGNORED -> postingRepository.findByIgnoredTrueOrderByScrapedAtDesc();
            case ACTIVE -> postingRepository.findByAppliedFalseAndIgnoredFalseOrderByScrapedAtDesc();
        };
    }
}
