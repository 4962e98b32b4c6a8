package dev.careercrawler.service;

import dev.careercrawler.ExitManager;
import dev.careercrawler.PipelineRunner;
import dev.careercrawler.config.AppConfig;
import dev.careercrawler.entity.Posting;
import dev.careercrawler.model.CandidatePosting;
import dev.careercrawler.model.PostingView;
import dev.careercrawler.repository.PostingRepository;
import dev.careercrawler.service.PostingStore.InsertResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@Import({PostingStore.class, AppConfig.class})
class PostingStoreIntegrationTest {

    @MockitoBean
    private PipelineRunner pipelineRunner;

    @MockitoBean
    private ExitManager exitManager;

    @Autowired
    private PostingStore postingStore;

    @Autowired
    private PostingRepository postingRepository;

    private CandidatePosting candidate(String url, String title) {
        return CandidatePosting.builder()
                .title(title)
                .url(url)
                .company("Acme")
                .build();
    }

    private Posting stored(String url, LocalDateTime scrapedAt) {
        return postingRepository.save(Posting.builder()
                .url(url)
                .company("Acme")
                .title("Engineer " + url)
                .scrapedAt(scrapedAt)
                .build());
    }

    @Test
    @DisplayName("Inserting the same URL twice should keep one row")
    void insertShouldBeIdempotentPerUrl() {
        InsertResult first = postingStore.insertIfAbsent(candidate("https://acme.example/jobs/1", "Engineer"));
        InsertResult second = postingStore.insertIfAbsent(candidate("https://acme.example/jobs/1", "Engineer (copy)"));

        assertThat(first.isCreated()).isTrue();
        assertThat(first.posting().getId()).isNotNull();
        assertThat(second.isCreated()).isFalse();
        assertThat(postingRepository.count()).isEqualTo(1);
        assertThat(postingStore.knownUrls()).containsExactly("https://acme.example/jobs/1");
    }

    @Test
    @DisplayName("Unnotified selection should skip handled postings and list newest first")
    void unnotifiedSelectionShouldSkipHandledPostings() {
        LocalDateTime base = LocalDateTime.of(2025, 3, 1, 9, 0);
        Posting older = stored("https://acme.example/jobs/old", base);
        Posting newer = stored("https://acme.example/jobs/new", base.plusHours(1));
        Posting notified = stored("https://acme.example/jobs/notified", base.plusHours(2));
        Posting applied = stored("https://acme.example/jobs/applied", base.plusHours(3));
        Posting ignored = stored("https://acme.example/jobs/ignored", base.plusHours(4));

        postingStore.markNotified(notified.getId());
        postingStore.updateStatus(applied.getId(), true, null);
        postingStore.updateStatus(ignored.getId(), null, true);

        assertThat(postingStore.selectUnnotifiedAcceptable())
                .extracting(Posting::getId)
                .containsExactly(newer.getId(), older.getId());
        assertThat(postingStore.countUnnotifiedAcceptable()).isEqualTo(2);
    }

    @Test
    @DisplayName("Status views should partition by applied and ignored")
    void statusViewsShouldPartition() {
        LocalDateTime base = LocalDateTime.of(2025, 3, 1, 9, 0);
        Posting active = stored("https://acme.example/jobs/a", base);
        Posting applied = stored("https://acme.example/jobs/b", base.plusMinutes(1));
        Posting ignored = stored("https://acme.example/jobs/c", base.plusMinutes(2));

        postingStore.updateStatus(applied.getId(), true, null);
        postingStore.updateStatus(ignored.getId(), null, true);
        postingStore.updateStatus(ignored.getId(), true, null);

        assertThat(postingStore.selectByStatus(PostingView.ACTIVE)).extracting(Posting::getId)
                .containsExactly(active.getId());
        assertThat(postingStore.selectByStatus(PostingView.APPLIED)).extracting(Posting::getId)
                .containsExactly(ignored.getId(), applied.getId());
        assertThat(postingStore.selectByStatus(PostingView.IGNORED)).isEmpty();
    }
}
