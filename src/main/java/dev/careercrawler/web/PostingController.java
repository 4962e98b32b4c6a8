package dev.careercrawler.web;

import dev.careercrawler.model.PostingView;
import dev.careercrawler.service.PostingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Lists stored postings by status and lets the user mark them applied or ignored.
 * Store calls are blocking JPA calls and run on the bounded-elastic scheduler.
 */
@Slf4j
@RestController
@RequestMapping("/api/postings")
@RequiredArgsConstructor
public class PostingController {

    private final PostingStore postingStore;

    @GetMapping
    public Mono<List<PostingResponse>> list(@RequestParam(name = "view", required = false) String view) {
        PostingView postingView = PostingView.fromParam(view);
        return Mono.fromCallable(() -> postingStore.selectByStatus(postingView).stream()
                        .map(PostingResponse::from)
                        .toList())
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{id}/apply")
    public Mono<ResponseEntity<Void>> apply(@PathVariable("id") Long id) {
        return update(id, true, null);
    }

    @PostMapping("/{id}/unapply")
    public Mono<ResponseEntity<Void>> unapply(@PathVariable("id") Long id) {
        return update(id, false, null);
    }

    @PostMapping("/{id}/ignore")
    public Mono<ResponseEntity<Void>> ignore(@PathVariable("id") Long id) {
        return update(id, null, true);
    }

    @PostMapping("/{id}/unignore")
    public Mono<ResponseEntity<Void>> unignore(@PathVariable("id") Long id) {
        return update(id, null, false);
    }

    private Mono<ResponseEntity<Void>> update(Long id, Boolean applied, Boolean ignored) {
        return Mono.fromCallable(() -> postingStore.updateStatus(id, applied, ignored))
                .subscribeOn(Schedulers.boundedElastic())
                .map(updated -> updated
                        ? ResponseEntity.noContent().<Void>build()
                        : ResponseEntity.notFound().<Void>build());
    }
}
