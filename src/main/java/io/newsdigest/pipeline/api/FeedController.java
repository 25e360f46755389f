package io.newsdigest.pipeline.api;

import io.newsdigest.pipeline.api.dto.FeedRequest;
import io.newsdigest.pipeline.api.dto.FeedView;
import io.newsdigest.pipeline.api.service.FeedCatalogService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/feeds")
public class FeedController {

    private final FeedCatalogService feedCatalog;

    public FeedController(FeedCatalogService feedCatalog) {
        this.feedCatalog = feedCatalog;
    }

    @GetMapping
    public List<FeedView> list() {
        return feedCatalog.list().stream().map(FeedView::of).toList();
    }

    @GetMapping("/{feedId}")
    public FeedView get(@PathVariable long feedId) {
        return FeedView.of(feedCatalog.get(feedId));
    }

    @PostMapping
    public ResponseEntity<FeedView> add(@Valid @RequestBody FeedRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(FeedView.of(feedCatalog.add(request)));
    }

    @PatchMapping("/{feedId}")
    public FeedView update(@PathVariable long feedId, @Valid @RequestBody FeedRequest request) {
        return FeedView.of(feedCatalog.update(feedId, request));
    }

    @DeleteMapping("/{feedId}")
    public ResponseEntity<Void> delete(@PathVariable long feedId) {
        feedCatalog.delete(feedId);
        return ResponseEntity.noContent().build();
    }
}
