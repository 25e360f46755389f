package io.newsdigest.pipeline.api;

import io.newsdigest.pipeline.api.dto.FeedTagsRequest;
import io.newsdigest.pipeline.api.dto.TagRequest;
import io.newsdigest.pipeline.api.dto.TagView;
import io.newsdigest.pipeline.api.service.TagService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/tags")
public class TagController {

    private final TagService tagService;

    public TagController(TagService tagService) {
        this.tagService = tagService;
    }

    @GetMapping
    public List<TagView> list() {
        return tagService.list().stream().map(TagView::of).toList();
    }

    @GetMapping("/{tagId}")
    public TagView get(@PathVariable long tagId) {
        return TagView.of(tagService.get(tagId));
    }

    @PostMapping
    public ResponseEntity<TagView> create(@Valid @RequestBody TagRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(TagView.of(tagService.create(request)));
    }

    @PatchMapping("/{tagId}")
    public TagView update(@PathVariable long tagId, @Valid @RequestBody TagRequest request) {
        return TagView.of(tagService.update(tagId, request));
    }

    @DeleteMapping("/{tagId}")
    public ResponseEntity<Void> delete(@PathVariable long tagId) {
        tagService.delete(tagId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/feed/{feedId}")
    public List<TagView> feedTags(@PathVariable long feedId) {
        return tagService.feedTags(feedId).stream().map(TagView::of).toList();
    }

    @PutMapping("/feed/{feedId}")
    public List<TagView> assign(@PathVariable long feedId, @Valid @RequestBody FeedTagsRequest request) {
        return tagService.assignToFeed(feedId, request.tagIds()).stream().map(TagView::of).toList();
    }
}
