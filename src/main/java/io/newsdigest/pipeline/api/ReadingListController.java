package io.newsdigest.pipeline.api;

import io.newsdigest.pipeline.api.dto.ReadingListEntryView;
import io.newsdigest.pipeline.api.dto.ReadingListRequest;
import io.newsdigest.pipeline.api.service.ReadingListService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/reading-list")
public class ReadingListController {

    private final ReadingListService readingList;

    public ReadingListController(ReadingListService readingList) {
        this.readingList = readingList;
    }

    @GetMapping
    public List<ReadingListEntryView> list() {
        return readingList.list();
    }

    @PostMapping
    public ResponseEntity<ReadingListEntryView> add(@Valid @RequestBody ReadingListRequest request) {
        ReadingListEntryView entry = readingList.add(request.articleId(), request.notes());
        return ResponseEntity.status(entry.created() ? HttpStatus.CREATED : HttpStatus.OK).body(entry);
    }

    @GetMapping("/{articleId}")
    public Map<String, Object> contains(@PathVariable long articleId) {
        return Map.of("article_id", articleId, "in_reading_list", readingList.contains(articleId));
    }

    @PutMapping("/{articleId}/notes")
    public ReadingListEntryView updateNotes(@PathVariable long articleId, @RequestBody Map<String, String> body) {
        return readingList.updateNotes(articleId, body.get("notes"));
    }

    @DeleteMapping("/{articleId}")
    public ResponseEntity<Void> remove(@PathVariable long articleId) {
        return readingList.remove(articleId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
