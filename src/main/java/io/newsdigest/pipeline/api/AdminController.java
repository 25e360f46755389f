package io.newsdigest.pipeline.api;

import io.newsdigest.pipeline.api.dto.ArticleFilter;
import io.newsdigest.pipeline.api.dto.CleanupRequest;
import io.newsdigest.pipeline.api.dto.DeletionPreview;
import io.newsdigest.pipeline.api.dto.DeletionReport;
import io.newsdigest.pipeline.api.exception.ValidationException;
import io.newsdigest.pipeline.api.service.CleanupService;
import io.newsdigest.pipeline.api.service.ReconciliationService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private final CleanupService cleanup;
    private final ReconciliationService reconciliation;

    public AdminController(CleanupService cleanup, ReconciliationService reconciliation) {
        this.cleanup = cleanup;
        this.reconciliation = reconciliation;
    }

    @GetMapping("/sources")
    public List<String> sources() {
        return cleanup.sources();
    }

    @PostMapping("/cleanup/preview")
    public DeletionPreview preview(@RequestBody(required = false) ArticleFilter filter) {
        return cleanup.preview(filter == null ? ArticleFilter.all() : filter);
    }

    /**
     * A request without filters deletes everything and must say so with {@code confirm_all}.
     */
    @PostMapping("/cleanup/delete")
    public DeletionReport delete(@RequestBody CleanupRequest request) {
        ArticleFilter filter = request.filter();
        if (filter.isEmpty() && !request.confirmAll()) {
            throw new ValidationException("Deleting without filters removes every article; set confirm_all=true");
        }
        return cleanup.delete(filter, request.options());
    }

    @GetMapping("/vectors/orphans")
    public Map<String, Object> orphans() {
        List<Long> orphans = reconciliation.findOrphanedVectorRecords();
        return Map.of("count", orphans.size(), "article_ids", orphans);
    }

    @PostMapping("/vectors/orphans/purge")
    public Map<String, Object> purgeOrphans() {
        return Map.of("purged", reconciliation.purgeOrphanedVectorRecords());
    }

    @GetMapping("/vectors/missing")
    public Map<String, Object> missing() {
        List<Long> missing = reconciliation.findArticlesMissingVectors();
        return Map.of("count", missing.size(), "article_ids", missing);
    }

    @PostMapping("/vectors/reindex")
    public Map<String, Object> reindex() {
        return Map.of("indexed", reconciliation.reindexMissing());
    }
}
