package io.newsdigest.pipeline.api;

import io.newsdigest.pipeline.api.dto.ArticleSummaryView;
import io.newsdigest.pipeline.api.dto.MultiAnalysis;
import io.newsdigest.pipeline.api.dto.MultiAnalysisRequest;
import io.newsdigest.pipeline.api.exception.ValidationException;
import io.newsdigest.pipeline.api.service.MultiAnalysisService;
import io.newsdigest.pipeline.api.service.SummarizationService;
import io.newsdigest.pipeline.model.SummaryKind;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/summaries")
public class SummaryController {

    private final SummarizationService summarization;
    private final MultiAnalysisService multiAnalysis;

    public SummaryController(SummarizationService summarization, MultiAnalysisService multiAnalysis) {
        this.summarization = summarization;
        this.multiAnalysis = multiAnalysis;
    }

    @PostMapping("/articles/{articleId}")
    public ArticleSummaryView summarize(@PathVariable long articleId,
                                        @RequestParam(defaultValue = "brief") String kind,
                                        @RequestParam(defaultValue = "false") boolean force) {
        return summarization.getOrCreateSummary(articleId, kind(kind), force);
    }

    @GetMapping("/articles/{articleId}")
    public List<ArticleSummaryView> cached(@PathVariable long articleId) {
        return summarization.cachedSummaries(articleId);
    }

    @DeleteMapping("/articles/{articleId}")
    public Map<String, Object> purge(@PathVariable long articleId,
                                     @RequestParam(required = false) String kind) {
        int purged = summarization.purgeSummaries(articleId, kind == null ? null : kind(kind));
        return Map.of("article_id", articleId, "purged", purged);
    }

    @PostMapping("/multi")
    public MultiAnalysis analyze(@Valid @RequestBody MultiAnalysisRequest request) {
        return multiAnalysis.analyze(request.articleIds(), request.focus(), request.force());
    }

    private static SummaryKind kind(String value) {
        try {
            return SummaryKind.fromLabel(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), Map.of("kind", value));
        }
    }
}
