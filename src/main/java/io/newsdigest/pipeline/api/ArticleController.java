package io.newsdigest.pipeline.api;

import io.newsdigest.pipeline.api.dto.ArticleView;
import io.newsdigest.pipeline.api.dto.DeletionReport;
import io.newsdigest.pipeline.api.dto.SearchResult;
import io.newsdigest.pipeline.api.service.ArticleQueryService;
import io.newsdigest.pipeline.api.service.CleanupService;
import io.newsdigest.pipeline.api.service.RetrievalService;
import org.springframework.data.domain.Page;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/api/v1/articles")
public class ArticleController {

    private final ArticleQueryService articleQuery;
    private final RetrievalService retrieval;
    private final CleanupService cleanup;

    public ArticleController(ArticleQueryService articleQuery, RetrievalService retrieval, CleanupService cleanup) {
        this.articleQuery = articleQuery;
        this.retrieval = retrieval;
        this.cleanup = cleanup;
    }

    @GetMapping
    public Map<String, Object> list(@RequestParam(required = false) String source,
                                    @RequestParam(required = false) Set<Long> tags,
                                    @RequestParam(defaultValue = "0") int page,
                                    @RequestParam(defaultValue = "20") int size) {
        Page<ArticleView> articles = articleQuery.list(source, tags, page, size);

        return Map.of(
                "articles", articles.getContent(),
                "page", articles.getNumber(),
                "size", articles.getSize(),
                "total", articles.getTotalElements()
        );
    }

    @GetMapping("/{articleId}")
    public ArticleView get(@PathVariable long articleId) {
        return articleQuery.get(articleId);
    }

    @GetMapping("/{articleId}/similar")
    public List<SearchResult> similar(@PathVariable long articleId,
                                      @RequestParam(required = false) Integer limit) {
        return retrieval.similar(articleId, limit);
    }

    @DeleteMapping("/{articleId}")
    public DeletionReport delete(@PathVariable long articleId) {
        return cleanup.deleteArticle(articleId);
    }
}
