package io.newsdigest.pipeline.api.service;

import io.newsdigest.pipeline.model.ArticleSummary;
import io.newsdigest.pipeline.model.SummaryKind;
import io.newsdigest.pipeline.repository.ArticleRepository;
import io.newsdigest.pipeline.repository.ArticleSummaryRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Transactional access to persisted summaries. Kept apart from the LLM call so no transaction spans it.
 */
@Component
public class SummaryStore {

    static final String BRIEF_SUMMARY_METADATA_KEY = "brief_summary";

    private final ArticleSummaryRepository summaryRepository;
    private final ArticleRepository articleRepository;

    public SummaryStore(ArticleSummaryRepository summaryRepository, ArticleRepository articleRepository) {
        this.summaryRepository = summaryRepository;
        this.articleRepository = articleRepository;
    }

    @Transactional(readOnly = true)
    public Optional<ArticleSummary> find(long articleId, SummaryKind kind) {
        return summaryRepository.findByArticleIdAndSummaryType(articleId, kind);
    }

    @Transactional(readOnly = true)
    public List<ArticleSummary> findAll(long articleId) {
        return summaryRepository.findByArticleIdOrderByGeneratedAtDesc(articleId);
    }

    /**
     * Inserts or overwrites the summary for (article, kind). A brief summary is also copied into the
     * article's metadata.
     */
    @Transactional
    public ArticleSummary save(long articleId, SummaryKind kind, String text, String model) {
        ArticleSummary summary = summaryRepository.findByArticleIdAndSummaryType(articleId, kind)
                .orElseGet(() -> new ArticleSummary(articleId, kind));
        summary.regenerated(text, model, Instant.now());

        ArticleSummary saved = summaryRepository.saveAndFlush(summary);

        if (kind == SummaryKind.BRIEF) {
            articleRepository.findById(articleId)
                    .ifPresent(article -> article.putMetadata(BRIEF_SUMMARY_METADATA_KEY, text));
        }
        return saved;
    }

    @Transactional
    public int purge(long articleId, SummaryKind kind) {
        if (kind != null) {
            return summaryRepository.deleteByArticleIdAndKind(articleId, kind);
        }
        return summaryRepository.deleteByArticleIdIn(List.of(articleId));
    }
}
