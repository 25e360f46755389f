package io.newsdigest.pipeline.api.service;

import io.newsdigest.pipeline.api.dto.ArticleSummaryView;
import io.newsdigest.pipeline.api.exception.AnalysisException;
import io.newsdigest.pipeline.api.exception.GenerationException;
import io.newsdigest.pipeline.config.AnalysisProperties;
import io.newsdigest.pipeline.model.Article;
import io.newsdigest.pipeline.model.ArticleSummary;
import io.newsdigest.pipeline.model.SummaryKind;
import io.newsdigest.pipeline.repository.ArticleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cached per-article summaries. A stored summary is returned without calling the LLM; a miss generates,
 * persists and returns a fresh one. Concurrent misses for the same key share one generation.
 */
@Service
public class SummarizationService {

    private static final Logger logger = LoggerFactory.getLogger(SummarizationService.class);

    private final ArticleRepository articleRepository;
    private final SummaryStore summaryStore;
    private final LlmGateway llmGateway;
    private final PromptTemplates prompts;
    private final Duration generationTimeout;
    private final InFlightRequests<SummaryKey, ArticleSummaryView> inFlight = new InFlightRequests<>();

    public SummarizationService(ArticleRepository articleRepository,
                                SummaryStore summaryStore,
                                LlmGateway llmGateway,
                                PromptTemplates prompts,
                                AnalysisProperties analysis) {
        this.articleRepository = articleRepository;
        this.summaryStore = summaryStore;
        this.llmGateway = llmGateway;
        this.prompts = prompts;
        this.generationTimeout = analysis.generationTimeout();
    }

    public ArticleSummaryView getOrCreateSummary(long articleId, SummaryKind kind) {
        return getOrCreateSummary(articleId, kind, false);
    }

    /**
     * @param force regenerate even when a stored summary exists
     * @throws AnalysisException kind {@code article-not-found} or {@code generation-failed}; nothing is stored then
     */
    public ArticleSummaryView getOrCreateSummary(long articleId, SummaryKind kind, boolean force) {
        Article article = articleRepository.findById(articleId)
                .orElseThrow(() -> new AnalysisException(AnalysisException.Kind.ARTICLE_NOT_FOUND,
                        "Article with ID " + articleId + " not found", Map.of("article_id", articleId), null));

        if (!force) {
            Optional<ArticleSummary> stored = summaryStore.find(articleId, kind);
            if (stored.isPresent()) {
                logger.debug("Summary cache hit for article {} ({})", articleId, kind.label());
                return ArticleSummaryView.of(stored.get(), true);
            }
        }

        return inFlight.run(new SummaryKey(articleId, kind), () -> {
            if (!force) {
                Optional<ArticleSummary> stored = summaryStore.find(articleId, kind);
                if (stored.isPresent()) {
                    return ArticleSummaryView.of(stored.get(), true);
                }
            }
            return generate(article, kind);
        });
    }

    public List<ArticleSummaryView> cachedSummaries(long articleId) {
        return summaryStore.findAll(articleId).stream()
                .map(summary -> ArticleSummaryView.of(summary, true))
                .toList();
    }

    /**
     * @param kind null purges every kind
     * @return number of summaries deleted
     */
    public int purgeSummaries(long articleId, SummaryKind kind) {
        int purged = summaryStore.purge(articleId, kind);
        logger.info("Purged {} summaries of article {}{}", purged, articleId,
                kind == null ? "" : " (" + kind.label() + ")");
        return purged;
    }

    private ArticleSummaryView generate(Article article, SummaryKind kind) {
        String text;
        try {
            text = llmGateway.generate(prompts.summary(article, kind), generationTimeout);
        } catch (GenerationException e) {
            logger.warn("Summary generation failed for article {} ({}): {}", article.getId(), kind.label(), e.getMessage());
            throw new AnalysisException(AnalysisException.Kind.GENERATION_FAILED,
                    "Could not generate " + kind.label() + " summary for article " + article.getId(),
                    Map.of("article_id", article.getId()), e);
        }

        ArticleSummary saved = summaryStore.save(article.getId(), kind, text, llmGateway.modelName());
        logger.info("Generated {} summary for article {} ({} words)", kind.label(), article.getId(), saved.getWordCount());

        return ArticleSummaryView.of(saved, false);
    }

    private record SummaryKey(long articleId, SummaryKind kind) {}
}
