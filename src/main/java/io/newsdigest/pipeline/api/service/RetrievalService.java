package io.newsdigest.pipeline.api.service;

import io.newsdigest.pipeline.api.dto.SearchResult;
import io.newsdigest.pipeline.api.exception.ArticleNotFoundException;
import io.newsdigest.pipeline.api.exception.GenerationException;
import io.newsdigest.pipeline.api.exception.ValidationException;
import io.newsdigest.pipeline.api.util.TextExcerpts;
import io.newsdigest.pipeline.config.RetrievalProperties;
import io.newsdigest.pipeline.model.Article;
import io.newsdigest.pipeline.repository.ArticleRepository;
import io.newsdigest.pipeline.vector.VectorMatch;
import io.newsdigest.pipeline.vector.VectorRecord;
import io.newsdigest.pipeline.vector.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Semantic search over the vector index, joined back to the article store for display fields.
 * Index hits whose article is gone are dropped.
 */
@Service
public class RetrievalService {

    private static final Logger logger = LoggerFactory.getLogger(RetrievalService.class);

    private static final Comparator<SearchResult> RANKING = Comparator
            .comparingDouble(SearchResult::score).reversed()
            .thenComparing(SearchResult::publishedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final VectorStore vectorStore;
    private final EmbeddingGateway embeddingGateway;
    private final ArticleIndexer indexer;
    private final ArticleRepository articleRepository;
    private final LlmGateway llmGateway;
    private final PromptTemplates prompts;
    private final RetrievalProperties retrieval;

    public RetrievalService(VectorStore vectorStore,
                            EmbeddingGateway embeddingGateway,
                            ArticleIndexer indexer,
                            ArticleRepository articleRepository,
                            LlmGateway llmGateway,
                            PromptTemplates prompts,
                            RetrievalProperties retrieval) {
        this.vectorStore = vectorStore;
        this.embeddingGateway = embeddingGateway;
        this.indexer = indexer;
        this.articleRepository = articleRepository;
        this.llmGateway = llmGateway;
        this.prompts = prompts;
        this.retrieval = retrieval;
    }

    public List<SearchResult> search(String query, Integer limit, boolean useAi) {
        return search(query, limit, useAi, Set.of());
    }

    /**
     * @param sources restrict hits to these sources; empty means all
     * @throws ValidationException for a blank query
     */
    public List<SearchResult> search(String query, Integer limit, boolean useAi, Set<String> sources) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("Search query must not be empty");
        }
        if (vectorStore.size() == 0) {
            return List.of();
        }

        int k = retrieval.clampLimit(limit);
        Predicate<VectorRecord> filter = sources == null || sources.isEmpty()
                ? record -> true
                : record -> sources.contains(record.source());

        float[] queryVector = embeddingGateway.embed(query.trim());
        List<SearchResult> results = topLive(queryVector, k, filter);
        logger.debug("Search '{}' matched {} of {} requested", query, results.size(), k);

        return useAi ? withHighlights(query.trim(), results) : results;
    }

    /**
     * Articles closest to the given one, excluding itself. Uses the stored vector, or embeds the article
     * when it has not been indexed yet.
     */
    public List<SearchResult> similar(long articleId, Integer limit) {
        Article article = articleRepository.findById(articleId)
                .orElseThrow(() -> new ArticleNotFoundException(articleId));

        int k = retrieval.clampLimit(limit);
        float[] vector = vectorStore.get(articleId)
                .map(VectorRecord::vector)
                .orElseGet(() -> indexer.embed(article));

        return topLive(vector, k, record -> record.articleId() != articleId);
    }

    /**
     * Asks the index for more hits while dropped ones leave fewer than {@code k} results and the index
     * still has candidates above the minimum score.
     */
    private List<SearchResult> topLive(float[] vector, int k, Predicate<VectorRecord> filter) {
        int requested = k;
        while (true) {
            List<VectorMatch> matches = vectorStore.query(vector, requested, filter);
            List<SearchResult> results = join(matches);

            boolean exhausted = matches.size() < requested
                    || matches.get(matches.size() - 1).score() < retrieval.minScore();
            if (results.size() >= k || exhausted) {
                return results.stream().limit(k).toList();
            }
            requested += matches.size() - results.size();
        }
    }

    private List<SearchResult> join(List<VectorMatch> matches) {
        if (matches.isEmpty()) return List.of();

        List<Long> ids = matches.stream().map(VectorMatch::articleId).toList();
        Map<Long, Article> articles = articleRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(Article::getId, Function.identity()));

        List<SearchResult> results = new ArrayList<>();
        for (VectorMatch match : matches) {
            if (match.score() < retrieval.minScore()) continue;

            Article article = articles.get(match.articleId());
            if (article == null) {
                logger.debug("Dropping hit {}: article no longer exists", match.articleId());
                continue;
            }

            results.add(new SearchResult(
                    article.getId(),
                    article.getTitle(),
                    article.getSource(),
                    article.getUrl(),
                    article.getPublishedAt(),
                    match.score(),
                    TextExcerpts.excerpt(article.getContent(), retrieval.snippetLength()),
                    false
            ));
        }

        results.sort(RANKING);
        return results;
    }

    private List<SearchResult> withHighlights(String query, List<SearchResult> results) {
        Map<Long, Article> articles = articleRepository.findAllById(results.stream().map(SearchResult::articleId).toList())
                .stream()
                .collect(Collectors.toMap(Article::getId, Function.identity()));

        List<SearchResult> highlighted = new ArrayList<>(results.size());
        for (int i = 0; i < results.size(); i++) {
            SearchResult result = results.get(i);
            Article article = articles.get(result.articleId());

            if (i >= retrieval.maxAiHighlights() || article == null) {
                highlighted.add(result);
                continue;
            }

            try {
                highlighted.add(result.withHighlight(llmGateway.generate(prompts.highlight(query, article))));
            } catch (GenerationException e) {
                logger.debug("Highlight for article {} fell back to excerpt: {}", result.articleId(), e.getMessage());
                highlighted.add(result);
            }
        }
        return highlighted;
    }
}
