package io.newsdigest.pipeline.api.service;

import io.newsdigest.pipeline.api.dto.ArticleDigest;
import io.newsdigest.pipeline.api.dto.MultiAnalysis;
import io.newsdigest.pipeline.api.exception.AnalysisException;
import io.newsdigest.pipeline.api.exception.GenerationException;
import io.newsdigest.pipeline.api.exception.ValidationException;
import io.newsdigest.pipeline.config.AnalysisProperties;
import io.newsdigest.pipeline.model.Article;
import io.newsdigest.pipeline.repository.ArticleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Cross-article perspective analysis. Every requested article takes part, in request order,
 * or the call fails.
 */
@Service
public class MultiAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(MultiAnalysisService.class);

    static final String DEFAULT_FOCUS = "general comparison of coverage";

    private final ArticleRepository articleRepository;
    private final LlmGateway llmGateway;
    private final PromptTemplates prompts;
    private final AnalysisCacheService cache;
    private final AnalysisProperties analysis;
    private final InFlightRequests<String, MultiAnalysis> inFlight = new InFlightRequests<>();

    public MultiAnalysisService(ArticleRepository articleRepository,
                                LlmGateway llmGateway,
                                PromptTemplates prompts,
                                AnalysisCacheService cache,
                                AnalysisProperties analysis) {
        this.articleRepository = articleRepository;
        this.llmGateway = llmGateway;
        this.prompts = prompts;
        this.cache = cache;
        this.analysis = analysis;
    }

    /**
     * @throws ValidationException fewer than two distinct ids, or more than the configured maximum
     * @throws AnalysisException   an id does not exist, or generation failed
     */
    public MultiAnalysis analyze(List<Long> articleIds, String focus, boolean force) {
        List<Long> ids = articleIds == null ? List.of() : new ArrayList<>(new LinkedHashSet<>(articleIds));
        if (ids.size() < 2) {
            throw new ValidationException("Multi-article analysis needs at least 2 distinct articles",
                    Map.of("distinct_articles", ids.size()));
        }
        if (ids.size() > analysis.maxArticles()) {
            throw new ValidationException("Multi-article analysis accepts at most " + analysis.maxArticles() + " articles",
                    Map.of("distinct_articles", ids.size()));
        }

        String effectiveFocus = focus == null || focus.isBlank() ? DEFAULT_FOCUS : focus.trim();

        Map<Long, Article> found = articleRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(Article::getId, Function.identity()));
        List<Long> missing = ids.stream().filter(id -> !found.containsKey(id)).toList();
        if (!missing.isEmpty()) {
            throw new AnalysisException(AnalysisException.Kind.ARTICLE_NOT_FOUND,
                    "Articles not found: " + missing, Map.of("missing_ids", missing), null);
        }

        String cacheKey = cache.multiAnalysisKey(ids, effectiveFocus);
        if (!force) {
            Optional<MultiAnalysis> cached = cache.get(cacheKey);
            if (cached.isPresent()) {
                logger.debug("Multi-analysis cache hit for {} articles", ids.size());
                return cached.get().asCached();
            }
        }

        List<Article> articles = ids.stream().map(found::get).toList();
        return inFlight.run(cacheKey, () -> generate(cacheKey, ids, articles, effectiveFocus));
    }

    private MultiAnalysis generate(String cacheKey, List<Long> ids, List<Article> articles, String effectiveFocus) {
        String text;
        try {
            text = llmGateway.generate(prompts.multiAnalysis(articles, effectiveFocus), analysis.generationTimeout());
        } catch (GenerationException e) {
            logger.warn("Multi-analysis over {} failed: {}", ids, e.getMessage());
            throw new AnalysisException(AnalysisException.Kind.GENERATION_FAILED,
                    "Could not generate analysis of " + ids.size() + " articles", Map.of("article_ids", ids), e);
        }

        MultiAnalysis result = new MultiAnalysis(
                effectiveFocus,
                text,
                articles.stream().map(ArticleDigest::of).toList(),
                articles.stream().map(Article::getSource).collect(Collectors.toCollection(TreeSet::new)),
                llmGateway.modelName(),
                Instant.now(),
                false
        );

        cache.put(cacheKey, result);
        logger.info("Generated multi-analysis of {} articles from {} sources", ids.size(), result.sourceDiversity().size());
        return result;
    }
}
