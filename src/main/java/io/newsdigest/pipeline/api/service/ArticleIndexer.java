package io.newsdigest.pipeline.api.service;

import io.newsdigest.pipeline.api.exception.EmbeddingException;
import io.newsdigest.pipeline.api.util.TextExcerpts;
import io.newsdigest.pipeline.config.ExecutorConfig;
import io.newsdigest.pipeline.config.RetrievalProperties;
import io.newsdigest.pipeline.model.Article;
import io.newsdigest.pipeline.repository.ArticleRepository;
import io.newsdigest.pipeline.vector.VectorRecord;
import io.newsdigest.pipeline.vector.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Writes the derived vector record of an article. Indexing failures leave the article unindexed
 * and are picked up later by reconciliation.
 * <p>
 * The article is looked up again after the write: cleanup deletes the row before the vector, so a record
 * written for an article deleted mid-indexing is removed here.
 */
@Service
public class ArticleIndexer {

    private static final Logger logger = LoggerFactory.getLogger(ArticleIndexer.class);

    private final EmbeddingGateway embeddingGateway;
    private final VectorStore vectorStore;
    private final ArticleRepository articleRepository;
    private final ExecutorService indexingExecutor;
    private final int excerptLength;

    public ArticleIndexer(EmbeddingGateway embeddingGateway,
                          VectorStore vectorStore,
                          ArticleRepository articleRepository,
                          @Qualifier(ExecutorConfig.INDEXING_EXECUTOR) ExecutorService indexingExecutor,
                          RetrievalProperties retrieval) {
        this.embeddingGateway = embeddingGateway;
        this.vectorStore = vectorStore;
        this.articleRepository = articleRepository;
        this.indexingExecutor = indexingExecutor;
        this.excerptLength = retrieval.snippetLength();
    }

    public CompletableFuture<Boolean> indexAsync(Article article) {
        return CompletableFuture.supplyAsync(() -> index(article), indexingExecutor);
    }

    /**
     * @return true when the vector record was written
     */
    public boolean index(Article article) {
        try {
            float[] vector = embed(article);

            vectorStore.upsert(new VectorRecord(
                    article.getId(),
                    vector,
                    article.getTitle(),
                    article.getSource(),
                    article.getUrl(),
                    article.getPublishedAt(),
                    TextExcerpts.excerpt(article.getContent(), excerptLength)
            ));

            if (!articleRepository.existsById(article.getId())) {
                vectorStore.delete(article.getId());
                logger.debug("Article {} was deleted while being indexed, vector record dropped", article.getId());
                return false;
            }
            return true;

        } catch (EmbeddingException e) {
            logger.warn("Could not index article {}: {}", article.getId(), e.getMessage());
            return false;

        } catch (RuntimeException e) {
            logger.error("Could not store vector record of article {}: {}", article.getId(), e.getMessage(), e);
            return false;
        }
    }

    /**
     * Indexes on the indexing pool and waits for all of them.
     *
     * @return number of articles indexed
     */
    public int indexAll(List<Article> articles) {
        List<CompletableFuture<Boolean>> futures = articles.stream()
                .map(this::indexAsync)
                .toList();

        return (int) futures.stream()
                .map(CompletableFuture::join)
                .filter(Boolean::booleanValue)
                .count();
    }

    public float[] embed(Article article) {
        return embeddingGateway.embed(article.getTitle() + "\n\n" + article.getContent());
    }
}
