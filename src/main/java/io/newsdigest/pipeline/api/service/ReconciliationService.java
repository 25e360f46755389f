package io.newsdigest.pipeline.api.service;

import io.newsdigest.pipeline.model.Article;
import io.newsdigest.pipeline.repository.ArticleRepository;
import io.newsdigest.pipeline.vector.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Repairs drift between the article store and the vector index. The article store always wins.
 */
@Service
public class ReconciliationService {

    private static final Logger logger = LoggerFactory.getLogger(ReconciliationService.class);

    private final ArticleRepository articleRepository;
    private final VectorStore vectorStore;
    private final ArticleIndexer indexer;

    public ReconciliationService(ArticleRepository articleRepository, VectorStore vectorStore, ArticleIndexer indexer) {
        this.articleRepository = articleRepository;
        this.vectorStore = vectorStore;
        this.indexer = indexer;
    }

    /**
     * @return ids of vector records whose article no longer exists, ascending
     */
    public List<Long> findOrphanedVectorRecords() {
        List<Long> indexed = new ArrayList<>(new TreeSet<>(vectorStore.articleIds()));

        Set<Long> existing = new HashSet<>();
        for (List<Long> batch : CleanupService.batches(indexed)) {
            existing.addAll(articleRepository.findExistingIds(batch));
        }

        return indexed.stream().filter(id -> !existing.contains(id)).toList();
    }

    public int purgeOrphanedVectorRecords() {
        int purged = 0;
        for (Long id : findOrphanedVectorRecords()) {
            if (vectorStore.delete(id)) {
                purged++;
            }
        }
        if (purged > 0) {
            logger.info("Purged {} orphaned vector records", purged);
        }
        return purged;
    }

    public List<Long> findArticlesMissingVectors() {
        Set<Long> indexed = vectorStore.articleIds();

        return articleRepository.findAllIds().stream()
                .filter(id -> !indexed.contains(id))
                .toList();
    }

    /**
     * @return number of articles indexed
     */
    public int reindexMissing() {
        List<Long> missing = findArticlesMissingVectors();
        if (missing.isEmpty()) return 0;

        logger.info("Indexing {} articles without a vector record", missing.size());

        int indexed = 0;
        for (List<Long> batch : CleanupService.batches(missing)) {
            List<Article> articles = articleRepository.findAllById(batch);
            indexed += indexer.indexAll(articles);
        }

        if (indexed < missing.size()) {
            logger.warn("{} of {} articles could not be indexed", missing.size() - indexed, missing.size());
        }
        return indexed;
    }
}
