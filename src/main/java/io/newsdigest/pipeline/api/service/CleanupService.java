package io.newsdigest.pipeline.api.service;

import io.newsdigest.pipeline.api.dto.ArticleFilter;
import io.newsdigest.pipeline.api.dto.ConsistencyWarning;
import io.newsdigest.pipeline.api.dto.DeletionOptions;
import io.newsdigest.pipeline.api.dto.DeletionPreview;
import io.newsdigest.pipeline.api.dto.DeletionReport;
import io.newsdigest.pipeline.api.exception.ArticleNotFoundException;
import io.newsdigest.pipeline.api.exception.StoreUnavailableException;
import io.newsdigest.pipeline.repository.ArticleRepository;
import io.newsdigest.pipeline.repository.ArticleSelector;
import io.newsdigest.pipeline.repository.ArticleSelector.ArticleRef;
import io.newsdigest.pipeline.repository.ArticleSummaryRepository;
import io.newsdigest.pipeline.repository.ReadingListRepository;
import io.newsdigest.pipeline.vector.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Filtered deletion across the article store and the vector index.
 * <p>
 * Relational rows go first in one transaction; vector records follow after commit. A vector-side failure is
 * reported as a {@link ConsistencyWarning}, the relational delete stands. Every deletion that touches the
 * vector index ends with an orphan sweep, so records left behind earlier do not outlive the next cleanup.
 */
@Service
public class CleanupService {

    private static final Logger logger = LoggerFactory.getLogger(CleanupService.class);

    static final int BATCH_SIZE = 500;

    private final ArticleSelector selector;
    private final ArticleRepository articleRepository;
    private final ArticleSummaryRepository summaryRepository;
    private final ReadingListRepository readingListRepository;
    private final VectorStore vectorStore;
    private final ReconciliationService reconciliation;
    private final EventPublisherService eventPublisher;
    private final TransactionTemplate transactionTemplate;

    public CleanupService(ArticleSelector selector,
                          ArticleRepository articleRepository,
                          ArticleSummaryRepository summaryRepository,
                          ReadingListRepository readingListRepository,
                          VectorStore vectorStore,
                          ReconciliationService reconciliation,
                          EventPublisherService eventPublisher,
                          PlatformTransactionManager transactionManager) {
        this.selector = selector;
        this.articleRepository = articleRepository;
        this.summaryRepository = summaryRepository;
        this.readingListRepository = readingListRepository;
        this.vectorStore = vectorStore;
        this.reconciliation = reconciliation;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public DeletionPreview preview(ArticleFilter filter) {
        List<ArticleRef> matched = select(filter);

        SortedMap<String, Long> bySource = matched.stream()
                .collect(Collectors.groupingBy(ArticleRef::source, TreeMap::new, Collectors.counting()));

        return new DeletionPreview(matched.size(), bySource, filter.describe());
    }

    public DeletionReport delete(ArticleFilter filter, DeletionOptions options) {
        List<Long> ids = select(filter).stream().map(ArticleRef::id).toList();
        logger.info("Deleting {} articles matching {}", ids.size(), filter.describe());

        return deleteIds(ids, options, filter.describe());
    }

    /**
     * Deletes one article with its summaries, reading-list entry and vector record.
     */
    public DeletionReport deleteArticle(long articleId) {
        if (!articleRepository.existsById(articleId)) {
            throw new ArticleNotFoundException(articleId);
        }
        return deleteIds(List.of(articleId), DeletionOptions.everything(), Map.of("article_id", articleId));
    }

    public List<String> sources() {
        return articleRepository.findDistinctSources();
    }

    private DeletionReport deleteIds(List<Long> ids, DeletionOptions options, Map<String, Object> filtersApplied) {
        RelationalCounts counts = deleteRelational(ids, options);

        List<ConsistencyWarning> warnings = new ArrayList<>();
        int vectorsDeleted = 0;
        if (options.deleteFromVectorStore()) {
            VectorOutcome outcome = deleteVectors(ids);
            vectorsDeleted = outcome.deleted();
            if (outcome.warning() != null) {
                warnings.add(outcome.warning());
            } else {
                sweepOrphans();
            }
        }

        long remaining = countArticles();

        DeletionReport report = new DeletionReport(counts.articles(), counts.summaries(), counts.readingList(),
                vectorsDeleted, remaining, filtersApplied, List.copyOf(warnings));

        logger.info("Deleted {} articles, {} summaries, {} reading list entries, {} vector records; {} articles remain",
                report.deletedCount(), report.deletedSummariesCount(), report.deletedReadingListCount(),
                report.deletedFromVectorStore(), remaining);

        if (report.deletedCount() > 0) {
            eventPublisher.publishArticlesDeleted(report);
        }
        return report;
    }

    private RelationalCounts deleteRelational(List<Long> ids, DeletionOptions options) {
        if (ids.isEmpty()) {
            return new RelationalCounts(0, 0, 0);
        }

        try {
            return transactionTemplate.execute(status -> {
                int articles = 0, summaries = 0, readingList = 0;
                for (List<Long> batch : batches(ids)) {
                    if (options.deleteSummaries()) {
                        summaries += summaryRepository.deleteByArticleIdIn(batch);
                    }
                    readingList += readingListRepository.deleteByArticleIdIn(batch);
                    articles += articleRepository.deleteByIdIn(batch);
                }
                return new RelationalCounts(articles, summaries, readingList);
            });
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new StoreUnavailableException("Article store unreachable during deletion", e);
        }
    }

    private VectorOutcome deleteVectors(List<Long> ids) {
        int deleted = 0;
        for (int i = 0; i < ids.size(); i++) {
            try {
                if (vectorStore.delete(ids.get(i))) {
                    deleted++;
                }
            } catch (RuntimeException e) {
                int orphaned = ids.size() - i;
                logger.warn("Vector store deletion failed after {} of {} records, up to {} orphaned: {}",
                        i, ids.size(), orphaned, e.getMessage());
                return new VectorOutcome(deleted, new ConsistencyWarning(
                        "Vector store deletion failed: " + e.getMessage() + "; run vector reconciliation to purge orphans",
                        orphaned));
            }
        }
        return new VectorOutcome(deleted, null);
    }

    private void sweepOrphans() {
        try {
            reconciliation.purgeOrphanedVectorRecords();
        } catch (RuntimeException e) {
            logger.warn("Orphan sweep after deletion failed, records stay until the next cleanup: {}", e.getMessage());
        }
    }

    private List<ArticleRef> select(ArticleFilter filter) {
        try {
            return selector.select(filter);
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new StoreUnavailableException("Article store unreachable", e);
        }
    }

    private long countArticles() {
        try {
            return articleRepository.count();
        } catch (DataAccessResourceFailureException e) {
            throw new StoreUnavailableException("Article store unreachable", e);
        }
    }

    static List<List<Long>> batches(List<Long> ids) {
        List<List<Long>> batches = new ArrayList<>();
        for (int from = 0; from < ids.size(); from += BATCH_SIZE) {
            batches.add(ids.subList(from, Math.min(from + BATCH_SIZE, ids.size())));
        }
        return batches;
    }

    private record RelationalCounts(int articles, int summaries, int readingList) {}

    private record VectorOutcome(int deleted, ConsistencyWarning warning) {}
}
