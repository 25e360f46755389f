package io.newsdigest.pipeline.api.service;

import io.newsdigest.pipeline.api.dto.RawFeedEntry;
import io.newsdigest.pipeline.api.exception.StoreUnavailableException;
import io.newsdigest.pipeline.model.Article;
import io.newsdigest.pipeline.repository.ArticleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * Check-then-insert of ingested articles. The unique fingerprint column decides races between workers;
 * the existence check only avoids a failed insert in the common case.
 */
@Service
public class ArticlePersistenceService {

    private static final Logger logger = LoggerFactory.getLogger(ArticlePersistenceService.class);

    public enum Outcome { CREATED, DUPLICATE, FAILED }

    public record PersistResult(Outcome outcome, Article article, String error) {

        static PersistResult created(Article article) {
            return new PersistResult(Outcome.CREATED, article, null);
        }

        static PersistResult duplicate() {
            return new PersistResult(Outcome.DUPLICATE, null, null);
        }

        static PersistResult failed(String error) {
            return new PersistResult(Outcome.FAILED, null, error);
        }
    }

    private final ArticleRepository articleRepository;
    private final FingerprintService fingerprintService;

    public ArticlePersistenceService(ArticleRepository articleRepository, FingerprintService fingerprintService) {
        this.articleRepository = articleRepository;
        this.fingerprintService = fingerprintService;
    }

    public boolean isKnown(String fingerprint) {
        try {
            return articleRepository.existsByFingerprint(fingerprint);
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new StoreUnavailableException("Article store unreachable", e);
        }
    }

    /**
     * @throws StoreUnavailableException when the store cannot be reached at all
     */
    public PersistResult createIfAbsent(RawFeedEntry entry) {
        String fingerprint = fingerprintService.fingerprint(entry.title(), entry.body(), entry.source());

        if (isKnown(fingerprint)) {
            return PersistResult.duplicate();
        }

        Article article = new Article(entry.title(), entry.body(), entry.source(), entry.publishedAt(),
                entry.link(), entry.metadata(), fingerprint);

        try {
            Article saved = articleRepository.saveAndFlush(article);
            logger.debug("Stored article {} from {}: {}", saved.getId(), saved.getSource(), saved.getTitle());
            return PersistResult.created(saved);

        } catch (DataIntegrityViolationException e) {
            // lost the race against another worker holding the same entry
            logger.debug("Fingerprint {} inserted concurrently, treating as duplicate", fingerprint);
            return PersistResult.duplicate();

        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new StoreUnavailableException("Article store unreachable", e);

        } catch (RuntimeException e) {
            logger.warn("Failed to store '{}' from {}: {}", entry.title(), entry.source(), e.getMessage());
            return PersistResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
