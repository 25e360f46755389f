package io.newsdigest.pipeline.api.service;

import io.newsdigest.pipeline.api.dto.FeedFetchError;
import io.newsdigest.pipeline.api.dto.FeedFetchResult;
import io.newsdigest.pipeline.api.dto.FeedIngestionResult;
import io.newsdigest.pipeline.api.dto.FeedSource;
import io.newsdigest.pipeline.api.dto.IngestionReport;
import io.newsdigest.pipeline.api.dto.IngestionRun;
import io.newsdigest.pipeline.api.dto.RawFeedEntry;
import io.newsdigest.pipeline.api.exception.ErrorCategory;
import io.newsdigest.pipeline.api.exception.IngestionFailedException;
import io.newsdigest.pipeline.api.exception.StoreUnavailableException;
import io.newsdigest.pipeline.config.ExecutorConfig;
import io.newsdigest.pipeline.config.ProcessingConfig;
import io.newsdigest.pipeline.config.RssConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs fetch, dedup, persist and index over a set of feeds.
 * <p>
 * Only one run is active at a time: triggering while a run is in progress returns that run.
 * Partial failures end up in the report; only an unreachable article store fails the run as a whole.
 */
@Service
public class IngestionCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(IngestionCoordinator.class);

    private final FeedFetcher feedFetcher;
    private final ArticlePersistenceService persistence;
    private final ArticleIndexer indexer;
    private final FeedCatalogService feedCatalog;
    private final EventPublisherService eventPublisher;
    private final IngestionRunRegistry registry;
    private final ExecutorService runExecutor;
    private final ExecutorService fetchExecutor;
    private final ProcessingConfig processing;

    private final Object lock = new Object();
    private IngestionRun activeRun;
    private CompletableFuture<IngestionReport> activeReport;

    public IngestionCoordinator(FeedFetcher feedFetcher,
                                ArticlePersistenceService persistence,
                                ArticleIndexer indexer,
                                FeedCatalogService feedCatalog,
                                EventPublisherService eventPublisher,
                                IngestionRunRegistry registry,
                                @Qualifier(ExecutorConfig.INGESTION_RUN_EXECUTOR) ExecutorService runExecutor,
                                @Qualifier(ExecutorConfig.FEED_FETCH_EXECUTOR) ExecutorService fetchExecutor,
                                RssConfig rssConfig) {
        this.feedFetcher = feedFetcher;
        this.persistence = persistence;
        this.indexer = indexer;
        this.feedCatalog = feedCatalog;
        this.eventPublisher = eventPublisher;
        this.registry = registry;
        this.runExecutor = runExecutor;
        this.fetchExecutor = fetchExecutor;
        this.processing = rssConfig.processing();
    }

    /**
     * Starts a background run over all enabled feeds, or returns the run already in progress.
     */
    public IngestionRun trigger(String trigger) {
        return start(trigger, feedCatalog::enabledFeeds).run();
    }

    public IngestionRun triggerFeed(String trigger, long feedId) {
        FeedSource feed = FeedSource.of(feedCatalog.get(feedId));
        return start(trigger, () -> List.of(feed)).run();
    }

    /**
     * Runs over all enabled feeds and waits for the report. Joins the active run when one is in progress.
     */
    public IngestionReport ingestNow(String trigger) {
        StartedRun started = start(trigger, feedCatalog::enabledFeeds);
        try {
            return started.report().get(processing.runTimeout().toMillis() * 2, TimeUnit.MILLISECONDS);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngestionFailedException(started.run().runId(), "Interrupted while waiting for ingestion", e);

        } catch (ExecutionException | TimeoutException e) {
            throw new IngestionFailedException(started.run().runId(), "Ingestion run did not complete: " + e.getMessage(), e);
        }
    }

    public Optional<IngestionRun> findRun(String runId) {
        return registry.find(runId);
    }

    public List<IngestionRun> recentRuns() {
        return registry.recent();
    }

    public Optional<IngestionRun> activeRun() {
        synchronized (lock) {
            return Optional.ofNullable(activeRun);
        }
    }

    private StartedRun start(String trigger, Supplier<List<FeedSource>> feeds) {
        synchronized (lock) {
            if (activeRun != null) {
                logger.info("Ingestion run {} already active, not starting another ({})", activeRun.runId(), trigger);
                return new StartedRun(activeRun, activeReport);
            }

            IngestionRun run = IngestionRun.running(UUID.randomUUID().toString(), trigger, Instant.now());
            registry.record(run);
            activeRun = run;

            try {
                activeReport = CompletableFuture
                        .supplyAsync(() -> execute(run.runId(), run.startedAt(), feeds.get()), runExecutor)
                        .handle((finished, ex) -> complete(run, finished, ex));
            } catch (RejectedExecutionException e) {
                activeRun = null;
                registry.record(run.finished(IngestionReport.of(run.runId(), run.startedAt(), Instant.now(),
                        Map.of(), "Run executor rejected the run")));
                throw new IngestionFailedException(run.runId(), "Ingestion executor is shut down", e);
            }
            return new StartedRun(run, activeReport);
        }
    }

    private IngestionReport complete(IngestionRun run, IngestionReport report, Throwable ex) {
        IngestionReport finalReport = report;
        if (ex != null) {
            Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
            logger.error("Ingestion run {} crashed: {}", run.runId(), cause.getMessage(), cause);
            finalReport = IngestionReport.of(run.runId(), run.startedAt(), Instant.now(), Map.of(), cause.getMessage());
        }

        synchronized (lock) {
            registry.record(run.finished(finalReport));
            if (activeRun != null && activeRun.runId().equals(run.runId())) {
                activeRun = null;
                activeReport = null;
            }
        }
        return finalReport;
    }

    /**
     * Executes one run on the calling thread.
     */
    IngestionReport execute(String runId, Instant startedAt, List<FeedSource> feeds) {
        logger.info("Starting ingestion run {} over {} feeds", runId, feeds.size());

        long deadline = System.nanoTime() + processing.runTimeout().toNanos();
        AtomicInteger budget = new AtomicInteger(
                processing.maxArticlesPerRun() == null ? Integer.MAX_VALUE : processing.maxArticlesPerRun());
        AtomicBoolean aborted = new AtomicBoolean(false);

        Map<FeedSource, CompletableFuture<FeedOutcome>> pending = new LinkedHashMap<>();
        for (FeedSource feed : feeds) {
            pending.put(feed, feedFetcher.fetchAsync(feed)
                    .thenApplyAsync(fetched -> process(runId, fetched, budget, aborted), fetchExecutor));
        }

        String fatalError = awaitFeeds(pending.values(), deadline, aborted);

        Map<String, FeedIngestionResult> results = new LinkedHashMap<>();
        List<CompletableFuture<Boolean>> allIndexing = new ArrayList<>();
        Map<String, FeedOutcome> outcomes = new LinkedHashMap<>();

        for (Map.Entry<FeedSource, CompletableFuture<FeedOutcome>> entry : pending.entrySet()) {
            FeedSource feed = entry.getKey();
            FeedOutcome outcome = outcomeOf(feed, entry.getValue());
            outcomes.put(feed.url(), outcome);
            allIndexing.addAll(outcome.indexing());
        }

        awaitIndexing(allIndexing, deadline);

        Instant now = Instant.now();
        for (Map.Entry<String, FeedOutcome> entry : outcomes.entrySet()) {
            FeedOutcome outcome = entry.getValue();
            int indexed = (int) outcome.indexing().stream()
                    .filter(f -> f.isDone() && !f.isCompletedExceptionally() && Boolean.TRUE.equals(f.join()))
                    .count();
            results.put(entry.getKey(), outcome.result().withIndexed(indexed));

            if (outcome.fetchSucceeded() && outcome.feedId() != null && fatalError == null) {
                markFetched(outcome.feedId(), now);
            }
        }

        IngestionReport report = IngestionReport.of(runId, startedAt, Instant.now(), results, fatalError);
        logReport(report);
        eventPublisher.publishIngestionCompleted(report);
        return report;
    }

    private FeedOutcome process(String runId, FeedFetchResult fetched, AtomicInteger budget, AtomicBoolean aborted) {
        FeedSource feed = fetched.feed();
        String feedName = feed.name() != null ? feed.name() : feed.url();

        if (!fetched.isSuccess()) {
            return new FeedOutcome(feed.id(), false, FeedIngestionResult.failed(feedName, fetched.error()), List.of());
        }

        List<RawFeedEntry> entries = fetched.entries();
        List<CompletableFuture<Boolean>> indexing = new ArrayList<>();
        int created = 0, duplicate = 0, failed = 0, skipped = 0;

        for (int i = 0; i < entries.size(); i++) {
            if (aborted.get()) {
                skipped = entries.size() - i;
                break;
            }

            if (budget.getAndDecrement() <= 0) {
                budget.incrementAndGet();
                skipped = entries.size() - i;
                logger.info("Article cap reached, skipping {} remaining entries of {}", skipped, feed.url());
                break;
            }

            ArticlePersistenceService.PersistResult result;
            try {
                result = persistence.createIfAbsent(entries.get(i));
            } catch (StoreUnavailableException e) {
                aborted.set(true);
                throw e;
            }

            switch (result.outcome()) {
                case CREATED -> {
                    created++;
                    eventPublisher.publishArticleIngested(result.article(), runId);
                    indexing.add(indexer.indexAsync(result.article()));
                }
                case DUPLICATE -> {
                    budget.incrementAndGet();
                    duplicate++;
                }
                case FAILED -> {
                    budget.incrementAndGet();
                    failed++;
                }
            }
        }

        logger.info("Processed {}: {} fetched, {} new, {} duplicate, {} rejected, {} failed",
                feedName, entries.size(), created, duplicate, fetched.rejected(), failed);

        FeedIngestionResult result = new FeedIngestionResult(feedName, entries.size(), created,
                duplicate, fetched.rejected(), failed, skipped, 0, List.of());
        return new FeedOutcome(feed.id(), true, result, indexing);
    }

    private String awaitFeeds(Iterable<CompletableFuture<FeedOutcome>> futures, long deadline, AtomicBoolean aborted) {
        List<CompletableFuture<FeedOutcome>> all = new ArrayList<>();
        futures.forEach(all::add);

        try {
            CompletableFuture.allOf(all.toArray(new CompletableFuture[0]))
                    .get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);

        } catch (TimeoutException e) {
            aborted.set(true);
            logger.warn("Run deadline of {} reached with feeds still in progress", processing.runTimeout());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            aborted.set(true);
            return "Ingestion interrupted";

        } catch (ExecutionException e) {
            // per-feed failures are read back from each future
            logger.debug("At least one feed completed exceptionally: {}", e.getMessage());
        }

        for (CompletableFuture<FeedOutcome> future : all) {
            if (future.isCompletedExceptionally()) {
                Throwable cause = causeOf(future);
                if (cause instanceof StoreUnavailableException) {
                    return cause.getMessage();
                }
            }
        }
        return null;
    }

    private FeedOutcome outcomeOf(FeedSource feed, CompletableFuture<FeedOutcome> future) {
        String feedName = feed.name() != null ? feed.name() : feed.url();

        if (!future.isDone()) {
            future.cancel(true);
            return new FeedOutcome(feed.id(), false, FeedIngestionResult.failed(feedName,
                    FeedFetchError.of(feed.url(), ErrorCategory.TIMEOUT, "Run deadline reached before the feed finished")),
                    List.of());
        }

        if (future.isCompletedExceptionally()) {
            Throwable cause = causeOf(future);
            ErrorCategory category = cause instanceof StoreUnavailableException ? ErrorCategory.IO_ERROR : ErrorCategory.UNKNOWN;
            return new FeedOutcome(feed.id(), false, FeedIngestionResult.failed(feedName,
                    FeedFetchError.of(feed.url(), category, cause.getClass().getSimpleName() + ": " + cause.getMessage())),
                    List.of());
        }

        return future.join();
    }

    private void awaitIndexing(List<CompletableFuture<Boolean>> indexing, long deadline) {
        if (indexing.isEmpty()) return;

        try {
            CompletableFuture.allOf(indexing.toArray(new CompletableFuture[0]))
                    .get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);

        } catch (TimeoutException e) {
            long pending = indexing.stream().filter(f -> !f.isDone()).count();
            logger.warn("{} articles still indexing at the run deadline; they will be reported as unindexed", pending);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for indexing");

        } catch (ExecutionException e) {
            logger.warn("Indexing task failed: {}", e.getMessage());
        }
    }

    private void markFetched(long feedId, Instant fetchedAt) {
        try {
            feedCatalog.markFetched(feedId, fetchedAt);
        } catch (RuntimeException e) {
            logger.warn("Could not record last fetch time for feed {}: {}", feedId, e.getMessage());
        }
    }

    private void logReport(IngestionReport report) {
        if (report.fatalError() != null) {
            logger.error("Ingestion run {} aborted: {}", report.runId(), report.fatalError());
        }

        logger.info("Ingestion run {} completed: {} feeds, {} fetched, {} new, {} duplicate, {} errors",
                report.runId(), report.feeds().size(), report.totalFetched(), report.totalNew(),
                report.totalDuplicate(), report.totalErrors());
    }

    private static Throwable causeOf(CompletableFuture<?> future) {
        try {
            future.join();
            return null;
        } catch (CompletionException e) {
            return e.getCause() != null ? e.getCause() : e;
        } catch (CancellationException e) {
            return e;
        }
    }

    private record StartedRun(IngestionRun run, CompletableFuture<IngestionReport> report) {}

    private record FeedOutcome(Long feedId, boolean fetchSucceeded, FeedIngestionResult result,
                               List<CompletableFuture<Boolean>> indexing) {}
}
