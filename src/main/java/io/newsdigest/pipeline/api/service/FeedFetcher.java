package io.newsdigest.pipeline.api.service;

import io.newsdigest.pipeline.api.dto.FeedFetchError;
import io.newsdigest.pipeline.api.dto.FeedFetchResult;
import io.newsdigest.pipeline.api.dto.FeedSource;
import io.newsdigest.pipeline.api.exception.ErrorCategory;
import io.newsdigest.pipeline.api.exception.FeedFetchException;
import io.newsdigest.pipeline.config.ExecutorConfig;
import io.newsdigest.pipeline.config.RssConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fetches and parses feeds on the bounded fetch pool. Every failure becomes a {@link FeedFetchError} value;
 * nothing thrown while fetching one feed reaches the caller or affects another feed.
 */
@Service
public class FeedFetcher {

    private static final Logger logger = LoggerFactory.getLogger(FeedFetcher.class);

    private final FeedHttpClient httpClient;
    private final RssParsingService parsingService;
    private final ExecutorService fetchExecutor;
    private final Duration feedTimeout;

    public FeedFetcher(FeedHttpClient httpClient,
                       RssParsingService parsingService,
                       @Qualifier(ExecutorConfig.FEED_FETCH_EXECUTOR) ExecutorService fetchExecutor,
                       RssConfig rssConfig) {
        this.httpClient = httpClient;
        this.parsingService = parsingService;
        this.fetchExecutor = fetchExecutor;
        this.feedTimeout = rssConfig.processing().feedTimeout();
    }

    /**
     * Completes with a timeout error once the per-feed timeout passes. The clock starts when a fetch worker
     * picks the feed up, so time spent queued behind other feeds does not count. The abandoned download is
     * left to its socket read timeout.
     */
    public CompletableFuture<FeedFetchResult> fetchAsync(FeedSource feed) {
        FeedFetchResult timedOut = FeedFetchResult.failure(feed, FeedFetchError.of(feed.url(), ErrorCategory.TIMEOUT,
                "Feed fetch exceeded " + feedTimeout.toMillis() + "ms"));

        CompletableFuture<FeedFetchResult> result = new CompletableFuture<>();
        fetchExecutor.execute(() -> {
            result.completeOnTimeout(timedOut, feedTimeout.toMillis(), TimeUnit.MILLISECONDS);
            result.complete(fetch(feed));
        });
        return result;
    }

    public List<FeedFetchResult> fetchAll(List<FeedSource> feeds) {
        List<CompletableFuture<FeedFetchResult>> futures = feeds.stream()
                .map(this::fetchAsync)
                .toList();

        return futures.stream()
                .map(CompletableFuture::join)
                .toList();
    }

    /**
     * Blocking fetch of a single feed on the calling thread.
     */
    public FeedFetchResult fetch(FeedSource feed) {
        try {
            byte[] document = httpClient.fetch(feed.url());
            FeedFetchResult result = parsingService.parse(document, feed);

            logger.debug("Fetched {}: {} entries, {} rejected", feed.url(), result.entries().size(), result.rejected());
            return result;

        } catch (FeedFetchException e) {
            logFailure(feed, e);
            return FeedFetchResult.failure(feed, FeedFetchError.of(feed.url(), e.getCategory(), e.getMessage()));

        } catch (RuntimeException e) {
            logger.error("Unexpected error fetching {}: {}", feed.url(), e.getMessage(), e);
            return FeedFetchResult.failure(feed, FeedFetchError.of(feed.url(), ErrorCategory.UNKNOWN,
                    e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }

    private void logFailure(FeedSource feed, FeedFetchException e) {
        switch (e.getCategory()) {
            case TIMEOUT, CONNECTION_REFUSED, NETWORK_ERROR, SERVER_UNAVAILABLE, RATE_LIMITED ->
                    logger.warn("Temporary error for {}: {}", feed.url(), e.getMessage());
            case NOT_FOUND, ACCESS_FORBIDDEN, AUTH_REQUIRED ->
                    logger.error("Permanent error for {}: {}", feed.url(), e.getMessage());
            case PARSE_ERROR ->
                    logger.warn("Parse error for {}: {}", feed.url(), e.getMessage());
            default ->
                    logger.error("Fetch failed for {}: {} (category: {})", feed.url(), e.getMessage(), e.getCategory());
        }
    }
}
