package io.newsdigest.pipeline.config;

import org.springframework.stereotype.Component;

/**
 * Exposes ingestion timings to SpEL in {@code @Scheduled} and {@code @Retryable} attributes as {@code @rssProps}.
 */
@Component("rssProps")
public class RssScheduleExpressions {

    private final RssConfig rssConfig;

    public RssScheduleExpressions(RssConfig rssConfig) {
        this.rssConfig = rssConfig;
    }

    public long getScheduleIntervalMs() {
        return rssConfig.processing().getScheduleIntervalMs();
    }

    public long getInitialDelayMs() {
        return rssConfig.processing().getInitialDelayMs();
    }

    public int getMaxAttempts() {
        return Math.max(1, rssConfig.http().maxRetries());
    }

    public long getRetryDelay() {
        return rssConfig.http().retryDelay();
    }
}
