package io.newsdigest.pipeline.config;

import java.time.Duration;

public record ProcessingConfig(
        Duration scheduleInterval,
        Duration initialDelay,
        boolean enableScheduling,
        int fetchConcurrency,
        int indexingConcurrency,
        Duration feedTimeout,
        Duration runTimeout,
        Integer maxArticlesPerRun,
        int maxArticlesPerFeed,
        int minContentLength,
        int maxContentLength
) {
    public long getScheduleIntervalMs() {
        return scheduleInterval.toMillis();
    }

    public long getInitialDelayMs() {
        return initialDelay.toMillis();
    }
}
