package io.newsdigest.pipeline.api.dto;

import java.time.Instant;
import java.util.Map;

public record RawFeedEntry(
        String title,
        String body,
        String link,
        Instant publishedAt,
        String source,
        Map<String, Object> metadata
) {}
