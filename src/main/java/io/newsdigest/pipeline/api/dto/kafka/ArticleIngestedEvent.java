package io.newsdigest.pipeline.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ArticleIngestedEvent(
        @JsonProperty("articleId") long articleId,
        @JsonProperty("runId") String runId,
        @JsonProperty("title") String title,
        @JsonProperty("url") String url,
        @JsonProperty("source") String source,
        @JsonProperty("publishedAt") Instant publishedAt,
        @JsonProperty("fingerprint") String fingerprint,
        @JsonProperty("ingestedAt") Instant ingestedAt
) {
    public static ArticleIngestedEvent create(long articleId, String runId, String title, String url,
                                              String source, Instant publishedAt, String fingerprint) {
        return new ArticleIngestedEvent(articleId, runId, title, url, source, publishedAt, fingerprint, Instant.now());
    }
}
