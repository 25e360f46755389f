package io.newsdigest.pipeline.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record ArticlesDeletedEvent(
        @JsonProperty("batchId") String batchId,
        @JsonProperty("deletedCount") int deletedCount,
        @JsonProperty("deletedFromVectorStore") int deletedFromVectorStore,
        @JsonProperty("remainingArticles") long remainingArticles,
        @JsonProperty("filters") Map<String, Object> filters,
        @JsonProperty("consistent") boolean consistent,
        @JsonProperty("deletedAt") Instant deletedAt
) {
    public static ArticlesDeletedEvent create(int deletedCount, int deletedFromVectorStore, long remainingArticles,
                                              Map<String, Object> filters, boolean consistent) {
        return new ArticlesDeletedEvent(
                "DELETE-" + System.currentTimeMillis(),
                deletedCount, deletedFromVectorStore, remainingArticles, filters, consistent, Instant.now());
    }
}
