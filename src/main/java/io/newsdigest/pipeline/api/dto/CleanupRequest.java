package io.newsdigest.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Set;

public record CleanupRequest(
        @JsonProperty("published_before") Instant publishedBefore,
        @JsonProperty("sources") Set<String> sources,
        @JsonProperty("delete_summaries") Boolean deleteSummaries,
        @JsonProperty("delete_from_vector_store") Boolean deleteFromVectorStore,
        @JsonProperty("confirm_all") boolean confirmAll
) {
    public ArticleFilter filter() {
        return new ArticleFilter(publishedBefore, sources);
    }

    /**
     * Both switches default to on.
     */
    public DeletionOptions options() {
        return new DeletionOptions(deleteSummaries == null || deleteSummaries,
                deleteFromVectorStore == null || deleteFromVectorStore);
    }
}
