package io.newsdigest.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record DeletionReport(
        @JsonProperty("deleted_count") int deletedCount,
        @JsonProperty("deleted_summaries_count") int deletedSummariesCount,
        @JsonProperty("deleted_reading_list_count") int deletedReadingListCount,
        @JsonProperty("deleted_from_vector_store") int deletedFromVectorStore,
        @JsonProperty("remaining_articles") long remainingArticles,
        @JsonProperty("filters_applied") Map<String, Object> filtersApplied,
        @JsonProperty("warnings") List<ConsistencyWarning> warnings
) {
    public boolean isConsistent() {
        return warnings.isEmpty();
    }
}
