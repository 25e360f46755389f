package io.newsdigest.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.SortedSet;

public record MultiAnalysis(
        @JsonProperty("focus") String focus,
        @JsonProperty("analysis") String analysis,
        @JsonProperty("articles") List<ArticleDigest> articles,
        @JsonProperty("source_diversity") SortedSet<String> sourceDiversity,
        @JsonProperty("model") String model,
        @JsonProperty("generated_at") Instant generatedAt,
        @JsonProperty("cached") boolean cached
) {
    public MultiAnalysis asCached() {
        return new MultiAnalysis(focus, analysis, articles, sourceDiversity, model, generatedAt, true);
    }
}
