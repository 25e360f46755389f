package io.newsdigest.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Selection used by cleanup preview and delete. An empty filter matches every article.
 */
public record ArticleFilter(
        @JsonProperty("published_before") Instant publishedBefore,
        @JsonProperty("sources") Set<String> sources
) {
    public ArticleFilter {
        sources = sources == null ? Set.of() : Set.copyOf(sources);
    }

    public static ArticleFilter all() {
        return new ArticleFilter(null, Set.of());
    }

    public boolean isEmpty() {
        return publishedBefore == null && sources.isEmpty();
    }

    public Map<String, Object> describe() {
        Map<String, Object> applied = new LinkedHashMap<>();
        if (publishedBefore != null) {
            applied.put("published_before", publishedBefore.toString());
        }
        if (!sources.isEmpty()) {
            applied.put("sources", new TreeSet<>(sources));
        }
        return applied;
    }
}
