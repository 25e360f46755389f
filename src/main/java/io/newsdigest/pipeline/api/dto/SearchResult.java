package io.newsdigest.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record SearchResult(
        @JsonProperty("article_id") long articleId,
        @JsonProperty("title") String title,
        @JsonProperty("source") String source,
        @JsonProperty("url") String url,
        @JsonProperty("published_at") Instant publishedAt,
        @JsonProperty("score") double score,
        @JsonProperty("snippet") String snippet,
        @JsonProperty("ai_highlight") boolean aiHighlight
) {
    public SearchResult withHighlight(String highlight) {
        return new SearchResult(articleId, title, source, url, publishedAt, score, highlight, true);
    }
}
