package io.newsdigest.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.newsdigest.pipeline.model.Article;

import java.time.Instant;
import java.util.Map;

public record ArticleView(
        @JsonProperty("id") long id,
        @JsonProperty("title") String title,
        @JsonProperty("content") String content,
        @JsonProperty("source") String source,
        @JsonProperty("url") String url,
        @JsonProperty("published_at") Instant publishedAt,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("created_at") Instant createdAt
) {
    public static ArticleView of(Article article) {
        return new ArticleView(article.getId(), article.getTitle(), article.getContent(), article.getSource(),
                article.getUrl(), article.getPublishedAt(), article.getMetadata(), article.getCreatedAt());
    }
}
