package io.newsdigest.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.newsdigest.pipeline.model.Article;

import java.time.Instant;

/**
 * Provenance of one article that contributed to an analysis.
 */
public record ArticleDigest(
        @JsonProperty("id") long id,
        @JsonProperty("title") String title,
        @JsonProperty("source") String source,
        @JsonProperty("url") String url,
        @JsonProperty("published_at") Instant publishedAt
) {
    public static ArticleDigest of(Article article) {
        return new ArticleDigest(article.getId(), article.getTitle(), article.getSource(),
                article.getUrl(), article.getPublishedAt());
    }
}
