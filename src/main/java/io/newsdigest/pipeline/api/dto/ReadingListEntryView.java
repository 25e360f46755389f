package io.newsdigest.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.newsdigest.pipeline.model.Article;
import io.newsdigest.pipeline.model.ReadingListItem;

import java.time.Instant;

public record ReadingListEntryView(
        @JsonProperty("article_id") long articleId,
        @JsonProperty("title") String title,
        @JsonProperty("source") String source,
        @JsonProperty("url") String url,
        @JsonProperty("notes") String notes,
        @JsonProperty("added_at") Instant addedAt,
        @JsonProperty("created") boolean created
) {
    public static ReadingListEntryView of(ReadingListItem item, Article article, boolean created) {
        return new ReadingListEntryView(item.getArticleId(), article.getTitle(), article.getSource(),
                article.getUrl(), item.getNotes(), item.getAddedAt(), created);
    }
}
