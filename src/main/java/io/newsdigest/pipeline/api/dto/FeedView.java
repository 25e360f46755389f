package io.newsdigest.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.newsdigest.pipeline.model.RssFeed;
import io.newsdigest.pipeline.model.Tag;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

public record FeedView(
        @JsonProperty("id") long id,
        @JsonProperty("name") String name,
        @JsonProperty("url") String url,
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("tags") List<TagView> tags,
        @JsonProperty("last_fetched_at") Instant lastFetchedAt
) {
    public static FeedView of(RssFeed feed) {
        List<TagView> tags = feed.getTags().stream()
                .sorted(Comparator.comparing(Tag::getName))
                .map(TagView::of)
                .toList();
        return new FeedView(feed.getId(), feed.getName(), feed.getUrl(), feed.isEnabled(),
                tags, feed.getLastFetchedAt());
    }
}
