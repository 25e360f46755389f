package io.newsdigest.pipeline.api.dto;

import io.newsdigest.pipeline.model.RssFeed;

/**
 * What the fetcher needs to know about a feed. {@code id} is null for ad-hoc URLs outside the catalog.
 */
public record FeedSource(Long id, String url, String name) {

    public static FeedSource of(RssFeed feed) {
        return new FeedSource(feed.getId(), feed.getUrl(), feed.getName());
    }
}
