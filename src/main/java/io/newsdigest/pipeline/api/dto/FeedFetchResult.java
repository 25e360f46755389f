package io.newsdigest.pipeline.api.dto;

import java.util.List;

/**
 * Outcome of fetching one feed: either parsed entries (possibly none) or a fetch error.
 */
public record FeedFetchResult(
        FeedSource feed,
        List<RawFeedEntry> entries,
        int rejected,
        FeedFetchError error
) {
    public static FeedFetchResult success(FeedSource feed, List<RawFeedEntry> entries, int rejected) {
        return new FeedFetchResult(feed, List.copyOf(entries), rejected, null);
    }

    public static FeedFetchResult failure(FeedSource feed, FeedFetchError error) {
        return new FeedFetchResult(feed, List.of(), 0, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
