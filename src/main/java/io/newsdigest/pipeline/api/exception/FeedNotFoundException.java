package io.newsdigest.pipeline.api.exception;

import java.util.Map;

public class FeedNotFoundException extends PipelineException {

    public FeedNotFoundException(long feedId) {
        super("RSS feed with ID " + feedId + " not found", "FEED_NOT_FOUND", Map.of("feed_id", feedId), null);
    }
}
