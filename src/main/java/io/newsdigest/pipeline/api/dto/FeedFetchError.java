package io.newsdigest.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.newsdigest.pipeline.api.exception.ErrorCategory;
import io.newsdigest.pipeline.api.exception.FetchErrorClass;

public record FeedFetchError(
        @JsonIgnore String feedUrl,
        @JsonProperty("class") FetchErrorClass errorClass,
        @JsonProperty("category") ErrorCategory category,
        @JsonProperty("message") String message
) {
    public static FeedFetchError of(String feedUrl, ErrorCategory category, String message) {
        return new FeedFetchError(feedUrl, category.errorClass(), category, message);
    }
}
