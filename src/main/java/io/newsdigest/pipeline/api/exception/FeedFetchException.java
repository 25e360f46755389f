package io.newsdigest.pipeline.api.exception;

public class FeedFetchException extends Exception {
    private final ErrorCategory category;
    private final Integer httpStatus;

    public FeedFetchException(String message, ErrorCategory category) {
        this(message, null, category, null);
    }

    public FeedFetchException(String message, Throwable cause, ErrorCategory category) {
        this(message, cause, category, null);
    }

    public FeedFetchException(String message, ErrorCategory category, int httpStatus) {
        this(message, null, category, httpStatus);
    }

    private FeedFetchException(String message, Throwable cause, ErrorCategory category, Integer httpStatus) {
        super(message, cause);
        this.category = category;
        this.httpStatus = httpStatus;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }
}
