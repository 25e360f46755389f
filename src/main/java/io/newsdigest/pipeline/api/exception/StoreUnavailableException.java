package io.newsdigest.pipeline.api.exception;

/**
 * The relational store cannot be reached. The only failure that aborts a whole batch operation.
 */
public class StoreUnavailableException extends PipelineException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, "DATABASE_ERROR", cause);
    }
}
