package io.newsdigest.pipeline.api.exception;

import java.util.Map;

/**
 * Base of every domain error surfaced to callers. The error code is stable and appears in API error bodies.
 */
public class PipelineException extends RuntimeException {
    private final String errorCode;
    private final Map<String, Object> details;

    public PipelineException(String message, String errorCode) {
        this(message, errorCode, Map.of(), null);
    }

    public PipelineException(String message, String errorCode, Throwable cause) {
        this(message, errorCode, Map.of(), cause);
    }

    public PipelineException(String message, String errorCode, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
