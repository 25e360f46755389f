package io.newsdigest.pipeline.api.exception;

import java.util.Map;

public class ValidationException extends PipelineException {

    public ValidationException(String message) {
        super(message, "VALIDATION_ERROR");
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(message, "VALIDATION_ERROR", details, null);
    }
}
