package io.newsdigest.pipeline.api.exception;

public class GenerationException extends PipelineException {

    public GenerationException(String message, Throwable cause) {
        super(message, "LLM_ERROR", cause);
    }
}
