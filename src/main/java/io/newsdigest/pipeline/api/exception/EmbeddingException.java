package io.newsdigest.pipeline.api.exception;

public class EmbeddingException extends PipelineException {

    public EmbeddingException(String message, Throwable cause) {
        super(message, "EMBEDDING_ERROR", cause);
    }
}
