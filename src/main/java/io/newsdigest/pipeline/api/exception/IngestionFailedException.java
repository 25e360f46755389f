package io.newsdigest.pipeline.api.exception;

import java.util.Map;

public class IngestionFailedException extends PipelineException {

    public IngestionFailedException(String runId, String message, Throwable cause) {
        super(message, "RSS_INGESTION_ERROR", Map.of("run_id", runId), cause);
    }
}
