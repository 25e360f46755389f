package io.newsdigest.pipeline.api.exception;

import java.util.HashMap;
import java.util.Map;

/**
 * Summary or multi-article analysis could not be produced. Nothing was persisted when this is thrown.
 */
public class AnalysisException extends PipelineException {

    public enum Kind {
        GENERATION_FAILED("generation-failed"),
        ARTICLE_NOT_FOUND("article-not-found");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Kind kind;

    public AnalysisException(Kind kind, String message, Map<String, Object> details, Throwable cause) {
        super(message, "ANALYSIS_" + kind.name(), withKind(kind, details), cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    private static Map<String, Object> withKind(Kind kind, Map<String, Object> details) {
        Map<String, Object> merged = new HashMap<>(details == null ? Map.of() : details);
        merged.put("kind", kind.label());
        return merged;
    }
}
