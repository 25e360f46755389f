package io.newsdigest.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.newsdigest.pipeline.model.ArticleSummary;
import io.newsdigest.pipeline.model.SummaryKind;

import java.time.Instant;

public record ArticleSummaryView(
        @JsonProperty("article_id") long articleId,
        @JsonProperty("summary_type") SummaryKind kind,
        @JsonProperty("summary_text") String summaryText,
        @JsonProperty("word_count") int wordCount,
        @JsonProperty("model") String model,
        @JsonProperty("generated_at") Instant generatedAt,
        @JsonProperty("cached") boolean cached
) {
    public static ArticleSummaryView of(ArticleSummary summary, boolean cached) {
        return new ArticleSummaryView(summary.getArticleId(), summary.getSummaryType(), summary.getSummaryText(),
                summary.getWordCount(), summary.getModel(), summary.getGeneratedAt(), cached);
    }

    public ArticleSummaryView asCached() {
        return new ArticleSummaryView(articleId, kind, summaryText, wordCount, model, generatedAt, true);
    }
}
