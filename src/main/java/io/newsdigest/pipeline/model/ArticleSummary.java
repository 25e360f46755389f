package io.newsdigest.pipeline.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Persisted LLM summary. At most one row per (article, kind); regeneration overwrites the row.
 * The article reference is a plain column so summaries can outlive a bulk delete when asked to.
 */
@Entity
@Table(name = "summaries",
        uniqueConstraints = @UniqueConstraint(name = "ux_summaries_article_kind",
                columnNames = {"article_id", "summary_type"}),
        indexes = @Index(name = "ix_summaries_article_id", columnList = "article_id"))
public class ArticleSummary {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "article_id", nullable = false, updatable = false)
    private Long articleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "summary_type", nullable = false, length = 32, updatable = false)
    private SummaryKind summaryType;

    @Column(nullable = false, length = 20_000)
    private String summaryText;

    @Column(nullable = false)
    private int wordCount;

    @Column(length = 100)
    private String model;

    @Column(nullable = false)
    private Instant generatedAt;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(nullable = false)
    private Instant updatedAt;

    protected ArticleSummary() {
    }

    public ArticleSummary(Long articleId, SummaryKind summaryType) {
        this.articleId = articleId;
        this.summaryType = summaryType;
    }

    public void regenerated(String text, String model, Instant generatedAt) {
        this.summaryText = text;
        this.wordCount = text.isBlank() ? 0 : text.trim().split("\\s+").length;
        this.model = model;
        this.generatedAt = generatedAt;
    }

    public Long getId() { return id; }
    public Long getArticleId() { return articleId; }
    public SummaryKind getSummaryType() { return summaryType; }
    public String getSummaryText() { return summaryText; }
    public int getWordCount() { return wordCount; }
    public String getModel() { return model; }
    public Instant getGeneratedAt() { return generatedAt; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
