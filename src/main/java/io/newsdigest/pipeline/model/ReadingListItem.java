package io.newsdigest.pipeline.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

@Entity
@Table(name = "reading_list",
        indexes = @Index(name = "ux_reading_list_article_id", columnList = "article_id", unique = true))
public class ReadingListItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "article_id", nullable = false, unique = true, updatable = false)
    private Long articleId;

    @Column(length = 2000)
    private String notes;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private Instant addedAt;

    protected ReadingListItem() {
    }

    public ReadingListItem(Long articleId, String notes) {
        this.articleId = articleId;
        this.notes = notes;
    }

    public Long getId() { return id; }
    public Long getArticleId() { return articleId; }
    public String getNotes() { return notes; }
    public Instant getAddedAt() { return addedAt; }

    public void setNotes(String notes) { this.notes = notes; }
}
