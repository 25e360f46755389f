package io.newsdigest.pipeline.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * A stored news article. Core fields are written once at ingestion; only {@link #metadata} changes afterwards.
 */
@Entity
@Table(name = "articles",
        indexes = {
                @Index(name = "ux_articles_fingerprint", columnList = "fingerprint", unique = true),
                @Index(name = "ix_articles_source", columnList = "source"),
                @Index(name = "ix_articles_published_at", columnList = "publishedAt"),
                @Index(name = "ix_articles_url", columnList = "url")
        })
public class Article {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 500, updatable = false)
    private String title;

    @Column(nullable = false, length = 50_000, updatable = false)
    private String content;

    @Column(nullable = false, length = 200, updatable = false)
    private String source;

    @Column(updatable = false)
    private Instant publishedAt;

    @Column(nullable = false, length = 2000, updatable = false)
    private String url;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata")
    private Map<String, Object> metadata = new HashMap<>();

    /**
     * sha-256 over normalized title, body and source
     */
    @Column(nullable = false, length = 64, unique = true, updatable = false)
    private String fingerprint;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(nullable = false)
    private Instant updatedAt;

    protected Article() {
    }

    public Article(String title, String content, String source, Instant publishedAt, String url,
                   Map<String, Object> metadata, String fingerprint) {
        this.title = title;
        this.content = content;
        this.source = source;
        this.publishedAt = publishedAt;
        this.url = url;
        this.metadata = metadata == null ? new HashMap<>() : new HashMap<>(metadata);
        this.fingerprint = fingerprint;
    }

    public Long getId() { return id; }
    public String getTitle() { return title; }
    public String getContent() { return content; }
    public String getSource() { return source; }
    public Instant getPublishedAt() { return publishedAt; }
    public String getUrl() { return url; }
    public String getFingerprint() { return fingerprint; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public Map<String, Object> getMetadata() {
        return metadata == null ? Map.of() : metadata;
    }

    public void putMetadata(String key, Object value) {
        Map<String, Object> amended = metadata == null ? new HashMap<>() : new HashMap<>(metadata);
        amended.put(key, value);
        this.metadata = amended;
    }

    @Override
    public String toString() {
        return "Article{id=" + id + ", source='" + source + "', title='" + title + "'}";
    }
}
