package io.newsdigest.pipeline.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

@Entity
@Table(name = "rss_feeds",
        indexes = @Index(name = "ux_rss_feeds_url", columnList = "url", unique = true))
public class RssFeed {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(nullable = false, length = 1000, unique = true)
    private String url;

    @Column(nullable = false)
    private boolean enabled = true;

    @ManyToMany(fetch = FetchType.EAGER)
    @JoinTable(name = "rss_feed_tag_links",
            joinColumns = @JoinColumn(name = "feed_id"),
            inverseJoinColumns = @JoinColumn(name = "tag_id"))
    private Set<Tag> tags = new LinkedHashSet<>();

    private Instant lastFetchedAt;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    protected RssFeed() {
    }

    public RssFeed(String name, String url, boolean enabled, Set<Tag> tags) {
        this.name = name;
        this.url = url;
        this.enabled = enabled;
        setTags(tags);
    }

    public Long getId() { return id; }
    public String getName() { return name; }
    public String getUrl() { return url; }
    public boolean isEnabled() { return enabled; }
    public Set<Tag> getTags() { return tags; }
    public Instant getLastFetchedAt() { return lastFetchedAt; }
    public Instant getCreatedAt() { return createdAt; }

    public void setName(String name) { this.name = name; }
    public void setUrl(String url) { this.url = url; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public void setLastFetchedAt(Instant lastFetchedAt) { this.lastFetchedAt = lastFetchedAt; }

    public void setTags(Set<Tag> tags) {
        this.tags = tags == null ? new LinkedHashSet<>() : new LinkedHashSet<>(tags);
    }
}
