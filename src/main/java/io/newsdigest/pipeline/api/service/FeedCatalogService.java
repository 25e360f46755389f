package io.newsdigest.pipeline.api.service;

import io.newsdigest.pipeline.api.dto.FeedRequest;
import io.newsdigest.pipeline.api.dto.FeedSource;
import io.newsdigest.pipeline.api.exception.FeedNotFoundException;
import io.newsdigest.pipeline.api.exception.ValidationException;
import io.newsdigest.pipeline.config.RssSource;
import io.newsdigest.pipeline.model.RssFeed;
import io.newsdigest.pipeline.model.Tag;
import io.newsdigest.pipeline.repository.RssFeedRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class FeedCatalogService {

    private static final Logger logger = LoggerFactory.getLogger(FeedCatalogService.class);

    private final RssFeedRepository feedRepository;
    private final TagService tagService;

    public FeedCatalogService(RssFeedRepository feedRepository, TagService tagService) {
        this.feedRepository = feedRepository;
        this.tagService = tagService;
    }

    @Transactional(readOnly = true)
    public List<RssFeed> list() {
        return feedRepository.findAll();
    }

    @Transactional(readOnly = true)
    public RssFeed get(long feedId) {
        return feedRepository.findById(feedId).orElseThrow(() -> new FeedNotFoundException(feedId));
    }

    @Transactional(readOnly = true)
    public List<FeedSource> enabledFeeds() {
        return feedRepository.findByEnabledTrueOrderByIdAsc().stream()
                .map(FeedSource::of)
                .toList();
    }

    @Transactional
    public RssFeed add(FeedRequest request) {
        String url = validUrl(request.url());
        if (feedRepository.existsByUrl(url)) {
            throw new ValidationException("Feed URL already registered: " + url, Map.of("url", url));
        }

        String name = request.name() == null || request.name().isBlank() ? URI.create(url).getHost() : request.name().trim();
        boolean enabled = request.enabled() == null || request.enabled();

        Set<Tag> tags = tagService.resolve(request.tagIds());

        RssFeed saved = feedRepository.save(new RssFeed(name, url, enabled, tags));
        logger.info("Registered feed {} ({})", saved.getName(), saved.getUrl());
        return saved;
    }

    @Transactional
    public RssFeed update(long feedId, FeedRequest request) {
        RssFeed feed = get(feedId);

        if (request.url() != null) {
            String url = validUrl(request.url());
            if (!url.equals(feed.getUrl()) && feedRepository.existsByUrl(url)) {
                throw new ValidationException("Feed URL already registered: " + url, Map.of("url", url));
            }
            feed.setUrl(url);
        }
        if (request.name() != null && !request.name().isBlank()) {
            feed.setName(request.name().trim());
        }
        if (request.enabled() != null) {
            feed.setEnabled(request.enabled());
        }
        if (request.tagIds() != null) {
            feed.setTags(tagService.resolve(request.tagIds()));
        }

        return feedRepository.save(feed);
    }

    @Transactional
    public void delete(long feedId) {
        RssFeed feed = get(feedId);
        feedRepository.delete(feed);
        logger.info("Removed feed {} ({})", feed.getName(), feed.getUrl());
    }

    @Transactional
    public void markFetched(long feedId, Instant fetchedAt) {
        feedRepository.findById(feedId).ifPresent(feed -> feed.setLastFetchedAt(fetchedAt));
    }

    /**
     * Adds configured sources whose URL is not yet in the catalog. Existing rows keep their edits.
     * Configured tag names are created as tags when missing.
     *
     * @return number of feeds added
     */
    @Transactional
    public int seed(List<RssSource> sources) {
        int added = 0;
        for (RssSource source : sources) {
            if (source.url() == null || feedRepository.existsByUrl(source.url().trim())) {
                continue;
            }
            Set<Tag> tags = tagService.findOrCreate(source.tags());
            feedRepository.save(new RssFeed(source.getSimpleName(), source.url().trim(), source.enabled(), tags));
            added++;
        }
        return added;
    }

    private String validUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new ValidationException("Feed URL is required");
        }

        String trimmed = url.trim();
        try {
            URI uri = URI.create(trimmed);
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    || uri.getHost() == null) {
                throw new ValidationException("Feed URL must be an absolute http(s) URL: " + trimmed);
            }
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Malformed feed URL: " + trimmed);
        }
        return trimmed;
    }
}
