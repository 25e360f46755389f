package io.newsdigest.pipeline.api.service;

import com.rometools.rome.feed.synd.SyndCategory;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import io.newsdigest.pipeline.api.dto.FeedFetchResult;
import io.newsdigest.pipeline.api.dto.FeedSource;
import io.newsdigest.pipeline.api.dto.RawFeedEntry;
import io.newsdigest.pipeline.api.exception.ErrorCategory;
import io.newsdigest.pipeline.api.exception.FeedFetchException;
import io.newsdigest.pipeline.config.ProcessingConfig;
import io.newsdigest.pipeline.config.RssConfig;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a downloaded RSS or Atom document into validated raw entries.
 */
@Service
public class RssParsingService {

    private static final Logger logger = LoggerFactory.getLogger(RssParsingService.class);

    private static final int MAX_TITLE_LENGTH = 500;
    private static final int MAX_URL_LENGTH = 2000;

    private final ProcessingConfig processing;

    public RssParsingService(RssConfig rssConfig) {
        this.processing = rssConfig.processing();
    }

    /**
     * @return entries that passed validation, with the number of rejected entries alongside
     * @throws FeedFetchException with category {@link ErrorCategory#PARSE_ERROR} when the document is not a feed
     */
    public FeedFetchResult parse(byte[] document, FeedSource feed) throws FeedFetchException {
        SyndFeed syndFeed = readFeed(document, feed.url());

        List<SyndEntry> entries = syndFeed.getEntries() == null ? List.of() : syndFeed.getEntries();
        if (entries.isEmpty()) {
            logger.warn("Feed has no entries: {}", feed.url());
            return FeedFetchResult.success(feed, List.of(), 0);
        }

        if (entries.size() > processing.maxArticlesPerFeed()) {
            logger.debug("Feed {} has {} entries, keeping the first {}",
                    feed.url(), entries.size(), processing.maxArticlesPerFeed());
            entries = entries.subList(0, processing.maxArticlesPerFeed());
        }

        String sourceLabel = sourceLabel(feed, syndFeed);
        List<RawFeedEntry> accepted = new ArrayList<>();
        int rejected = 0;

        for (SyndEntry entry : entries) {
            RawFeedEntry raw = convertToEntry(entry, syndFeed, feed, sourceLabel);
            if (raw == null) {
                rejected++;
            } else {
                accepted.add(raw);
            }
        }

        return FeedFetchResult.success(feed, accepted, rejected);
    }

    private SyndFeed readFeed(byte[] document, String url) throws FeedFetchException {
        if (document == null || document.length == 0) {
            throw new FeedFetchException("Empty response body: " + url, ErrorCategory.PARSE_ERROR);
        }

        try (XmlReader reader = new XmlReader(new ByteArrayInputStream(document))) {
            SyndFeed feed = new SyndFeedInput().build(reader);
            if (feed == null) {
                throw new FeedFetchException("Feed document is empty: " + url, ErrorCategory.PARSE_ERROR);
            }
            return feed;

        } catch (FeedException | IllegalArgumentException e) {
            throw new FeedFetchException("Feed parsing error: " + e.getMessage(), e, ErrorCategory.PARSE_ERROR);

        } catch (IOException e) {
            throw new FeedFetchException("Unreadable feed document: " + e.getMessage(), e, ErrorCategory.PARSE_ERROR);
        }
    }

    private RawFeedEntry convertToEntry(SyndEntry entry, SyndFeed syndFeed, FeedSource feed, String sourceLabel) {
        if (entry == null) {
            return null;
        }

        String title = truncate(htmlToText(entry.getTitle()), MAX_TITLE_LENGTH);
        String link = entryLink(entry);
        String body = truncate(htmlToText(entryBody(entry)), processing.maxContentLength());

        if (title.isBlank() || link.isBlank()) {
            logger.debug("Rejecting entry with missing title or link: title='{}', link='{}'", title, link);
            return null;
        }

        if (link.length() > MAX_URL_LENGTH) {
            logger.debug("Rejecting entry with oversized link: {}", link.substring(0, 80));
            return null;
        }

        if (body.length() < processing.minContentLength()) {
            logger.debug("Rejecting '{}' from {}: body has {} chars, minimum is {}",
                    title, feed.url(), body.length(), processing.minContentLength());
            return null;
        }

        return new RawFeedEntry(title, body, link, publishedAt(entry), sourceLabel, metadata(entry, syndFeed, feed));
    }

    private String entryBody(SyndEntry entry) {
        if (entry.getContents() != null) {
            String content = entry.getContents().stream()
                    .map(SyndContent::getValue)
                    .filter(Objects::nonNull)
                    .filter(value -> !value.isBlank())
                    .findFirst()
                    .orElse(null);
            if (content != null) {
                return content;
            }
        }

        return entry.getDescription() != null ? entry.getDescription().getValue() : null;
    }

    private String entryLink(SyndEntry entry) {
        if (entry.getLink() != null && !entry.getLink().isBlank()) {
            return entry.getLink().trim();
        }

        // Atom entries sometimes carry the permalink only as their id
        String uri = entry.getUri();
        if (uri != null && (uri.startsWith("http://") || uri.startsWith("https://"))) {
            return uri.trim();
        }
        return "";
    }

    private Instant publishedAt(SyndEntry entry) {
        Date date = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
        return date != null ? date.toInstant() : null;
    }

    private Map<String, Object> metadata(SyndEntry entry, SyndFeed syndFeed, FeedSource feed) {
        Map<String, Object> metadata = new LinkedHashMap<>();

        if (entry.getAuthor() != null && !entry.getAuthor().isBlank()) {
            metadata.put("author", htmlToText(entry.getAuthor()));
        }

        if (entry.getCategories() != null && !entry.getCategories().isEmpty()) {
            List<String> categories = entry.getCategories().stream()
                    .map(SyndCategory::getName)
                    .filter(Objects::nonNull)
                    .map(String::trim)
                    .filter(name -> !name.isEmpty())
                    .distinct()
                    .toList();
            if (!categories.isEmpty()) {
                metadata.put("categories", categories);
            }
        }

        if (syndFeed.getTitle() != null) {
            metadata.put("feed_title", htmlToText(syndFeed.getTitle()));
        }
        metadata.put("feed_url", feed.url());

        return metadata;
    }

    private String sourceLabel(FeedSource feed, SyndFeed syndFeed) {
        if (feed.name() != null && !feed.name().isBlank()) {
            return feed.name().trim();
        }
        if (syndFeed.getTitle() != null && !syndFeed.getTitle().isBlank()) {
            return htmlToText(syndFeed.getTitle());
        }

        String host = URI.create(feed.url()).getHost();
        return host != null ? host : feed.url();
    }

    static String htmlToText(String html) {
        if (html == null || html.isBlank()) return "";

        return Jsoup.parse(html).text().trim();
    }

    static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) return text;

        return text.substring(0, maxLength).trim();
    }
}
