package io.newsdigest.pipeline.api.service;

import io.newsdigest.pipeline.api.dto.TagRequest;
import io.newsdigest.pipeline.api.exception.FeedNotFoundException;
import io.newsdigest.pipeline.api.exception.TagNotFoundException;
import io.newsdigest.pipeline.api.exception.ValidationException;
import io.newsdigest.pipeline.model.RssFeed;
import io.newsdigest.pipeline.model.Tag;
import io.newsdigest.pipeline.repository.RssFeedRepository;
import io.newsdigest.pipeline.repository.TagRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Tag catalog and the feed to tag assignments. Tags group feeds; article listings filter on them
 * through the feed name each article carries as its source.
 */
@Service
public class TagService {

    private static final Logger logger = LoggerFactory.getLogger(TagService.class);

    private static final Pattern COLOR = Pattern.compile("^#[0-9A-Fa-f]{6}$");
    private static final int MAX_NAME_LENGTH = 64;

    private final TagRepository tagRepository;
    private final RssFeedRepository feedRepository;

    public TagService(TagRepository tagRepository, RssFeedRepository feedRepository) {
        this.tagRepository = tagRepository;
        this.feedRepository = feedRepository;
    }

    @Transactional(readOnly = true)
    public List<Tag> list() {
        return tagRepository.findAllByOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public Tag get(long tagId) {
        return tagRepository.findById(tagId).orElseThrow(() -> new TagNotFoundException(tagId));
    }

    @Transactional
    public Tag create(TagRequest request) {
        String name = validName(request.name());
        if (tagRepository.existsByName(name)) {
            throw new ValidationException("Tag with name '" + name + "' already exists", Map.of("name", name));
        }

        Tag saved = tagRepository.save(new Tag(name, blankToNull(request.description()), validColor(request.color())));
        logger.info("Created tag {} (id {})", saved.getName(), saved.getId());
        return saved;
    }

    @Transactional
    public Tag update(long tagId, TagRequest request) {
        Tag tag = get(tagId);

        if (request.name() != null) {
            String name = validName(request.name());
            if (tagRepository.existsByNameAndIdNot(name, tagId)) {
                throw new ValidationException("Tag with name '" + name + "' already exists", Map.of("name", name));
            }
            tag.setName(name);
        }
        if (request.description() != null) {
            tag.setDescription(blankToNull(request.description()));
        }
        if (request.color() != null) {
            tag.setColor(validColor(request.color()));
        }

        return tagRepository.save(tag);
    }

    /**
     * Deletes the tag and drops it from every feed carrying it.
     */
    @Transactional
    public void delete(long tagId) {
        Tag tag = get(tagId);

        List<RssFeed> feeds = feedRepository.findByTagId(tagId);
        feeds.forEach(feed -> feed.getTags().removeIf(t -> t.getId().equals(tagId)));
        feedRepository.saveAll(feeds);

        tagRepository.delete(tag);
        logger.info("Deleted tag {} (was on {} feeds)", tag.getName(), feeds.size());
    }

    @Transactional(readOnly = true)
    public List<Tag> feedTags(long feedId) {
        RssFeed feed = feedRepository.findById(feedId).orElseThrow(() -> new FeedNotFoundException(feedId));
        return feed.getTags().stream().sorted(Comparator.comparing(Tag::getName)).toList();
    }

    /**
     * Replaces the tags of a feed. Every ID must exist; nothing changes otherwise.
     */
    @Transactional
    public List<Tag> assignToFeed(long feedId, Collection<Long> tagIds) {
        RssFeed feed = feedRepository.findById(feedId).orElseThrow(() -> new FeedNotFoundException(feedId));

        feed.setTags(resolve(tagIds));
        feedRepository.save(feed);
        logger.debug("Feed {} now tagged {}", feedId, tagIds);

        return feedTags(feedId);
    }

    /**
     * Loads tags by ID, failing with the full list of unknown IDs.
     */
    @Transactional(readOnly = true)
    public Set<Tag> resolve(Collection<Long> tagIds) {
        if (tagIds == null || tagIds.isEmpty()) {
            return new LinkedHashSet<>();
        }

        List<Tag> found = tagRepository.findAllById(tagIds);
        if (found.size() < new TreeSet<>(tagIds).size()) {
            Set<Long> missing = new TreeSet<>(tagIds);
            found.forEach(tag -> missing.remove(tag.getId()));
            throw new ValidationException("Unknown tag IDs: " + missing, Map.of("tag_ids", List.copyOf(missing)));
        }
        return new LinkedHashSet<>(found);
    }

    /**
     * Looks tags up by name and creates the missing ones. Used when seeding configured feeds.
     */
    @Transactional
    public Set<Tag> findOrCreate(Collection<String> names) {
        Set<Tag> tags = new LinkedHashSet<>();
        if (names == null) {
            return tags;
        }

        for (String raw : names) {
            if (raw == null || raw.isBlank()) continue;

            String name = validName(raw);
            tags.add(tagRepository.findByName(name).orElseGet(() -> tagRepository.save(new Tag(name, null, null))));
        }
        return tags;
    }

    private String validName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Tag name cannot be empty");
        }

        String trimmed = name.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("Tag name is longer than " + MAX_NAME_LENGTH + " characters",
                    Map.of("name", trimmed));
        }
        return trimmed;
    }

    private String validColor(String color) {
        if (color == null || color.isBlank()) {
            return null;
        }

        String trimmed = color.trim();
        if (!COLOR.matcher(trimmed).matches()) {
            throw new ValidationException("Color must be a hex code like #1F6FEB", Map.of("color", trimmed));
        }
        return trimmed.toUpperCase();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
