package io.newsdigest.pipeline.api.service;

import io.newsdigest.pipeline.api.dto.TagRequest;
import io.newsdigest.pipeline.api.exception.FeedNotFoundException;
import io.newsdigest.pipeline.api.exception.TagNotFoundException;
import io.newsdigest.pipeline.api.exception.ValidationException;
import io.newsdigest.pipeline.model.RssFeed;
import io.newsdigest.pipeline.model.Tag;
import io.newsdigest.pipeline.repository.RssFeedRepository;
import io.newsdigest.pipeline.repository.TagRepository;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
class TagServiceTest {

    @Autowired
    private TagRepository tagRepository;

    @Autowired
    private RssFeedRepository feedRepository;

    @Autowired
    private EntityManager entityManager;

    private TagService service;
    private RssFeed wire;

    @BeforeEach
    void setUp() {
        service = new TagService(tagRepository, feedRepository);
        wire = feedRepository.saveAndFlush(new RssFeed("Wire", "https://wire.example.com/rss", true, Set.of()));
    }

    @Test
    @DisplayName("Should create tags with trimmed names and list them by name")
    void shouldCreateAndList() {
        service.create(new TagRequest("  tech ", "Technology news", "#1f6feb"));
        service.create(new TagRequest("politics", null, null));

        assertThat(service.list()).extracting(Tag::getName).containsExactly("politics", "tech");
        Tag tech = tagRepository.findByName("tech").orElseThrow();
        assertThat(tech.getDescription()).isEqualTo("Technology news");
        assertThat(tech.getColor()).isEqualTo("#1F6FEB");
        assertThat(tech.getCreatedAt()).isNotNull();
    }

    @Test
    @DisplayName("Should reject duplicate names, blank names and malformed colors")
    void shouldValidateTags() {
        service.create(new TagRequest("tech", null, null));

        assertThatThrownBy(() -> service.create(new TagRequest("tech", "again", null)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("already exists");
        assertThatThrownBy(() -> service.create(new TagRequest("   ", null, null)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.create(new TagRequest("science", null, "blue")))
                .isInstanceOf(ValidationException.class);
        assertThat(tagRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should update fields and refuse a name held by another tag")
    void shouldUpdateTag() {
        Tag tech = service.create(new TagRequest("tech", null, null));
        service.create(new TagRequest("science", null, null));

        Tag updated = service.update(tech.getId(), new TagRequest("technology", "Gadgets and software", "#00AA00"));

        assertThat(updated.getName()).isEqualTo("technology");
        assertThat(updated.getDescription()).isEqualTo("Gadgets and software");
        assertThat(updated.getColor()).isEqualTo("#00AA00");
        assertThatThrownBy(() -> service.update(tech.getId(), new TagRequest("science", null, null)))
                .isInstanceOf(ValidationException.class);
        assertThat(service.update(tech.getId(), new TagRequest("technology", null, null)).getName())
                .isEqualTo("technology");
    }

    @Test
    @DisplayName("Should replace feed tags by ID and list them")
    void shouldAssignTagsToFeed() {
        Tag tech = service.create(new TagRequest("tech", null, null));
        Tag science = service.create(new TagRequest("science", null, null));
        Tag world = service.create(new TagRequest("world", null, null));

        service.assignToFeed(wire.getId(), List.of(tech.getId(), world.getId()));
        List<Tag> assigned = service.assignToFeed(wire.getId(), List.of(science.getId(), tech.getId()));

        assertThat(assigned).extracting(Tag::getName).containsExactly("science", "tech");
        entityManager.flush();
        entityManager.clear();
        assertThat(service.feedTags(wire.getId())).extracting(Tag::getName).containsExactly("science", "tech");
    }

    @Test
    @DisplayName("Should refuse assignments naming unknown tags or feeds")
    void shouldRejectUnknownAssignments() {
        Tag tech = service.create(new TagRequest("tech", null, null));

        assertThatThrownBy(() -> service.assignToFeed(wire.getId(), List.of(tech.getId(), 777L)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("777");
        assertThatThrownBy(() -> service.assignToFeed(404L, List.of(tech.getId())))
                .isInstanceOf(FeedNotFoundException.class);
        assertThatThrownBy(() -> service.feedTags(404L)).isInstanceOf(FeedNotFoundException.class);
        assertThat(service.feedTags(wire.getId())).isEmpty();
    }

    @Test
    @DisplayName("Should delete a tag and drop it from the feeds carrying it")
    void shouldDeleteTag() {
        Tag tech = service.create(new TagRequest("tech", null, null));
        Tag world = service.create(new TagRequest("world", null, null));
        service.assignToFeed(wire.getId(), List.of(tech.getId(), world.getId()));
        entityManager.flush();

        service.delete(tech.getId());
        entityManager.flush();
        entityManager.clear();

        assertThat(tagRepository.existsById(tech.getId())).isFalse();
        assertThat(service.feedTags(wire.getId())).extracting(Tag::getName).containsExactly("world");
        assertThatThrownBy(() -> service.delete(tech.getId())).isInstanceOf(TagNotFoundException.class);
    }
}
