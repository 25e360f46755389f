package io.newsdigest.pipeline.api.service;

import io.newsdigest.pipeline.TestFixtures;
import io.newsdigest.pipeline.api.dto.ArticleView;
import io.newsdigest.pipeline.api.dto.TagRequest;
import io.newsdigest.pipeline.api.exception.ValidationException;
import io.newsdigest.pipeline.model.RssFeed;
import io.newsdigest.pipeline.model.Tag;
import io.newsdigest.pipeline.repository.ArticleRepository;
import io.newsdigest.pipeline.repository.RssFeedRepository;
import io.newsdigest.pipeline.repository.TagRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.Page;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
class ArticleQueryServiceTest {

    @Autowired
    private ArticleRepository articleRepository;

    @Autowired
    private RssFeedRepository feedRepository;

    @Autowired
    private TagRepository tagRepository;

    private ArticleQueryService service;
    private Tag tech;
    private Tag world;

    @BeforeEach
    void setUp() {
        service = new ArticleQueryService(articleRepository, feedRepository);
        TagService tags = new TagService(tagRepository, feedRepository);
        tech = tags.create(new TagRequest("tech", null, null));
        world = tags.create(new TagRequest("world", null, null));
        tags.create(new TagRequest("sports", null, null));

        feedRepository.save(new RssFeed("Ars", "https://ars.example.com/rss", true, Set.of(tech)));
        feedRepository.save(new RssFeed("BBC", "https://bbc.example.com/rss", true, Set.of(world)));
        feedRepository.save(new RssFeed("Verge", "https://verge.example.com/rss", true, Set.of(tech, world)));

        articleRepository.save(TestFixtures.article("Chip shortage", "Ars", Instant.parse("2025-06-01T00:00:00Z")));
        articleRepository.save(TestFixtures.article("Summit ends", "BBC", Instant.parse("2025-06-02T00:00:00Z")));
        articleRepository.save(TestFixtures.article("Phone review", "Verge", Instant.parse("2025-06-03T00:00:00Z")));
        articleRepository.save(TestFixtures.article("Undated note", "Ars", null));
        articleRepository.saveAndFlush(TestFixtures.article("Local fair", "Gazette", Instant.parse("2025-06-04T00:00:00Z")));
    }

    @Test
    @DisplayName("Should list newest first with undated articles last")
    void shouldListNewestFirst() {
        Page<ArticleView> page = service.list(null, null, 0, 10);

        assertThat(page.getTotalElements()).isEqualTo(5);
        assertThat(page.getContent()).extracting(ArticleView::title)
                .containsExactly("Local fair", "Phone review", "Summit ends", "Chip shortage", "Undated note");
    }

    @Test
    @DisplayName("Should list only articles from feeds carrying any of the tags")
    void shouldFilterByTags() {
        assertThat(service.list(null, Set.of(tech.getId()), 0, 10).getContent()).extracting(ArticleView::title)
                .containsExactly("Phone review", "Chip shortage", "Undated note");
        assertThat(service.list(null, Set.of(tech.getId(), world.getId()), 0, 10).getTotalElements())
                .isEqualTo(4);
        assertThat(service.list("BBC", Set.of(world.getId()), 0, 10).getContent()).extracting(ArticleView::title)
                .containsExactly("Summit ends");
    }

    @Test
    @DisplayName("Should return an empty page when no feed carries the tags")
    void shouldReturnEmptyPageForUnmatchedTags() {
        Long sports = tagRepository.findByName("sports").orElseThrow().getId();

        assertThat(service.list(null, Set.of(sports), 0, 10)).isEmpty();
        assertThat(service.list(null, List.of(9_999L), 0, 10)).isEmpty();
        assertThat(service.list("Ars", Set.of(world.getId()), 0, 10)).isEmpty();
    }

    @Test
    @DisplayName("Should reject out of range paging")
    void shouldValidatePaging() {
        assertThatThrownBy(() -> service.list(null, null, -1, 10)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.list(null, null, 0, 101)).isInstanceOf(ValidationException.class);
    }
}
