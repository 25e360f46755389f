package io.newsdigest.pipeline.api.service;

import io.newsdigest.pipeline.TestFixtures;
import io.newsdigest.pipeline.api.dto.RawFeedEntry;
import io.newsdigest.pipeline.api.service.ArticlePersistenceService.Outcome;
import io.newsdigest.pipeline.api.service.ArticlePersistenceService.PersistResult;
import io.newsdigest.pipeline.model.Article;
import io.newsdigest.pipeline.repository.ArticleRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class ArticlePersistenceServiceTest {

    @Autowired
    private ArticleRepository articleRepository;

    private final FingerprintService fingerprintService = new FingerprintService();
    private ArticlePersistenceService service;

    @BeforeEach
    void setUp() {
        articleRepository.deleteAll();
        service = new ArticlePersistenceService(articleRepository, fingerprintService);
    }

    @AfterEach
    void tearDown() {
        articleRepository.deleteAll();
    }

    @Test
    @DisplayName("Should store a new entry and report the same entry as duplicate afterwards")
    void shouldCreateThenReportDuplicate() {
        RawFeedEntry entry = entry("Port strike ends", "Dock workers return after a deal on pay was reached overnight.");

        PersistResult first = service.createIfAbsent(entry);
        PersistResult second = service.createIfAbsent(entry);

        assertThat(first.outcome()).isEqualTo(Outcome.CREATED);
        assertThat(first.article().getId()).isNotNull();
        assertThat(first.article().getMetadata()).containsEntry("feed_url", "https://wire.example.com/rss");
        assertThat(second.outcome()).isEqualTo(Outcome.DUPLICATE);
        assertThat(articleRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should treat whitespace and case variants as the same article")
    void shouldDeduplicateNormalizedVariants() {
        service.createIfAbsent(entry("Port strike ends", "Dock workers return after a deal on pay was reached overnight."));
        PersistResult variant = service.createIfAbsent(
                entry("PORT  strike ends ", "Dock workers return after a deal on pay\nwas reached overnight."));

        assertThat(variant.outcome()).isEqualTo(Outcome.DUPLICATE);
    }

    @Test
    @DisplayName("Should enforce fingerprint uniqueness in the store itself")
    void shouldRejectDuplicateFingerprintInStore() {
        Article original = articleRepository.saveAndFlush(
                TestFixtures.article("Original", "Wire", Instant.parse("2025-01-01T00:00:00Z")));
        Article copy = new Article("Copy", original.getContent(), "Wire", null, "https://wire.example.com/copy",
                Map.of(), original.getFingerprint());

        assertThatThrownBy(() -> articleRepository.saveAndFlush(copy)).isInstanceOf(DataIntegrityViolationException.class);
    }

    private static RawFeedEntry entry(String title, String body) {
        return new RawFeedEntry(title, body, "https://wire.example.com/" + title.hashCode(),
                Instant.parse("2025-06-01T12:00:00Z"), "Wire", Map.of("feed_url", "https://wire.example.com/rss"));
    }
}
