package io.newsdigest.pipeline.api.service;

import io.newsdigest.pipeline.TestFixtures;
import io.newsdigest.pipeline.model.Article;
import io.newsdigest.pipeline.repository.ArticleRepository;
import io.newsdigest.pipeline.vector.InMemoryVectorStore;
import io.newsdigest.pipeline.vector.VectorRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReconciliationServiceTest {

    @Mock
    private ArticleRepository articleRepository;

    @Mock
    private ArticleIndexer indexer;

    private InMemoryVectorStore vectorStore;
    private ReconciliationService service;

    @BeforeEach
    void setUp() {
        vectorStore = new InMemoryVectorStore();
        service = new ReconciliationService(articleRepository, vectorStore, indexer);

        for (long id = 1; id <= 4; id++) {
            vectorStore.upsert(new VectorRecord(id, new float[]{1f, 0f}, "t" + id, "AP", "u" + id, null, "e"));
        }
    }

    @Test
    @DisplayName("Should find and purge vector records without an article")
    void shouldPurgeOrphans() {
        when(articleRepository.findExistingIds(anyCollection())).thenReturn(List.of(1L, 3L));

        assertThat(service.findOrphanedVectorRecords()).containsExactly(2L, 4L);
        assertThat(service.purgeOrphanedVectorRecords()).isEqualTo(2);
        assertThat(vectorStore.articleIds()).containsExactlyInAnyOrder(1L, 3L);
    }

    @Test
    @DisplayName("Should index articles that have no vector record")
    void shouldReindexMissing() {
        Article five = TestFixtures.article(5L, "Five", "AP", Instant.now());
        Article six = TestFixtures.article(6L, "Six", "AP", Instant.now());
        when(articleRepository.findAllIds()).thenReturn(List.of(1L, 2L, 3L, 4L, 5L, 6L));
        when(articleRepository.findAllById(List.of(5L, 6L))).thenReturn(List.of(five, six));
        when(indexer.indexAll(List.of(five, six))).thenReturn(1);

        assertThat(service.findArticlesMissingVectors()).containsExactly(5L, 6L);
        assertThat(service.reindexMissing()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should do nothing when the index is complete")
    void shouldSkipWhenNothingMissing() {
        when(articleRepository.findAllIds()).thenReturn(List.of(1L, 2L, 3L, 4L));

        assertThat(service.reindexMissing()).isZero();
    }
}
