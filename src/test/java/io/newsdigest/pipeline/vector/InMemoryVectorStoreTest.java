package io.newsdigest.pipeline.vector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryVectorStoreTest {

    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();

    @Test
    @DisplayName("Should return the k closest records, best first")
    void shouldReturnClosestRecords() {
        InMemoryVectorStore store = new InMemoryVectorStore();
        store.upsert(record(1, "Reuters", 1f, 0f));
        store.upsert(record(2, "Reuters", 0.6f, 0.8f));
        store.upsert(record(3, "AP", 0f, 1f));

        List<VectorMatch> matches = store.query(new float[]{1f, 0f}, 2);

        assertThat(matches).extracting(VectorMatch::articleId).containsExactly(1L, 2L);
        assertThat(matches.get(0).score()).isGreaterThan(matches.get(1).score());
    }

    @Test
    @DisplayName("Should apply the record filter before ranking")
    void shouldApplyFilter() {
        InMemoryVectorStore store = new InMemoryVectorStore();
        store.upsert(record(1, "Reuters", 1f, 0f));
        store.upsert(record(2, "AP", 0f, 1f));

        assertThat(store.query(new float[]{1f, 0f}, 5, r -> r.source().equals("AP")))
                .extracting(VectorMatch::articleId)
                .containsExactly(2L);
    }

    @Test
    @DisplayName("Should skip records embedded with another dimension")
    void shouldSkipOtherDimensions() {
        InMemoryVectorStore store = new InMemoryVectorStore();
        store.upsert(record(1, "Reuters", 1f, 0f));
        store.upsert(new VectorRecord(2, new float[]{1f, 0f, 0f}, "t", "AP", "u", null, "e"));

        assertThat(store.query(new float[]{1f, 0f}, 5)).extracting(VectorMatch::articleId).containsExactly(1L);
    }

    @Test
    @DisplayName("Should replace a record on upsert and report deletions")
    void shouldUpsertAndDelete() {
        InMemoryVectorStore store = new InMemoryVectorStore();
        store.upsert(record(1, "Reuters", 1f, 0f));
        store.upsert(record(1, "Reuters", 0f, 1f));

        assertThat(store.size()).isEqualTo(1);
        assertThat(store.get(1).orElseThrow().vector()).containsExactly(0f, 1f);
        assertThat(store.delete(1)).isTrue();
        assertThat(store.delete(1)).isFalse();
        assertThat(store.articleIds()).isEmpty();
    }

    @Test
    @DisplayName("Should survive a snapshot and restore")
    void shouldRestoreSnapshot(@TempDir Path dir) {
        Path snapshot = dir.resolve("vectors/index.json");
        InMemoryVectorStore store = new InMemoryVectorStore(objectMapper, snapshot);
        store.upsert(record(1, "Reuters", 1f, 0f));
        store.upsert(record(2, "AP", 0f, 1f));
        store.snapshot();

        InMemoryVectorStore restored = new InMemoryVectorStore(objectMapper, snapshot);
        restored.restore();

        assertThat(Files.exists(snapshot)).isTrue();
        assertThat(restored.articleIds()).containsExactlyInAnyOrder(1L, 2L);
        assertThat(restored.get(2).orElseThrow().publishedAt()).isEqualTo(Instant.parse("2025-01-02T00:00:00Z"));
    }

    @Test
    @DisplayName("Should start empty when the snapshot is unreadable")
    void shouldStartEmptyOnCorruptSnapshot(@TempDir Path dir) throws Exception {
        Path snapshot = dir.resolve("index.json");
        Files.writeString(snapshot, "[{broken");

        InMemoryVectorStore store = new InMemoryVectorStore(objectMapper, snapshot);
        store.restore();

        assertThat(store.size()).isZero();
    }

    private static VectorRecord record(long id, String source, float x, float y) {
        return new VectorRecord(id, new float[]{x, y}, "Title " + id, source, "https://example.com/" + id,
                Instant.parse("2025-01-0" + id + "T00:00:00Z"), "excerpt " + id);
    }
}
