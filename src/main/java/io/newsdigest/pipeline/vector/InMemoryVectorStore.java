package io.newsdigest.pipeline.vector;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.CosineSimilarity;
import dev.langchain4j.store.embedding.RelevanceScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Brute-force cosine index held in memory, optionally snapshotted to a JSON file between restarts.
 */
public class InMemoryVectorStore implements VectorStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryVectorStore.class);

    private final ConcurrentHashMap<Long, VectorRecord> records = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final Path snapshotPath;

    public InMemoryVectorStore() {
        this(null, null);
    }

    public InMemoryVectorStore(ObjectMapper objectMapper, Path snapshotPath) {
        this.objectMapper = objectMapper;
        this.snapshotPath = snapshotPath;
    }

    @Override
    public void upsert(VectorRecord record) {
        records.put(record.articleId(), record);
    }

    @Override
    public List<VectorMatch> query(float[] vector, int k, Predicate<VectorRecord> filter) {
        if (k <= 0 || records.isEmpty()) {
            return List.of();
        }

        Embedding query = Embedding.from(vector);
        List<VectorMatch> matches = new ArrayList<>();
        int skipped = 0;

        for (VectorRecord record : records.values()) {
            if (!filter.test(record)) continue;

            if (record.vector().length != vector.length) {
                skipped++;
                continue;
            }

            double cosine = CosineSimilarity.between(query, Embedding.from(record.vector()));
            matches.add(new VectorMatch(record.articleId(), RelevanceScore.fromCosineSimilarity(cosine), record));
        }

        if (skipped > 0) {
            logger.warn("Skipped {} vector records with a dimension other than {}", skipped, vector.length);
        }

        return matches.stream()
                .sorted(Comparator.comparingDouble(VectorMatch::score).reversed())
                .limit(k)
                .toList();
    }

    @Override
    public Optional<VectorRecord> get(long articleId) {
        return Optional.ofNullable(records.get(articleId));
    }

    @Override
    public boolean delete(long articleId) {
        return records.remove(articleId) != null;
    }

    @Override
    public Set<Long> articleIds() {
        return Set.copyOf(records.keySet());
    }

    @Override
    public int size() {
        return records.size();
    }

    public void restore() {
        if (snapshotPath == null || !Files.exists(snapshotPath)) {
            return;
        }

        try {
            List<VectorRecord> loaded = objectMapper.readValue(snapshotPath.toFile(), new TypeReference<>() {});
            loaded.forEach(this::upsert);
            logger.info("Restored {} vector records from {}", loaded.size(), snapshotPath);
        } catch (IOException e) {
            // reconciliation re-embeds whatever is missing
            logger.error("Could not restore vector snapshot {}: {}", snapshotPath, e.getMessage());
        }
    }

    public void snapshot() {
        if (snapshotPath == null) {
            return;
        }

        try {
            Path parent = snapshotPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(snapshotPath.toFile(), new ArrayList<>(records.values()));
            logger.info("Wrote {} vector records to {}", records.size(), snapshotPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to snapshot vector store to " + snapshotPath, e);
        }
    }
}
