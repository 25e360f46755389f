package io.newsdigest.pipeline.vector;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Nearest-neighbour index keyed by article id. Derived from the relational store and rebuildable from it,
 * so callers must tolerate records that lag behind article inserts and deletes.
 */
public interface VectorStore {

    void upsert(VectorRecord record);

    /**
     * @return at most {@code k} matches in descending score order
     */
    List<VectorMatch> query(float[] vector, int k, Predicate<VectorRecord> filter);

    default List<VectorMatch> query(float[] vector, int k) {
        return query(vector, k, record -> true);
    }

    Optional<VectorRecord> get(long articleId);

    /**
     * @return true when a record existed and was removed
     */
    boolean delete(long articleId);

    Set<Long> articleIds();

    int size();
}
