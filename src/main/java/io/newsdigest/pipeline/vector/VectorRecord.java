package io.newsdigest.pipeline.vector;

import java.time.Instant;

/**
 * Embedding of one article plus the display fields copied from it at indexing time.
 */
public record VectorRecord(
        long articleId,
        float[] vector,
        String title,
        String source,
        String url,
        Instant publishedAt,
        String excerpt
) {}
