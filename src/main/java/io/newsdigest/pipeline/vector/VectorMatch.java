package io.newsdigest.pipeline.vector;

/**
 * @param score relevance in [0, 1], higher is more similar
 */
public record VectorMatch(long articleId, double score, VectorRecord record) {}
