package io.newsdigest.pipeline.api.service;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.newsdigest.pipeline.api.exception.EmbeddingException;
import io.newsdigest.pipeline.config.EmbeddingProperties;
import org.springframework.stereotype.Service;

@Service
public class EmbeddingGateway {

    private final EmbeddingModel embeddingModel;
    private final int maxInputChars;

    public EmbeddingGateway(EmbeddingModel embeddingModel, EmbeddingProperties properties) {
        this.embeddingModel = embeddingModel;
        this.maxInputChars = properties.maxInputChars();
    }

    /**
     * @throws EmbeddingException when the provider fails or returns no vector
     */
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingException("Cannot embed empty text", null);
        }

        String input = text.length() > maxInputChars ? text.substring(0, maxInputChars) : text;

        Response<Embedding> response;
        try {
            response = embeddingModel.embed(input);
        } catch (RuntimeException e) {
            throw new EmbeddingException("Embedding provider failed: " + e.getMessage(), e);
        }

        if (response == null || response.content() == null || response.content().vector().length == 0) {
            throw new EmbeddingException("Embedding provider returned no vector", null);
        }
        return response.content().vector();
    }
}
