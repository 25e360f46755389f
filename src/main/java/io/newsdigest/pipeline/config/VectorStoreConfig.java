package io.newsdigest.pipeline.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.newsdigest.pipeline.vector.InMemoryVectorStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class VectorStoreConfig {

    @Bean(initMethod = "restore", destroyMethod = "snapshot")
    public InMemoryVectorStore vectorStore(VectorStoreProperties properties, ObjectMapper objectMapper) {
        Path snapshot = properties.hasSnapshot() ? Path.of(properties.snapshotPath()) : null;
        return new InMemoryVectorStore(objectMapper, snapshot);
    }
}
