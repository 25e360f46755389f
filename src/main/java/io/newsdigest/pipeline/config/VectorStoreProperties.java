package io.newsdigest.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "vector-store")
public record VectorStoreProperties(
        String snapshotPath,
        boolean rebuildMissingOnStartup
) {
    public boolean hasSnapshot() {
        return snapshotPath != null && !snapshotPath.isBlank();
    }
}
