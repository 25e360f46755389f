package io.newsdigest.pipeline.api.service;

import io.newsdigest.pipeline.config.ExecutorConfig;
import io.newsdigest.pipeline.config.VectorStoreProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;

/**
 * Optionally rebuilds missing vector records after startup. Runs on the ingestion run thread so it never
 * overlaps an ingestion run's indexing.
 */
@Component
@Order(2)
public class VectorIndexStartup implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(VectorIndexStartup.class);

    private final ReconciliationService reconciliation;
    private final VectorStoreProperties properties;
    private final ExecutorService runExecutor;

    public VectorIndexStartup(ReconciliationService reconciliation,
                              VectorStoreProperties properties,
                              @Qualifier(ExecutorConfig.INGESTION_RUN_EXECUTOR) ExecutorService runExecutor) {
        this.reconciliation = reconciliation;
        this.properties = properties;
        this.runExecutor = runExecutor;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.rebuildMissingOnStartup()) {
            return;
        }

        runExecutor.execute(() -> {
            try {
                int purged = reconciliation.purgeOrphanedVectorRecords();
                int indexed = reconciliation.reindexMissing();
                logger.info("Startup reconciliation: {} orphans purged, {} articles indexed", purged, indexed);
            } catch (RuntimeException e) {
                logger.error("Startup reconciliation failed: {}", e.getMessage(), e);
            }
        });
    }
}
