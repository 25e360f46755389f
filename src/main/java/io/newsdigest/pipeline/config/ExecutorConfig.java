package io.newsdigest.pipeline.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Fixed-size pools for every fan-out in the pipeline. Nothing submits work to an unbounded executor.
 */
@Configuration
public class ExecutorConfig {

    public static final String FEED_FETCH_EXECUTOR = "feedFetchExecutor";
    public static final String INDEXING_EXECUTOR = "indexingExecutor";
    public static final String INGESTION_RUN_EXECUTOR = "ingestionRunExecutor";
    public static final String LLM_EXECUTOR = "llmExecutor";

    @Bean(name = FEED_FETCH_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService feedFetchExecutor(RssConfig rssConfig) {
        return Executors.newFixedThreadPool(rssConfig.processing().fetchConcurrency(),
                new CustomizableThreadFactory("feed-fetch-"));
    }

    @Bean(name = INDEXING_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService indexingExecutor(RssConfig rssConfig) {
        return Executors.newFixedThreadPool(rssConfig.processing().indexingConcurrency(),
                new CustomizableThreadFactory("indexing-"));
    }

    @Bean(name = INGESTION_RUN_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService ingestionRunExecutor() {
        return Executors.newSingleThreadExecutor(new CustomizableThreadFactory("ingestion-run-"));
    }

    @Bean(name = LLM_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService llmExecutor(LlmProperties llm) {
        return Executors.newFixedThreadPool(llm.concurrency(), new CustomizableThreadFactory("llm-"));
    }
}
