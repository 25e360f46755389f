package io.newsdigest.pipeline.api.service;

import io.newsdigest.pipeline.api.dto.IngestionRun;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded history of ingestion runs, oldest evicted first.
 */
@Component
public class IngestionRunRegistry {

    static final int MAX_RUNS = 50;

    private final Map<String, IngestionRun> runs = new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, IngestionRun> eldest) {
            return size() > MAX_RUNS;
        }
    };

    public synchronized void record(IngestionRun run) {
        runs.put(run.runId(), run);
    }

    public synchronized Optional<IngestionRun> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    /**
     * @return runs newest first
     */
    public synchronized List<IngestionRun> recent() {
        List<IngestionRun> newestFirst = new ArrayList<>(runs.values());
        Collections.reverse(newestFirst);
        return newestFirst;
    }
}
