package io.newsdigest.pipeline.api.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.newsdigest.pipeline.api.dto.MultiAnalysis;
import io.newsdigest.pipeline.config.AnalysisProperties;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Redis cache of multi-article analyses. Redis being down turns every lookup into a miss.
 */
@Service
public class AnalysisCacheService {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisCacheService.class);

    private static final String MULTI_ANALYSIS_PREFIX = "analysis:multi:";

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final AnalysisProperties analysis;

    public AnalysisCacheService(RedisTemplate<String, String> redisTemplate,
                                ObjectMapper objectMapper,
                                AnalysisProperties analysis) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.analysis = analysis;
    }

    public Optional<MultiAnalysis> get(String key) {
        try {
            String json = redisTemplate.opsForValue().get(key);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, MultiAnalysis.class));

        } catch (DataAccessException e) {
            logger.warn("Analysis cache unavailable, treating {} as a miss: {}", key, e.getMessage());
            return Optional.empty();

        } catch (JsonProcessingException e) {
            logger.warn("Discarding unreadable cached analysis {}: {}", key, e.getOriginalMessage());
            evict(key);
            return Optional.empty();
        }
    }

    public void put(String key, MultiAnalysis result) {
        try {
            redisTemplate.opsForValue().set(key, objectMapper.writeValueAsString(result), analysis.cacheTtl());

        } catch (DataAccessException e) {
            logger.warn("Could not cache analysis {}: {}", key, e.getMessage());

        } catch (JsonProcessingException e) {
            logger.error("Could not serialize analysis {}: {}", key, e.getOriginalMessage());
        }
    }

    public void evict(String key) {
        try {
            redisTemplate.delete(key);
        } catch (DataAccessException e) {
            logger.warn("Could not evict cached analysis {}: {}", key, e.getMessage());
        }
    }

    /**
     * Same ids in any order with the same focus, ignoring case and spacing, give the same key.
     */
    public String multiAnalysisKey(Collection<Long> articleIds, String focus) {
        String ids = articleIds.stream()
                .distinct()
                .sorted()
                .map(String::valueOf)
                .collect(Collectors.joining(","));
        String normalizedFocus = focus == null ? "" : focus.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();

        return MULTI_ANALYSIS_PREFIX + DigestUtils.sha256Hex(ids + "|" + normalizedFocus);
    }
}
