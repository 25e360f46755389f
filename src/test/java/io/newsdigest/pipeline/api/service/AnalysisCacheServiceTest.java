package io.newsdigest.pipeline.api.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.newsdigest.pipeline.api.dto.MultiAnalysis;
import io.newsdigest.pipeline.config.AnalysisProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnalysisCacheServiceTest {

    @Mock
    private RedisTemplate<String, String> redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();

    private AnalysisCacheService cache;

    @BeforeEach
    void setUp() {
        cache = new AnalysisCacheService(redisTemplate, objectMapper,
                new AnalysisProperties(Duration.ofSeconds(30), 10, 1000, Duration.ofHours(6)));
    }

    @Test
    @DisplayName("Should derive the same key regardless of id order and focus spacing")
    void shouldNormalizeKey() {
        String a = cache.multiAnalysisKey(List.of(3L, 1L, 2L), "Economic  Impact");
        String b = cache.multiAnalysisKey(List.of(1L, 2L, 3L, 3L), " economic impact ");
        String c = cache.multiAnalysisKey(List.of(1L, 2L, 3L), "humanitarian impact");

        assertThat(a).isEqualTo(b).startsWith("analysis:multi:");
        assertThat(a).isNotEqualTo(c);
    }

    @Test
    @DisplayName("Should store analyses as JSON with the configured TTL and read them back")
    void shouldStoreAndReadBack() throws Exception {
        MultiAnalysis analysis = new MultiAnalysis("focus", "text", List.of(),
                new TreeSet<>(List.of("A", "B")), "model", Instant.parse("2025-01-01T00:00:00Z"), false);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        cache.put("key", analysis);
        verify(valueOperations).set(eq("key"), anyString(), eq(Duration.ofHours(6)));

        when(valueOperations.get("key")).thenReturn(objectMapper.writeValueAsString(analysis));
        assertThat(cache.get("key")).contains(analysis);
    }

    @Test
    @DisplayName("Should treat an unreachable Redis as a cache miss")
    void shouldDegradeWhenRedisDown() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("key")).thenThrow(new RedisConnectionFailureException("down"));

        assertThat(cache.get("key")).isEmpty();
    }

    @Test
    @DisplayName("Should not fail a request when caching fails")
    void shouldIgnoreWriteFailures() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        doThrow(new RedisConnectionFailureException("down"))
                .when(valueOperations).set(anyString(), anyString(), eq(Duration.ofHours(6)));

        assertThatCode(() -> cache.put("key", new MultiAnalysis("f", "t", List.of(), new TreeSet<>(), "m",
                Instant.now(), false))).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should evict unreadable entries")
    void shouldEvictCorruptEntries() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("key")).thenReturn("{not json");

        assertThat(cache.get("key")).isEmpty();
        verify(redisTemplate).delete("key");
    }
}
