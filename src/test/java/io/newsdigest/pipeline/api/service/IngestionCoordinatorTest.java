package io.newsdigest.pipeline.api.service;

import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import io.newsdigest.pipeline.TestFixtures;
import io.newsdigest.pipeline.api.dto.FeedIngestionResult;
import io.newsdigest.pipeline.api.dto.FeedSource;
import io.newsdigest.pipeline.api.dto.IngestionReport;
import io.newsdigest.pipeline.api.dto.IngestionRun;
import io.newsdigest.pipeline.api.exception.FetchErrorClass;
import io.newsdigest.pipeline.config.RssConfig;
import io.newsdigest.pipeline.model.Article;
import io.newsdigest.pipeline.repository.ArticleRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class IngestionCoordinatorTest {

    @RegisterExtension
    static WireMockExtension wireMock = WireMockExtension.newInstance().build();

    @Mock
    private ArticleRepository articleRepository;

    @Mock
    private ArticleIndexer indexer;

    @Mock
    private FeedCatalogService feedCatalog;

    @Mock
    private EventPublisherService eventPublisher;

    private final Map<String, Article> stored = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    private ExecutorService fetchExecutor;
    private ExecutorService runExecutor;

    @BeforeEach
    void setUp() {
        fetchExecutor = Executors.newFixedThreadPool(8);
        runExecutor = Executors.newSingleThreadExecutor();

        when(articleRepository.existsByFingerprint(anyString()))
                .thenAnswer(invocation -> stored.containsKey(invocation.<String>getArgument(0)));
        when(articleRepository.saveAndFlush(any(Article.class))).thenAnswer(invocation -> {
            Article article = invocation.getArgument(0);
            ReflectionTestUtils.setField(article, "id", ids.incrementAndGet());
            if (stored.putIfAbsent(article.getFingerprint(), article) != null) {
                throw new DataIntegrityViolationException("duplicate fingerprint");
            }
            return article;
        });
        when(indexer.indexAsync(any(Article.class))).thenReturn(CompletableFuture.completedFuture(true));
    }

    @AfterEach
    void tearDown() {
        fetchExecutor.shutdownNow();
        runExecutor.shutdownNow();
    }

    @Test
    @DisplayName("Should keep ingesting healthy feeds when one feed fails")
    void shouldIsolateFeedFailures() {
        stubFeed("/a", 200, TestFixtures.rss("alpha", 3));
        stubFeed("/b", 404, "not here");
        stubFeed("/c", 200, TestFixtures.rss("gamma", 2));

        IngestionReport report = coordinator(TestFixtures.rssConfig())
                .execute("run-1", Instant.now(), List.of(feed("/a", "A"), feed("/b", "B"), feed("/c", "C")));

        assertThat(report.totalNew()).isEqualTo(5);
        assertThat(report.fatalError()).isNull();
        assertThat(report.feed(url("/a")).created()).isEqualTo(3);
        assertThat(report.feed(url("/c")).created()).isEqualTo(2);
        assertThat(report.feed(url("/a")).indexed()).isEqualTo(3);

        FeedIngestionResult failed = report.feed(url("/b"));
        assertThat(failed.created()).isZero();
        assertThat(failed.errors()).hasSize(1);
        assertThat(failed.errors().get(0).errorClass()).isEqualTo(FetchErrorClass.HTTP_STATUS);

        verify(eventPublisher, times(5)).publishArticleIngested(any(Article.class), eq("run-1"));
        verify(eventPublisher).publishIngestionCompleted(report);
    }

    @Test
    @DisplayName("Should report everything as duplicate on an unchanged second run")
    void shouldBeIdempotentAcrossRuns() {
        stubFeed("/a", 200, TestFixtures.rss("alpha", 3));
        stubFeed("/c", 200, TestFixtures.rss("gamma", 2));
        IngestionCoordinator coordinator = coordinator(TestFixtures.rssConfig());
        List<FeedSource> feeds = List.of(feed("/a", "A"), feed("/c", "C"));

        coordinator.execute("run-1", Instant.now(), feeds);
        IngestionReport second = coordinator.execute("run-2", Instant.now(), feeds);

        assertThat(second.totalNew()).isZero();
        assertThat(second.totalDuplicate()).isEqualTo(second.totalFetched()).isEqualTo(5);
        assertThat(stored).hasSize(5);
        verify(eventPublisher, never()).publishArticleIngested(any(Article.class), eq("run-2"));
    }

    @Test
    @DisplayName("Should store an entry carried by two feeds of the same source only once")
    void shouldCollapseSameEntryFromTwoFeeds() {
        String items = TestFixtures.rss(TestFixtures.item("Shared story", "https://wire.example.com/shared",
                "The same wire report syndicated to two different feed addresses today."));
        stubFeed("/wire-1", 200, items);
        stubFeed("/wire-2", 200, items);

        IngestionReport report = coordinator(TestFixtures.rssConfig())
                .execute("run-1", Instant.now(), List.of(feed("/wire-1", "Wire"), feed("/wire-2", "Wire")));

        assertThat(report.totalNew()).isEqualTo(1);
        assertThat(report.totalDuplicate()).isEqualTo(1);
        assertThat(stored).hasSize(1);
    }

    @Test
    @DisplayName("Should stop persisting once the per-run article cap is reached")
    void shouldHonourRunCap() {
        stubFeed("/a", 200, TestFixtures.rss("alpha", 3));
        RssConfig capped = TestFixtures.rssConfig(2, Duration.ofSeconds(5), Duration.ofSeconds(20));

        IngestionReport report = coordinator(capped).execute("run-1", Instant.now(), List.of(feed("/a", "A")));

        assertThat(report.totalNew()).isEqualTo(2);
        assertThat(report.feed(url("/a")).skipped()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should fail the run when the article store is unreachable")
    void shouldFailRunWhenStoreUnavailable() {
        stubFeed("/a", 200, TestFixtures.rss("alpha", 3));
        when(articleRepository.existsByFingerprint(anyString()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        IngestionReport report = coordinator(TestFixtures.rssConfig())
                .execute("run-1", Instant.now(), List.of(feed("/a", "A")));

        assertThat(report.fatalError()).isNotNull();
        assertThat(report.totalNew()).isZero();
        verify(feedCatalog, never()).markFetched(anyLong(), any(Instant.class));
    }

    @Test
    @DisplayName("Should record fetch time only for catalog feeds that were fetched")
    void shouldMarkFetchedFeeds() {
        stubFeed("/a", 200, TestFixtures.rss("alpha", 1));
        stubFeed("/b", 500, "boom");

        coordinator(TestFixtures.rssConfig()).execute("run-1", Instant.now(), List.of(
                new FeedSource(1L, url("/a"), "A"),
                new FeedSource(2L, url("/b"), "B")));

        verify(feedCatalog).markFetched(eq(1L), any(Instant.class));
        verify(feedCatalog, never()).markFetched(eq(2L), any(Instant.class));
    }

    @Test
    @DisplayName("Should return the active run instead of starting a second one")
    void shouldCoalesceConcurrentTriggers() {
        wireMock.stubFor(get(urlEqualTo("/slow")).willReturn(aResponse()
                .withStatus(200)
                .withFixedDelay(800)
                .withBody(TestFixtures.rss("slow", 1))));
        when(feedCatalog.enabledFeeds()).thenReturn(List.of(feed("/slow", "Slow")));
        IngestionCoordinator coordinator = coordinator(TestFixtures.rssConfig());

        IngestionRun first = coordinator.trigger("manual");
        IngestionRun second = coordinator.trigger("scheduled");
        IngestionReport report = coordinator.ingestNow("api");

        assertThat(second.runId()).isEqualTo(first.runId());
        assertThat(report.runId()).isEqualTo(first.runId());
        assertThat(report.totalNew()).isEqualTo(1);
        assertThat(coordinator.findRun(first.runId())).get()
                .extracting(IngestionRun::status).isEqualTo(IngestionRun.Status.COMPLETED);
        assertThat(coordinator.activeRun()).isEmpty();
    }

    private IngestionCoordinator coordinator(RssConfig config) {
        FeedFetcher fetcher = new FeedFetcher(new FeedHttpClient(config), new RssParsingService(config), fetchExecutor, config);
        ArticlePersistenceService persistence = new ArticlePersistenceService(articleRepository, new FingerprintService());

        return new IngestionCoordinator(fetcher, persistence, indexer, feedCatalog, eventPublisher,
                new IngestionRunRegistry(), runExecutor, fetchExecutor, config);
    }

    private static FeedSource feed(String path, String name) {
        return new FeedSource(null, url(path), name);
    }

    private static String url(String path) {
        return wireMock.baseUrl() + path;
    }

    private static void stubFeed(String path, int status, String body) {
        wireMock.stubFor(get(urlEqualTo(path)).willReturn(aResponse()
                .withStatus(status)
                .withHeader("Content-Type", "application/rss+xml")
                .withBody(body)));
    }
}
