package dev.oppscanner.service;

import dev.oppscanner.cache.DedupCache;
import dev.oppscanner.cache.InMemoryDedupCache;
import dev.oppscanner.config.DiscoveryConfig;
import dev.oppscanner.config.SourcesConfig;
import dev.oppscanner.metrics.DiscoveryMetrics;
import dev.oppscanner.model.DiscoveryProfile;
import dev.oppscanner.model.DiscoveryResult;
import dev.oppscanner.model.Opportunity;
import dev.oppscanner.model.Platform;
import dev.oppscanner.model.SourceReport;
import dev.oppscanner.source.OpportunitySource;
import dev.oppscanner.source.SourceSupport;
import dev.oppscanner.source.impl.HackerNewsSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class DiscoveryServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-15T12:00:00Z");

    @Mock
    private DedupCache dedupCache;

    @Mock
    private DiscoveryMetrics metrics;

    private DiscoveryConfig discoveryConfig;
    private final List<OpportunitySource> sources = new ArrayList<>();
    private DiscoveryService discoveryService;

    @BeforeEach
    void setUp() {
        discoveryConfig = new DiscoveryConfig();
        discoveryService = new DiscoveryService(sources, dedupCache, discoveryConfig, metrics,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Opportunity opportunity(Platform platform, String id, int value, int matchScore) {
        return Opportunity.builder()
                .source(platform)
                .nativeId(id)
                .title("Opportunity " + id)
                .estimatedValue(value)
                .matchScore(matchScore)
                .build();
    }

    @Nested
    @DisplayName("Failure isolation")
    class IsolationTests {

        @Test
        @DisplayName("One failing source does not affect the others")
        void shouldIsolateFailingSource() {
            sources.add(new FakeSource(Platform.GITHUB, () -> Flux.just(
                    opportunity(Platform.GITHUB, "1", 100, 90),
                    opportunity(Platform.GITHUB, "2", 200, 50),
                    opportunity(Platform.GITHUB, "3", 300, 80))));
            sources.add(new FakeSource(Platform.REDDIT, () -> Flux.error(new IllegalStateException("HTTP 503"))));
            sources.add(new FakeSource(Platform.UPWORK, Flux::empty));

            StepVerifier.create(discoveryService.discover("tester", DiscoveryProfile.empty(),
                            List.of("github", "reddit", "upwork")))
                    .assertNext(result -> {
                        assertThat(result.isSuccess()).isTrue();
                        assertThat(result.getCaller()).isEqualTo("tester");
                        assertThat(result.getTotalFound()).isEqualTo(3);
                        assertThat(result.getTotalEstimatedValue()).isEqualTo(600L);
                        assertThat(result.getHighRelevanceCount()).isEqualTo(2);
                        assertThat(result.getSourcesAttempted()).containsExactly("github", "reddit", "upwork");
                        assertThat(result.getCompletedAt()).isEqualTo(NOW);

                        SourceReport github = result.getBySource().get("github");
                        assertThat(github.status()).isEqualTo(SourceReport.Status.OK);
                        assertThat(github.count()).isEqualTo(3);

                        SourceReport reddit = result.getBySource().get("reddit");
                        assertThat(reddit.status()).isEqualTo(SourceReport.Status.ERROR);
                        assertThat(reddit.error()).contains("503");
                        assertThat(reddit.count()).isZero();

                        assertThat(result.getBySource().get("upwork").status()).isEqualTo(SourceReport.Status.OK);
                        assertThat(result.getBySource().get("upwork").count()).isZero();
                    })
                    .verifyComplete();

            verify(metrics).recordRun(3, 600L, 1);
        }

        @Test
        @DisplayName("A source throwing before returning a publisher is contained")
        void shouldContainSynchronousThrow() {
            sources.add(new FakeSource(Platform.GITHUB, () -> {
                throw new IllegalArgumentException("bad state");
            }));

            StepVerifier.create(discoveryService.discover("tester", null, null))
                    .assertNext(result -> {
                        assertThat(result.isSuccess()).isTrue();
                        assertThat(result.getBySource().get("github").error()).isEqualTo("bad state");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("A slow source is reported as timed out and cancelled")
        void shouldTimeOutSlowSource() {
            discoveryConfig.setSourceTimeout(Duration.ofMillis(200));
            AtomicBoolean cancelled = new AtomicBoolean();
            sources.add(new FakeSource(Platform.HACKERNEWS,
                    () -> Flux.<Opportunity>never().doOnCancel(() -> cancelled.set(true))));
            sources.add(new FakeSource(Platform.REMOTIVE,
                    () -> Flux.just(opportunity(Platform.REMOTIVE, "r1", 1000, 10))));

            StepVerifier.create(discoveryService.discover("tester", DiscoveryProfile.empty(), null))
                    .assertNext(result -> {
                        SourceReport hn = result.getBySource().get("hackernews");
                        assertThat(hn.status()).isEqualTo(SourceReport.Status.TIMED_OUT);
                        assertThat(hn.opportunities()).isEmpty();
                        assertThat(result.getBySource().get("remotive").count()).isEqualTo(1);
                        assertThat(result.getTotalFound()).isEqualTo(1);
                    })
                    .verifyComplete();

            assertThat(cancelled).isTrue();
        }

        @Test
        @DisplayName("Batch deadline caps the per-source deadline")
        void shouldUseTighterOfTheTwoDeadlines() {
            discoveryConfig.setSourceTimeout(Duration.ofSeconds(30));
            discoveryConfig.setBatchTimeout(Duration.ofMillis(150));
            sources.add(new FakeSource(Platform.GITHUB, Flux::never));

            StepVerifier.create(discoveryService.discover("tester", null, null))
                    .assertNext(result -> assertThat(result.getBySource().get("github").error())
                            .isEqualTo("Timed out after 150 ms"))
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));
        }
    }

    @Nested
    @DisplayName("Deadline with a live adapter")
    class PartialResultTests {

        private MockWebServer mockWebServer;
        private InMemoryDedupCache realCache;

        @BeforeEach
        void startServer() throws IOException {
            mockWebServer = new MockWebServer();
            mockWebServer.setDispatcher(new Dispatcher() {
                @Override
                public MockResponse dispatch(RecordedRequest request) {
                    String path = request.getPath() == null ? "" : request.getPath();
                    return switch (path) {
                        case "/v0/topstories.json" -> json("[1, 2]");
                        case "/v0/item/1.json" -> json("""
                                {"id": 1, "type": "story", "title": "Ask HN: Paid help with a parser, $800"}
                                """);
                        case "/v0/item/2.json" -> json("""
                                {"id": 2, "type": "story", "title": "Ask HN: Paid help with a compiler, $900"}
                                """).setHeadersDelay(5, TimeUnit.SECONDS);
                        default -> new MockResponse().setResponseCode(404);
                    };
                }
            });
            mockWebServer.start();

            Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
            realCache = new InMemoryDedupCache(clock, Duration.ofHours(24), 100);
            DiscoveryConfig adapterConfig = new DiscoveryConfig();
            adapterConfig.getHttp().setRequestTimeout(Duration.ofSeconds(10));
            SourceSupport support = new SourceSupport(adapterConfig, realCache, new BudgetExtractor(),
                    new RelevanceScorer(), new DiscoveryMetrics(new SimpleMeterRegistry()), clock);

            SourcesConfig sourcesConfig = new SourcesConfig();
            sourcesConfig.forPlatform(Platform.HACKERNEWS).setBaseUrl(mockWebServer.url("/").toString());
            sourcesConfig.forPlatform(Platform.HACKERNEWS).setRequestPause(Duration.ZERO);
            sources.add(new HackerNewsSource(WebClient.builder(), support, sourcesConfig));
        }

        @AfterEach
        void stopServer() throws IOException {
            mockWebServer.shutdown();
        }

        @Test
        @DisplayName("Opportunities claimed before the deadline are returned with the timed-out report")
        void shouldKeepOpportunitiesEmittedBeforeTimeout() {
            discoveryConfig.setSourceTimeout(Duration.ofSeconds(2));

            StepVerifier.create(discoveryService.discover("tester", DiscoveryProfile.empty(), null))
                    .assertNext(result -> {
                        SourceReport hn = result.getBySource().get("hackernews");
                        assertThat(hn.status()).isEqualTo(SourceReport.Status.TIMED_OUT);
                        assertThat(hn.count()).isEqualTo(1);
                        assertThat(result.getTotalFound()).isEqualTo(1);
                        assertThat(result.getOpportunities()).extracting(Opportunity::getId)
                                .containsExactly("hackernews_1");
                        assertThat(result.getTotalEstimatedValue()).isEqualTo(800L);
                    })
                    .expectComplete()
                    .verify(Duration.ofSeconds(10));

            assertThat(realCache.seen("hackernews", "1")).isTrue();
            assertThat(realCache.seen("hackernews", "2")).isFalse();
        }

        private MockResponse json(String body) {
            return new MockResponse().setBody(body).addHeader("Content-Type", "application/json");
        }
    }

    @Nested
    @DisplayName("Result shape")
    class ResultTests {

        @Test
        void shouldNotTouchCacheUntilSubscribed() {
            Mono<DiscoveryResult> pending = discoveryService.discover("tester", null, null);

            verifyNoInteractions(dedupCache);

            StepVerifier.create(pending).expectNextCount(1).verifyComplete();
            verify(dedupCache).evictExpired();
        }

        @Test
        void shouldExposeReadOnlyBreakdown() {
            sources.add(new FakeSource(Platform.GITHUB, Flux::empty));

            StepVerifier.create(discoveryService.discover("tester", null, null))
                    .assertNext(result -> assertThatThrownBy(
                            () -> result.getBySource().put("x", SourceReport.error("x", 0)))
                            .isInstanceOf(UnsupportedOperationException.class))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Source selection")
    class SelectionTests {

        @BeforeEach
        void registerSources() {
            sources.add(new FakeSource(Platform.GITHUB, () -> Flux.just(opportunity(Platform.GITHUB, "g", 1, 0))));
            FakeSource disabled = new FakeSource(Platform.LINKEDIN, Flux::empty);
            disabled.enabled = false;
            sources.add(disabled);
            sources.add(new FakeSource(Platform.REDDIT, () -> Flux.just(opportunity(Platform.REDDIT, "r", 2, 0))));
        }

        @Test
        void shouldRunEnabledSourcesInRegistrationOrderByDefault() {
            StepVerifier.create(discoveryService.discover("tester", null, List.of()))
                    .assertNext(result -> {
                        assertThat(result.getSourcesAttempted()).containsExactly("github", "reddit");
                        assertThat(result.getOpportunities()).extracting(Opportunity::getId)
                                .containsExactly("github_g", "reddit_r");
                    })
                    .verifyComplete();
        }

        @Test
        void shouldReportUnknownSourceAndMatchNamesCaseInsensitively() {
            StepVerifier.create(discoveryService.discover("tester", null, List.of("Reddit", "myspace", "REDDIT")))
                    .assertNext(result -> {
                        assertThat(result.getSourcesAttempted()).containsExactly("reddit", "myspace");
                        assertThat(result.getBySource().get("myspace").status())
                                .isEqualTo(SourceReport.Status.ERROR);
                        assertThat(result.getBySource().get("myspace").error())
                                .isEqualTo(DiscoveryService.UNKNOWN_SOURCE);
                        assertThat(result.getTotalFound()).isEqualTo(1);
                    })
                    .verifyComplete();
        }

        @Test
        void shouldRunDisabledSourceWhenExplicitlyRequested() {
            StepVerifier.create(discoveryService.discover("tester", null, List.of("linkedin")))
                    .assertNext(result -> assertThat(result.getBySource().get("linkedin").isOk()).isTrue())
                    .verifyComplete();
        }

        @Test
        void shouldSweepCacheAndRecordOutcomes() {
            StepVerifier.create(discoveryService.discover("tester", null, null))
                    .expectNextCount(1)
                    .verifyComplete();

            verify(dedupCache).evictExpired();
            verify(metrics).recordSourceOutcome(eq("github"), any(SourceReport.class));
            verify(metrics).recordSourceOutcome(eq("reddit"), any(SourceReport.class));
            verify(metrics).recordRun(anyInt(), anyLong(), eq(0));
        }
    }

    static class FakeSource implements OpportunitySource {
        private final Platform platform;
        private final Supplier<Flux<Opportunity>> results;
        boolean enabled = true;

        FakeSource(Platform platform, Supplier<Flux<Opportunity>> results) {
            this.platform = platform;
            this.results = results;
        }

        @Override
        public Platform getPlatform() {
            return platform;
        }

        @Override
        public Flux<Opportunity> fetch(DiscoveryProfile profile) {
            return results.get();
        }

        @Override
        public boolean isEnabled() {
            return enabled;
        }
    }
}
