package dev.oppscanner.source.impl;

import dev.oppscanner.config.SourceSettings;
import dev.oppscanner.config.SourcesConfig;
import dev.oppscanner.metrics.DiscoveryMetrics;
import dev.oppscanner.model.DiscoveryProfile;
import dev.oppscanner.model.Opportunity;
import dev.oppscanner.model.Platform;
import dev.oppscanner.model.RawListing;
import dev.oppscanner.model.ValueOrigin;
import dev.oppscanner.service.BudgetExtractor;
import dev.oppscanner.source.OpportunitySource;
import dev.oppscanner.source.SourceSupport;
import dev.oppscanner.source.parser.ListingParser;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URI;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Shared pipeline for HTTP-backed sources:
 * sub-feeds (sequential, paused) -> raw listings -> relevance filter -> normalize
 * -> value and match-score thresholds -> dedup -> Opportunity.
 * <p>
 * Failures never escape {@link #fetch}: a failing sub-feed contributes nothing,
 * a malformed candidate is skipped.
 */
@Slf4j
public abstract class AbstractOpportunitySource implements OpportunitySource {

    protected static final int DESCRIPTION_LIMIT = 500;

    private static final String ACCEPT =
            "application/json, application/rss+xml, application/xml;q=0.9, text/html;q=0.8, */*;q=0.5";

    protected final WebClient webClient;
    protected final SourceSupport support;
    protected final DiscoveryMetrics metrics;
    private final Platform platform;
    private final SourcesConfig sourcesConfig;

    protected AbstractOpportunitySource(Platform platform, WebClient.Builder webClientBuilder,
                                        SourceSupport support, SourcesConfig sourcesConfig) {
        this.platform = platform;
        this.support = support;
        this.metrics = support.getMetrics();
        this.sourcesConfig = sourcesConfig;

        Duration requestTimeout = support.getDiscoveryConfig().getHttp().getRequestTimeout();
        HttpClient httpClient = HttpClient.create()
                .compress(true)
                .followRedirect(true)
                .responseTimeout(requestTimeout)
                .httpResponseDecoder(spec -> spec.maxHeaderSize(32768));

        int maxInMemorySize = support.getDiscoveryConfig().getHttp().getMaxInMemorySize();
        WebClient.Builder builder = webClientBuilder
                .codecs(config -> config.defaultCodecs().maxInMemorySize(maxInMemorySize))
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader(HttpHeaders.USER_AGENT, support.getDiscoveryConfig().getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT, ACCEPT);

        SourceSettings settings = settings();
        if (settings.hasToken()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + settings.getToken());
            log.info("{}: using configured credential", platform.getDisplayName());
        } else {
            log.debug("{}: no credential configured, running unauthenticated", platform.getDisplayName());
        }
        this.webClient = builder.build();
    }

    @Override
    public final Platform getPlatform() {
        return platform;
    }

    @Override
    public boolean isEnabled() {
        return settings().isEnabled();
    }

    protected SourceSettings settings() {
        return sourcesConfig.forPlatform(platform);
    }

    /**
     * Endpoint root: the configured base-url, or the platform's public one.
     */
    protected String baseUrl() {
        String configured = settings().getBaseUrl();
        String base = configured != null && !configured.isBlank() ? configured : defaultBaseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    protected abstract String defaultBaseUrl();

    /**
     * Sub-feeds queried one after another (queries, subreddits, feed urls, cities).
     */
    protected List<String> subFeeds(DiscoveryProfile profile) {
        List<String> configured = settings().getFeeds();
        return configured == null || configured.isEmpty() ? defaultFeeds() : configured;
    }

    protected List<String> defaultFeeds() {
        return List.of("default");
    }

    /**
     * Fetch and parse one sub-feed into raw listings.
     */
    protected abstract Flux<RawListing> fetchListings(String feed, DiscoveryProfile profile);

    /**
     * Platform-specific relevance rule. Listings failing it are dropped silently.
     */
    protected boolean isRelevant(RawListing listing, DiscoveryProfile profile) {
        return true;
    }

    protected abstract String defaultType();

    @Override
    public Flux<Opportunity> fetch(DiscoveryProfile profile) {
        DiscoveryProfile effective = profile != null ? profile : DiscoveryProfile.empty();
        return Flux.defer(() -> fetchFeeds(effective))
                .doOnNext(opportunity -> metrics.incrementEmitted(getName()))
                .onErrorResume(e -> {
                    log.error("{} - fetch aborted: {}", platform.getDisplayName(), e.getMessage(), e);
                    return Flux.empty();
                });
    }

    private Flux<Opportunity> fetchFeeds(DiscoveryProfile profile) {
        List<String> feeds = subFeeds(profile);
        SourceSettings settings = settings();
        log.info("Fetching opportunities from {} ({} sub-feeds)", platform.getDisplayName(), feeds.size());

        return Flux.fromIterable(feeds)
                .index()
                .concatMap(indexed -> {
                    String feed = indexed.getT2();
                    Flux<RawListing> listings = Flux.defer(() -> fetchListings(feed, profile))
                            .take(settings.getMaxItems())
                            .onErrorResume(e -> {
                                log.warn("{} - sub-feed '{}' failed: {}", platform.getDisplayName(), feed,
                                        e.getMessage());
                                metrics.incrementFetchFailures(getName());
                                return Flux.empty();
                            });
                    return indexed.getT1() == 0 ? listings : listings.delaySubscription(settings.getRequestPause());
                })
                .concatMap(listing -> Mono.justOrEmpty(accept(listing, profile)));
    }

    /**
     * Non-blank entries, trimmed.
     */
    protected static List<String> usable(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .toList();
    }

    /**
     * Filter, normalize and dedup one listing.
     *
     * @return the opportunity, or null when the listing is dropped
     */
    protected Opportunity accept(RawListing listing, DiscoveryProfile profile) {
        try {
            if (listing.getNativeId() == null || listing.getNativeId().isBlank()
                    || listing.getTitle() == null || listing.getTitle().isBlank()) {
                return reject(listing, "malformed");
            }
            if (!isRelevant(listing, profile)) {
                return reject(listing, "relevance");
            }

            String title = listing.getTitle().trim();
            String plainBody = stripHtml(listing.getBody());
            int value;
            ValueOrigin origin;
            if (listing.getPlatformValue() != null) {
                value = Math.max(0, listing.getPlatformValue());
                origin = ValueOrigin.PLATFORM;
            } else {
                BudgetExtractor.Estimate estimate = support.getBudgetExtractor().estimate(title + " " + plainBody);
                value = estimate.amount();
                origin = estimate.origin();
            }
            if (value < settings().getMinValue()) {
                return reject(listing, "min_value");
            }

            String description = truncate(plainBody, DESCRIPTION_LIMIT);
            int matchScore = support.getRelevanceScorer().score(title, description, value, profile);
            if (matchScore < settings().getMinMatchScore()) {
                return reject(listing, "match_score");
            }

            if (!support.getDedupCache().claim(getName(), listing.getNativeId())) {
                return reject(listing, "duplicate");
            }

            return Opportunity.builder()
                    .source(platform)
                    .nativeId(listing.getNativeId())
                    .title(title)
                    .description(description)
                    .url(listing.getUrl())
                    .type(listing.getType() != null ? listing.getType() : defaultType())
                    .estimatedValue(value)
                    .valueOrigin(origin)
                    .matchScore(matchScore)
                    .createdAt(listing.getCreatedAt() != null && !listing.getCreatedAt().isBlank()
                            ? listing.getCreatedAt()
                            : nowIso())
                    .extras(listing.getExtras())
                    .build();
        } catch (RuntimeException e) {
            log.warn("{} - skipping malformed candidate '{}': {}", platform.getDisplayName(),
                    listing.getNativeId(), e.getMessage());
            metrics.incrementFiltered(getName(), "error");
            return null;
        }
    }

    private Opportunity reject(RawListing listing, String reason) {
        log.debug("{} - dropped '{}' ({})", platform.getDisplayName(), listing.getTitle(), reason);
        metrics.incrementFiltered(getName(), reason);
        return null;
    }

    /**
     * Map response items to listings one by one; an item that fails to map is skipped.
     */
    protected <T> Flux<RawListing> listingsOf(Collection<T> items, Function<T, RawListing> mapper) {
        if (items == null || items.isEmpty()) {
            return Flux.empty();
        }
        return Flux.fromIterable(items)
                .concatMap(item -> {
                    try {
                        return Mono.justOrEmpty(mapper.apply(item));
                    } catch (RuntimeException e) {
                        log.debug("{} - unparseable item skipped: {}", platform.getDisplayName(), e.getMessage());
                        metrics.incrementFiltered(getName(), "unparseable");
                        return Mono.empty();
                    }
                });
    }

    /**
     * Execute a timed GET request, decoding the body as JSON.
     */
    protected <T> Mono<T> timedGet(URI uri, Class<T> responseType) {
        long start = System.currentTimeMillis();
        return webClient.get()
                .uri(uri)
                .retrieve()
                .bodyToMono(responseType)
                .doOnTerminate(() -> metrics.recordFetchLatency(getName(), System.currentTimeMillis() - start));
    }

    /**
     * Execute a timed GET request returning the raw body (RSS, HTML).
     */
    protected Mono<String> timedGetBody(URI uri) {
        return timedGet(uri, String.class);
    }

    /**
     * GET a page or feed and hand the body to its parser.
     */
    protected Flux<RawListing> fetchAndParse(URI uri, ListingParser parser) {
        return timedGetBody(uri)
                .flatMapMany(body -> Flux.fromIterable(parser.parse(body)));
    }

    protected UriComponentsBuilder uri(String path) {
        return UriComponentsBuilder.fromUriString(baseUrl() + path);
    }

    protected static boolean containsAny(String text, List<String> keywords) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(k -> lower.contains(k.toLowerCase(Locale.ROOT)));
    }

    /**
     * Strip HTML tags from text.
     */
    protected String stripHtml(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text();
    }

    protected static String truncate(String text, int limit) {
        if (text == null) {
            return "";
        }
        return text.length() <= limit ? text : text.substring(0, limit);
    }

    protected String nowIso() {
        return support.getClock().instant().toString();
    }
}
