package dev.oppscanner.source.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.oppscanner.config.SourcesConfig;
import dev.oppscanner.model.DiscoveryProfile;
import dev.oppscanner.model.Platform;
import dev.oppscanner.model.RawListing;
import dev.oppscanner.source.SourceSupport;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Hacker News Firebase API: a list of story ids, then one request per story.
 * Stories are fetched one at a time with a short pause; already-seen ids are not requested.
 */
@Slf4j
@Component
public class HackerNewsSource extends AbstractOpportunitySource {

    private static final List<String> TITLE_MARKERS = List.of("Show HN", "Ask HN", "Hiring", "Freelance");
    private static final Duration ITEM_PAUSE = Duration.ofMillis(100);

    public HackerNewsSource(WebClient.Builder webClientBuilder, SourceSupport support, SourcesConfig sourcesConfig) {
        super(Platform.HACKERNEWS, webClientBuilder, support, sourcesConfig);
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://hacker-news.firebaseio.com";
    }

    @Override
    protected List<String> defaultFeeds() {
        return List.of("topstories");
    }

    @Override
    protected String defaultType() {
        return "ask_hn";
    }

    @Override
    protected Flux<RawListing> fetchListings(String feed, DiscoveryProfile profile) {
        URI idsUri = uri("/v0/" + feed + ".json").build().toUri();
        int maxItems = settings().getMaxItems();

        return timedGet(idsUri, Long[].class)
                .flatMapMany(ids -> Flux.fromArray(ids).take(maxItems))
                .filter(id -> !support.getDedupCache().seen(getName(), String.valueOf(id)))
                .concatMap(id -> fetchItem(id).delaySubscription(ITEM_PAUSE));
    }

    private Mono<RawListing> fetchItem(Long id) {
        URI itemUri = uri("/v0/item/" + id + ".json").build().toUri();
        return timedGet(itemUri, Item.class)
                .map(this::toListing)
                .onErrorResume(e -> {
                    log.debug("Hacker News - item {} failed: {}", id, e.getMessage());
                    metrics.incrementFetchFailures(getName());
                    return Mono.empty();
                });
    }

    @Override
    protected boolean isRelevant(RawListing listing, DiscoveryProfile profile) {
        String title = listing.getTitle();
        return title != null && TITLE_MARKERS.stream().anyMatch(title::contains);
    }

    private RawListing toListing(Item item) {
        String title = item.getTitle() == null ? "" : item.getTitle();
        String type;
        if ("job".equals(item.getType()) || title.contains("Hiring")) {
            type = "job_posting";
        } else if (title.contains("Show HN")) {
            type = "show_hn";
        } else {
            type = "ask_hn";
        }
        return RawListing.builder()
                .nativeId(String.valueOf(item.getId()))
                .title(title)
                .body(item.getText())
                .url("https://news.ycombinator.com/item?id=" + item.getId())
                .type(type)
                .createdAt(item.getTime() > 0 ? Instant.ofEpochSecond(item.getTime()).toString() : null)
                .extra("author", item.getBy() == null ? "" : item.getBy())
                .build();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Item {
        private long id;
        private String type;
        private String by;
        private String title;
        private String text;
        private long time;
    }
}
