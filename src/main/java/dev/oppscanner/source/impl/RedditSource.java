package dev.oppscanner.source.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
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

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reddit public JSON listings, newest posts of each configured subreddit.
 */
@Slf4j
@Component
public class RedditSource extends AbstractOpportunitySource {

    static final int MAX_SUBREDDITS = 10;
    private static final int PAGE_SIZE = 25;

    static final List<String> HIRING_KEYWORDS = List.of(
            "hiring", "looking for", "need help", "freelancer", "contract", "gig", "opportunity");

    public RedditSource(WebClient.Builder webClientBuilder, SourceSupport support, SourcesConfig sourcesConfig) {
        super(Platform.REDDIT, webClientBuilder, support, sourcesConfig);
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://www.reddit.com";
    }

    @Override
    protected List<String> defaultFeeds() {
        return List.of("forhire", "freelance", "startups", "entrepreneur", "smallbusiness",
                "marketing", "webdev", "saas", "microsaas", "indiehackers");
    }

    @Override
    protected List<String> subFeeds(DiscoveryProfile profile) {
        return super.subFeeds(profile).stream().limit(MAX_SUBREDDITS).collect(Collectors.toList());
    }

    @Override
    protected String defaultType() {
        return "help_request";
    }

    @Override
    protected Flux<RawListing> fetchListings(String subreddit, DiscoveryProfile profile) {
        URI uri = uri("/r/" + subreddit + "/new.json")
                .queryParam("limit", PAGE_SIZE)
                .build()
                .toUri();
        return timedGet(uri, Listing.class)
                .flatMapMany(listing -> listing.getData() == null
                        ? Flux.<RawListing>empty()
                        : listingsOf(listing.getData().getChildren(), child -> toListing(child.getData(), subreddit)));
    }

    @Override
    protected boolean isRelevant(RawListing listing, DiscoveryProfile profile) {
        return containsAny(listing.getTitle(), HIRING_KEYWORDS) || containsAny(listing.getBody(), HIRING_KEYWORDS);
    }

    private RawListing toListing(Post post, String subreddit) {
        return RawListing.builder()
                .nativeId(post.getId())
                .title(post.getTitle())
                .body(post.getSelftext())
                .url("https://reddit.com" + (post.getPermalink() == null ? "" : post.getPermalink()))
                .createdAt(post.getCreatedUtc() > 0
                        ? Instant.ofEpochSecond((long) post.getCreatedUtc()).toString()
                        : null)
                .extra("subreddit", subreddit)
                .build();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Listing {
        private ListingData data;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ListingData {
        private List<Child> children;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Child {
        private Post data;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Post {
        private String id;
        private String title;
        private String selftext;
        private String permalink;
        @JsonProperty("created_utc")
        private double createdUtc;
    }
}
