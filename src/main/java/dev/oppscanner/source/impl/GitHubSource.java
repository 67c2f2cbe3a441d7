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
import java.util.List;
import java.util.stream.Collectors;

/**
 * GitHub issue search. One query per configured label search; a token raises the rate allowance.
 */
@Slf4j
@Component
public class GitHubSource extends AbstractOpportunitySource {

    private static final String OPEN_ISSUE_QUALIFIERS = " is:open is:issue";
    private static final int MAX_PER_PAGE = 100;

    public GitHubSource(WebClient.Builder webClientBuilder, SourceSupport support, SourcesConfig sourcesConfig) {
        super(Platform.GITHUB, webClientBuilder, support, sourcesConfig);
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://api.github.com";
    }

    @Override
    protected List<String> defaultFeeds() {
        return List.of("label:bounty", "label:\"help wanted\"");
    }

    @Override
    protected String defaultType() {
        return "open_source_contribution";
    }

    @Override
    protected Flux<RawListing> fetchListings(String query, DiscoveryProfile profile) {
        String q = query.contains("is:issue") ? query : query + OPEN_ISSUE_QUALIFIERS;
        URI uri = uri("/search/issues")
                .queryParam("q", q)
                .queryParam("sort", "created")
                .queryParam("order", "desc")
                .queryParam("per_page", Math.min(settings().getMaxItems(), MAX_PER_PAGE))
                .encode()
                .build()
                .toUri();

        return timedGet(uri, SearchResponse.class)
                .flatMapMany(response -> listingsOf(response.getItems(), this::toListing));
    }

    private RawListing toListing(Issue issue) {
        List<String> labels = issue.getLabels() == null ? List.of()
                : issue.getLabels().stream().map(Label::getName).collect(Collectors.toList());
        boolean bounty = labels.stream().anyMatch(l -> l != null && l.toLowerCase().contains("bounty"));

        RawListing.RawListingBuilder listing = RawListing.builder()
                .nativeId(String.valueOf(issue.getId()))
                .title(issue.getTitle())
                .body(issue.getBody())
                .url(issue.getHtmlUrl())
                .type(bounty ? "bounty" : defaultType())
                .createdAt(issue.getCreatedAt());
        if (!labels.isEmpty()) {
            listing.extra("labels", String.join(",", labels));
        }
        String repository = repositoryName(issue.getRepositoryUrl());
        if (repository != null) {
            listing.extra("repository", repository);
        }
        return listing.build();
    }

    private String repositoryName(String repositoryUrl) {
        if (repositoryUrl == null) {
            return null;
        }
        int idx = repositoryUrl.indexOf("/repos/");
        return idx >= 0 ? repositoryUrl.substring(idx + "/repos/".length()) : null;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SearchResponse {
        private List<Issue> items;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Issue {
        private long id;
        private String title;
        private String body;
        @JsonProperty("html_url")
        private String htmlUrl;
        @JsonProperty("created_at")
        private String createdAt;
        @JsonProperty("repository_url")
        private String repositoryUrl;
        private List<Label> labels;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Label {
        private String name;
    }
}
