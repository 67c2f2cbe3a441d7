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

/**
 * Stack Exchange featured questions, i.e. questions with an open bounty.
 * The bounty amount is the opportunity value.
 */
@Slf4j
@Component
public class StackOverflowSource extends AbstractOpportunitySource {

    static final int MIN_BOUNTY = 50;

    public StackOverflowSource(WebClient.Builder webClientBuilder, SourceSupport support,
                               SourcesConfig sourcesConfig) {
        super(Platform.STACKOVERFLOW, webClientBuilder, support, sourcesConfig);
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://api.stackexchange.com";
    }

    @Override
    protected String defaultType() {
        return "bounty";
    }

    @Override
    protected Flux<RawListing> fetchListings(String feed, DiscoveryProfile profile) {
        URI uri = uri("/2.3/questions/featured")
                .queryParam("site", "stackoverflow")
                .queryParam("order", "desc")
                .queryParam("sort", "creation")
                .queryParam("filter", "withbody")
                .queryParam("pagesize", settings().getMaxItems())
                .build()
                .toUri();
        return timedGet(uri, QuestionsResponse.class)
                .flatMapMany(response -> listingsOf(response.getItems(), this::toListing));
    }

    @Override
    protected boolean isRelevant(RawListing listing, DiscoveryProfile profile) {
        return listing.getPlatformValue() != null && listing.getPlatformValue() >= MIN_BOUNTY;
    }

    private RawListing toListing(Question question) {
        RawListing.RawListingBuilder listing = RawListing.builder()
                .nativeId(String.valueOf(question.getQuestionId()))
                .title(question.getTitle())
                .body(question.getBody())
                .url(question.getLink())
                .platformValue(question.getBountyAmount())
                .createdAt(question.getCreationDate() > 0
                        ? Instant.ofEpochSecond(question.getCreationDate()).toString()
                        : null);
        if (question.getTags() != null && !question.getTags().isEmpty()) {
            listing.extra("tags", String.join(",", question.getTags()));
        }
        return listing.build();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class QuestionsResponse {
        private List<Question> items;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Question {
        @JsonProperty("question_id")
        private long questionId;
        private String title;
        private String body;
        private String link;
        private List<String> tags;
        @JsonProperty("bounty_amount")
        private Integer bountyAmount;
        @JsonProperty("creation_date")
        private long creationDate;
    }
}
