package dev.oppscanner.source.impl;

import dev.oppscanner.config.SourcesConfig;
import dev.oppscanner.model.DiscoveryProfile;
import dev.oppscanner.model.Platform;
import dev.oppscanner.model.RawListing;
import dev.oppscanner.source.SourceSupport;
import dev.oppscanner.source.parser.IndieHackersFeedParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Indie Hackers feed page, keeping posts that ask for collaborators.
 */
@Slf4j
@Component
public class IndieHackersSource extends AbstractOpportunitySource {

    static final List<String> COLLABORATION_KEYWORDS = List.of(
            "looking for", "need help", "co-founder", "partner", "collaborate");

    public IndieHackersSource(WebClient.Builder webClientBuilder, SourceSupport support,
                              SourcesConfig sourcesConfig) {
        super(Platform.INDIEHACKERS, webClientBuilder, support, sourcesConfig);
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://www.indiehackers.com";
    }

    @Override
    protected String defaultType() {
        return "collaboration";
    }

    @Override
    protected Flux<RawListing> fetchListings(String feed, DiscoveryProfile profile) {
        return fetchAndParse(uri("/feed").build().toUri(), new IndieHackersFeedParser(baseUrl()));
    }

    @Override
    protected boolean isRelevant(RawListing listing, DiscoveryProfile profile) {
        return containsAny(listing.getTitle() + " " + listing.getBody(), COLLABORATION_KEYWORDS);
    }
}
