package dev.oppscanner.source.impl;

import dev.oppscanner.config.SourcesConfig;
import dev.oppscanner.model.DiscoveryProfile;
import dev.oppscanner.model.Platform;
import dev.oppscanner.model.RawListing;
import dev.oppscanner.source.SourceSupport;
import dev.oppscanner.source.parser.RssListingParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.net.URI;
import java.util.List;

/**
 * Upwork public job RSS. The query comes from the profile's company type, else its first keyword.
 */
@Slf4j
@Component
public class UpworkSource extends AbstractOpportunitySource {

    static final String FALLBACK_QUERY = "general";

    private final RssListingParser parser = new RssListingParser(defaultType());

    public UpworkSource(WebClient.Builder webClientBuilder, SourceSupport support, SourcesConfig sourcesConfig) {
        super(Platform.UPWORK, webClientBuilder, support, sourcesConfig);
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://www.upwork.com";
    }

    @Override
    protected String defaultType() {
        return "freelance_gig";
    }

    @Override
    protected List<String> subFeeds(DiscoveryProfile profile) {
        return List.of(query(profile));
    }

    @Override
    protected Flux<RawListing> fetchListings(String query, DiscoveryProfile profile) {
        URI uri = uri("/ab/feed/jobs/rss")
                .queryParam("q", query)
                .queryParam("sort", "recency")
                .encode()
                .build()
                .toUri();
        return fetchAndParse(uri, parser);
    }

    static String query(DiscoveryProfile profile) {
        if (profile.getCompanyType() != null && !profile.getCompanyType().isBlank()) {
            return profile.getCompanyType().trim();
        }
        List<String> keywords = usable(profile.getKeywords());
        return keywords.isEmpty() ? FALLBACK_QUERY : keywords.get(0);
    }
}
