package dev.oppscanner.source.impl;

import dev.oppscanner.config.SourcesConfig;
import dev.oppscanner.model.DiscoveryProfile;
import dev.oppscanner.model.Platform;
import dev.oppscanner.model.RawListing;
import dev.oppscanner.source.SourceSupport;
import dev.oppscanner.source.parser.CraigslistSearchParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.net.URI;
import java.util.List;

/**
 * Craigslist computer gigs ({@code cpg}) search, one request per configured city.
 * The base url is a template where {@code {city}} is replaced by the sub-feed.
 */
@Slf4j
@Component
public class CraigslistSource extends AbstractOpportunitySource {

    static final String CITY_PLACEHOLDER = "{city}";

    public CraigslistSource(WebClient.Builder webClientBuilder, SourceSupport support,
                            SourcesConfig sourcesConfig) {
        super(Platform.CRAIGSLIST, webClientBuilder, support, sourcesConfig);
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://" + CITY_PLACEHOLDER + ".craigslist.org";
    }

    @Override
    protected List<String> defaultFeeds() {
        return List.of("newyork", "sfbay", "losangeles", "chicago", "seattle");
    }

    @Override
    protected String defaultType() {
        return "local_gig";
    }

    @Override
    protected Flux<RawListing> fetchListings(String city, DiscoveryProfile profile) {
        URI uri = URI.create(baseUrl().replace(CITY_PLACEHOLDER, city) + "/search/cpg");
        return fetchAndParse(uri, new CraigslistSearchParser(city));
    }
}
