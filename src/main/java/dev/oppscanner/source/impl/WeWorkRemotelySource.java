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
 * We Work Remotely category RSS feeds. Titles read "Company: Role".
 */
@Slf4j
@Component
public class WeWorkRemotelySource extends AbstractOpportunitySource {

    private final RssListingParser parser = new RssListingParser(defaultType());

    public WeWorkRemotelySource(WebClient.Builder webClientBuilder, SourceSupport support,
                                SourcesConfig sourcesConfig) {
        super(Platform.WEWORKREMOTELY, webClientBuilder, support, sourcesConfig);
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://weworkremotely.com";
    }

    @Override
    protected List<String> defaultFeeds() {
        return List.of(
                "/categories/remote-programming-jobs.rss",
                "/categories/remote-devops-sysadmin-jobs.rss",
                "/categories/remote-design-jobs.rss");
    }

    @Override
    protected String defaultType() {
        return "remote_job";
    }

    /**
     * Feeds may be absolute urls or paths under the base url.
     */
    @Override
    protected Flux<RawListing> fetchListings(String feed, DiscoveryProfile profile) {
        URI uri = feed.startsWith("http") ? URI.create(feed) : uri(feed).build().toUri();
        return fetchAndParse(uri, parser).map(WeWorkRemotelySource::withCompany);
    }

    static RawListing withCompany(RawListing listing) {
        String title = listing.getTitle();
        int colon = title == null ? -1 : title.indexOf(':');
        if (colon <= 0 || colon == title.length() - 1) {
            return listing;
        }
        return listing.toBuilder()
                .extra("company", title.substring(0, colon).trim())
                .build();
    }
}
