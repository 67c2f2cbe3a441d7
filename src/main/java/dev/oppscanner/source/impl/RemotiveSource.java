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
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Remotive remote-jobs API. One search per profile keyword, or a single unfiltered request.
 */
@Slf4j
@Component
public class RemotiveSource extends AbstractOpportunitySource {

    static final String UNFILTERED = "";

    public RemotiveSource(WebClient.Builder webClientBuilder, SourceSupport support, SourcesConfig sourcesConfig) {
        super(Platform.REMOTIVE, webClientBuilder, support, sourcesConfig);
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://remotive.com";
    }

    @Override
    protected String defaultType() {
        return "remote_job";
    }

    @Override
    protected List<String> subFeeds(DiscoveryProfile profile) {
        List<String> keywords = usable(profile.getKeywords());
        if (!keywords.isEmpty()) {
            return keywords;
        }
        List<String> configured = settings().getFeeds();
        return configured == null || configured.isEmpty() ? List.of(UNFILTERED) : configured;
    }

    @Override
    protected Flux<RawListing> fetchListings(String search, DiscoveryProfile profile) {
        UriComponentsBuilder builder = uri("/api/remote-jobs")
                .queryParam("limit", settings().getMaxItems());
        if (!search.isBlank()) {
            builder.queryParam("search", search);
        }
        return timedGet(builder.encode().build().toUri(), JobsResponse.class)
                .flatMapMany(response -> listingsOf(response.getJobs(), this::toListing));
    }

    private RawListing toListing(Job job) {
        // Salary text goes first so the extractor sees it before any amount in the description
        String salary = job.getSalary() == null ? "" : job.getSalary();
        RawListing.RawListingBuilder listing = RawListing.builder()
                .nativeId(String.valueOf(job.getId()))
                .title(job.getTitle())
                .body(salary.isBlank() ? job.getDescription() : salary + " " + job.getDescription())
                .url(job.getUrl())
                .createdAt(job.getPublicationDate());
        if (job.getCompanyName() != null) {
            listing.extra("company", job.getCompanyName());
        }
        if (job.getCategory() != null) {
            listing.extra("category", job.getCategory());
        }
        return listing.build();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class JobsResponse {
        private List<Job> jobs;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Job {
        private long id;
        private String title;
        private String url;
        private String description;
        private String salary;
        private String category;
        @JsonProperty("company_name")
        private String companyName;
        @JsonProperty("publication_date")
        private String publicationDate;
    }
}
