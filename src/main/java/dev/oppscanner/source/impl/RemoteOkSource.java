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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * RemoteOK public API. The response is a JSON array whose first element is a legal notice.
 */
@Slf4j
@Component
public class RemoteOkSource extends AbstractOpportunitySource {

    public RemoteOkSource(WebClient.Builder webClientBuilder, SourceSupport support, SourcesConfig sourcesConfig) {
        super(Platform.REMOTEOK, webClientBuilder, support, sourcesConfig);
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://remoteok.com";
    }

    @Override
    protected String defaultType() {
        return "remote_job";
    }

    @Override
    protected Flux<RawListing> fetchListings(String feed, DiscoveryProfile profile) {
        URI uri = uri("/api").build().toUri();
        return timedGet(uri, Job[].class)
                .flatMapMany(jobs -> jobs.length <= 1
                        ? Flux.<RawListing>empty()
                        : listingsOf(Arrays.asList(jobs).subList(1, jobs.length), this::toListing));
    }

    /**
     * With a profile, keep only jobs whose tags or position mention one of its skills or keywords.
     */
    @Override
    protected boolean isRelevant(RawListing listing, DiscoveryProfile profile) {
        if (!profile.hasInterests()) {
            return true;
        }
        List<String> interests = new ArrayList<>(usable(profile.getSkills()));
        interests.addAll(usable(profile.getKeywords()));
        String haystack = listing.getTitle() + " " + listing.getExtras().getOrDefault("tags", "");
        return containsAny(haystack, interests);
    }

    private RawListing toListing(Job job) {
        RawListing.RawListingBuilder listing = RawListing.builder()
                .nativeId(job.getId())
                .title(job.getPosition())
                .body(job.getDescription())
                .url(job.getUrl())
                .createdAt(job.getDate())
                .platformValue(salaryMean(job));
        if (job.getCompany() != null) {
            listing.extra("company", job.getCompany());
        }
        if (job.getTags() != null && !job.getTags().isEmpty()) {
            listing.extra("tags", String.join(",", job.getTags()));
        }
        return listing.build();
    }

    private static Integer salaryMean(Job job) {
        Integer min = positive(job.getSalaryMin());
        Integer max = positive(job.getSalaryMax());
        if (min != null && max != null) {
            return (int) (((long) min + max) / 2);
        }
        return min != null ? min : max;
    }

    private static Integer positive(Integer value) {
        return value != null && value > 0 ? value : null;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Job {
        private String id;
        private String position;
        private String company;
        private String description;
        private String url;
        private String date;
        private List<String> tags;
        @JsonProperty("salary_min")
        private Integer salaryMin;
        @JsonProperty("salary_max")
        private Integer salaryMax;
    }
}
