package dev.oppscanner.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What the caller is looking for. Used by query-based sources and by relevance scoring.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DiscoveryProfile {
    private String name;

    @Builder.Default
    private List<String> skills = new ArrayList<>();

    @Builder.Default
    private List<String> kits = new ArrayList<>();

    // Search terms for sources that accept a query
    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    @JsonProperty("company_type")
    @JsonAlias("companyType")
    private String companyType;

    public static DiscoveryProfile empty() {
        return new DiscoveryProfile();
    }

    @JsonIgnore
    public boolean hasInterests() {
        return !(isNullOrEmpty(skills) && isNullOrEmpty(keywords));
    }

    private static boolean isNullOrEmpty(List<String> list) {
        return list == null || list.isEmpty();
    }
}
