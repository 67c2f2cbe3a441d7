package dev.oppscanner.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Normalized, immutable record of one discovered opportunity.
 */
@Value
public class Opportunity {
    String id;
    Platform source;
    String nativeId;
    String title;
    String description;
    String url;
    String type; // bounty, freelance_gig, remote_job, ...

    int estimatedValue;
    ValueOrigin valueOrigin;
    int matchScore;

    String createdAt; // ISO-8601

    // Advisory extras (company, subreddit, category, ...)
    Map<String, String> extras;

    @Builder
    private Opportunity(Platform source, String nativeId, String title, String description, String url,
                        String type, int estimatedValue, ValueOrigin valueOrigin, int matchScore,
                        String createdAt, Map<String, String> extras) {
        this.id = source != null && nativeId != null ? composeId(source, nativeId) : null;
        this.source = source;
        this.nativeId = nativeId;
        this.title = title;
        this.description = description;
        this.url = url;
        this.type = type;
        this.estimatedValue = Math.max(0, estimatedValue);
        this.valueOrigin = valueOrigin == null ? ValueOrigin.DEFAULT : valueOrigin;
        this.matchScore = matchScore;
        this.createdAt = createdAt;
        this.extras = extras == null ? Map.of() : Map.copyOf(extras);
    }

    public static String composeId(Platform source, String nativeId) {
        return source.getKey() + "_" + nativeId;
    }
}
