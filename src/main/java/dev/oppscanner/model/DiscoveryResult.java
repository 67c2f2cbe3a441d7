package dev.oppscanner.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregate payload of one discovery call.
 * {@code success} only says the orchestration completed; source health lives in {@code bySource}.
 */
@Value
@Builder
public class DiscoveryResult {
    boolean success;
    String caller;
    List<Opportunity> opportunities;
    Map<String, SourceReport> bySource;
    int totalFound;
    long totalEstimatedValue;
    int highRelevanceCount;
    List<String> sourcesAttempted;
    Instant completedAt;
}
