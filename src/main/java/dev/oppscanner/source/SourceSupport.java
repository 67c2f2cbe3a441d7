package dev.oppscanner.source;

import dev.oppscanner.cache.DedupCache;
import dev.oppscanner.config.DiscoveryConfig;
import dev.oppscanner.metrics.DiscoveryMetrics;
import dev.oppscanner.service.BudgetExtractor;
import dev.oppscanner.service.RelevanceScorer;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Collaborators shared by every source adapter.
 */
@Getter
@Component
@RequiredArgsConstructor
public class SourceSupport {

    private final DiscoveryConfig discoveryConfig;
    private final DedupCache dedupCache;
    private final BudgetExtractor budgetExtractor;
    private final RelevanceScorer relevanceScorer;
    private final DiscoveryMetrics metrics;
    private final Clock clock;
}
