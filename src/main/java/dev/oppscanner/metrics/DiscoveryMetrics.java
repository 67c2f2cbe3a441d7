package dev.oppscanner.metrics;

import dev.oppscanner.model.SourceReport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Prometheus metrics for discovery runs.
 */
@Component
public class DiscoveryMetrics {

    private static final String TAG_SOURCE = "source";
    private static final String TAG_STATUS = "status";
    private final MeterRegistry registry;

    private final Counter runsCounter;
    private final Counter opportunitiesFoundCounter;

    // Timers (per source)
    private final ConcurrentHashMap<String, Timer> fetchTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger lastRunOpportunities = new AtomicInteger(0);
    private final AtomicLong lastRunEstimatedValue = new AtomicLong(0);
    private final AtomicInteger lastRunFailedSources = new AtomicInteger(0);

    public DiscoveryMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.runsCounter = Counter.builder("opportunity_scanner_runs_total")
                .description("Total discovery calls")
                .register(registry);

        this.opportunitiesFoundCounter = Counter.builder("opportunity_scanner_opportunities_found_total")
                .description("Total opportunities returned across all sources")
                .register(registry);

        Gauge.builder("opportunity_scanner_last_run_opportunities", lastRunOpportunities, AtomicInteger::get)
                .description("Opportunities found in last run")
                .register(registry);

        Gauge.builder("opportunity_scanner_last_run_estimated_value", lastRunEstimatedValue, AtomicLong::get)
                .description("Total estimated value found in last run")
                .register(registry);

        Gauge.builder("opportunity_scanner_last_run_failed_sources", lastRunFailedSources, AtomicInteger::get)
                .description("Sources that errored or timed out in last run")
                .register(registry);
    }

    /**
     * Get or create the HTTP latency timer for a source.
     */
    public Timer getFetchTimer(String source) {
        return fetchTimers.computeIfAbsent(source, name ->
                Timer.builder("opportunity_scanner_fetch_duration")
                        .description("Latency of HTTP requests to a source")
                        .tag(TAG_SOURCE, name)
                        .register(registry)
        );
    }

    public void recordFetchLatency(String source, long latencyMs) {
        getFetchTimer(source).record(Duration.ofMillis(latencyMs));
    }

    /**
     * A sub-request to a source failed (network, status, parse).
     */
    public void incrementFetchFailures(String source) {
        Counter.builder("opportunity_scanner_fetch_failures_total")
                .tag(TAG_SOURCE, source)
                .register(registry)
                .increment();
    }

    /**
     * A candidate was dropped by relevance, value or dedup filtering.
     */
    public void incrementFiltered(String source, String reason) {
        Counter.builder("opportunity_scanner_candidates_filtered_total")
                .tag(TAG_SOURCE, source)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementEmitted(String source) {
        Counter.builder("opportunity_scanner_opportunities_emitted_total")
                .tag(TAG_SOURCE, source)
                .register(registry)
                .increment();
    }

    /**
     * Record how one source finished within a discovery call.
     */
    public void recordSourceOutcome(String source, SourceReport report) {
        Counter.builder("opportunity_scanner_source_outcomes_total")
                .tag(TAG_SOURCE, source)
                .tag(TAG_STATUS, report.status().name())
                .register(registry)
                .increment();
    }

    public void recordRun(int opportunities, long estimatedValue, int failedSources) {
        runsCounter.increment();
        opportunitiesFoundCounter.increment(opportunities);
        lastRunOpportunities.set(opportunities);
        lastRunEstimatedValue.set(estimatedValue);
        lastRunFailedSources.set(failedSources);
    }
}
