package dev.oppscanner.service;

import dev.oppscanner.cache.DedupCache;
import dev.oppscanner.config.DiscoveryConfig;
import dev.oppscanner.metrics.DiscoveryMetrics;
import dev.oppscanner.model.DiscoveryProfile;
import dev.oppscanner.model.DiscoveryResult;
import dev.oppscanner.model.Opportunity;
import dev.oppscanner.model.SourceReport;
import dev.oppscanner.source.OpportunitySource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Runs the selected sources concurrently and folds their outcomes into one result.
 * A failing or slow source is reported in {@code bySource} and never affects its siblings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiscoveryService {

    private static final String SEPARATOR = "========================================";
    static final String UNKNOWN_SOURCE = "Unknown source";

    private final List<OpportunitySource> sources;
    private final DedupCache dedupCache;
    private final DiscoveryConfig discoveryConfig;
    private final DiscoveryMetrics metrics;
    private final Clock clock;

    /**
     * Run one discovery call.
     *
     * @param caller    who asked; echoed in the result
     * @param profile   interests used for queries and scoring, may be null
     * @param requested source names to run; null or empty runs every enabled source
     */
    public Mono<DiscoveryResult> discover(String caller, DiscoveryProfile profile, List<String> requested) {
        return Mono.defer(() -> {
            DiscoveryProfile effective = profile != null ? profile : DiscoveryProfile.empty();
            Map<String, OpportunitySource> selected = select(requested);
            Duration deadline = discoveryConfig.effectiveSourceTimeout();

            int evicted = dedupCache.evictExpired();
            log.info(SEPARATOR);
            log.info("Discovery for '{}' across {} sources (deadline {} ms, {} expired cache entries evicted)",
                    caller, selected.size(), deadline.toMillis(), evicted);
            log.info(SEPARATOR);

            return Flux.fromIterable(selected.entrySet())
                    .flatMapSequential(entry -> runSource(entry.getKey(), entry.getValue(), effective, deadline)
                            .map(report -> Tuples.of(entry.getKey(), report)))
                    .collectList()
                    .map(reports -> aggregate(caller, reports));
        });
    }

    /**
     * Every source registered, in registration order.
     */
    public List<OpportunitySource> getSources() {
        return sources;
    }

    /**
     * Resolve requested names, keeping request order. Unknown names map to null.
     */
    Map<String, OpportunitySource> select(List<String> requested) {
        Map<String, OpportunitySource> selected = new LinkedHashMap<>();
        if (requested == null || requested.isEmpty()) {
            sources.stream()
                    .filter(OpportunitySource::isEnabled)
                    .forEach(source -> selected.put(source.getName(), source));
            return selected;
        }
        for (String name : requested) {
            if (name == null || name.isBlank()) {
                continue;
            }
            String key = name.trim().toLowerCase(Locale.ROOT);
            OpportunitySource match = sources.stream()
                    .filter(source -> source.getName().equalsIgnoreCase(key))
                    .findFirst()
                    .orElse(null);
            selected.putIfAbsent(key, match);
        }
        return selected;
    }

    private Mono<SourceReport> runSource(String name, OpportunitySource source, DiscoveryProfile profile,
                                         Duration deadline) {
        if (source == null) {
            log.warn("Requested source '{}' is not registered", name);
            return Mono.just(SourceReport.error(UNKNOWN_SOURCE, 0));
        }
        long start = System.nanoTime();
        // Opportunities already claimed in the dedup cache must reach the caller even if the deadline hits
        List<Opportunity> received = Collections.synchronizedList(new ArrayList<>());
        return Flux.defer(() -> source.fetch(profile))
                .doOnNext(received::add)
                .then(Mono.fromSupplier(() -> SourceReport.ok(snapshot(received), elapsedMs(start))))
                .timeout(deadline)
                .onErrorResume(TimeoutException.class, e -> {
                    List<Opportunity> partial = snapshot(received);
                    log.warn("{} timed out after {} ms, keeping {} opportunities", name, deadline.toMillis(),
                            partial.size());
                    return Mono.just(SourceReport.timedOut(partial, deadline.toMillis()));
                })
                .onErrorResume(e -> {
                    log.warn("{} failed: {}", name, e.getMessage());
                    return Mono.just(SourceReport.error(errorMessage(e), elapsedMs(start)));
                })
                .doOnNext(report -> metrics.recordSourceOutcome(name, report));
    }

    private DiscoveryResult aggregate(String caller, List<Tuple2<String, SourceReport>> reports) {
        Map<String, SourceReport> bySource = new LinkedHashMap<>();
        List<Opportunity> opportunities = new ArrayList<>();
        List<String> attempted = new ArrayList<>();
        for (Tuple2<String, SourceReport> entry : reports) {
            bySource.put(entry.getT1(), entry.getT2());
            attempted.add(entry.getT1());
            opportunities.addAll(entry.getT2().opportunities());
        }

        long totalValue = opportunities.stream().mapToLong(Opportunity::getEstimatedValue).sum();
        int threshold = discoveryConfig.getHighRelevanceThreshold();
        int highRelevance = (int) opportunities.stream().filter(o -> o.getMatchScore() >= threshold).count();
        int failed = (int) bySource.values().stream().filter(report -> !report.isOk()).count();

        metrics.recordRun(opportunities.size(), totalValue, failed);
        logSummary(bySource, opportunities.size(), totalValue);

        return DiscoveryResult.builder()
                .success(true)
                .caller(caller)
                .opportunities(List.copyOf(opportunities))
                .bySource(Collections.unmodifiableMap(bySource))
                .totalFound(opportunities.size())
                .totalEstimatedValue(totalValue)
                .highRelevanceCount(highRelevance)
                .sourcesAttempted(List.copyOf(attempted))
                .completedAt(clock.instant())
                .build();
    }

    private void logSummary(Map<String, SourceReport> bySource, int total, long totalValue) {
        log.info(SEPARATOR);
        bySource.forEach((name, report) -> {
            if (report.isOk()) {
                log.info("  {}: {} opportunities ({} ms)", name, report.count(), report.durationMs());
            } else {
                log.info("  {}: {} - {}", name, report.status(), report.error());
            }
        });
        log.info("DISCOVERY SUMMARY: {} opportunities, estimated value ${}", total, totalValue);
        log.info(SEPARATOR);
    }

    private static List<Opportunity> snapshot(List<Opportunity> received) {
        synchronized (received) {
            return List.copyOf(received);
        }
    }

    private static String errorMessage(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
