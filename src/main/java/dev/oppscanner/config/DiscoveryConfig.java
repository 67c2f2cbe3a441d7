package dev.oppscanner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Engine-wide settings.
 * Loaded from application.yml under 'discovery' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "discovery")
public class DiscoveryConfig {

    private String userAgent = "OpportunityScanner/1.0 (+https://github.com/oppscanner)";

    // Deadline per source within one discovery call
    private Duration sourceTimeout = Duration.ofSeconds(60);

    // Deadline for the whole fan-out
    private Duration batchTimeout = Duration.ofSeconds(120);

    private int highRelevanceThreshold = 80;

    private Http http = new Http();
    private Cache cache = new Cache();

    @Data
    public static class Http {
        private Duration requestTimeout = Duration.ofSeconds(12);
        private int maxInMemorySize = 10 * 1024 * 1024;
    }

    @Data
    public static class Cache {
        private Duration ttl = Duration.ofHours(24);
        private int maxEntries = 50_000;
    }

    /**
     * Effective deadline for one source: the tighter of the per-source and batch deadlines.
     */
    public Duration effectiveSourceTimeout() {
        return sourceTimeout.compareTo(batchTimeout) <= 0 ? sourceTimeout : batchTimeout;
    }
}
