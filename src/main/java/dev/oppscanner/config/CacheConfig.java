package dev.oppscanner.config;

import dev.oppscanner.cache.DedupCache;
import dev.oppscanner.cache.InMemoryDedupCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class CacheConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DedupCache dedupCache(Clock clock, DiscoveryConfig discoveryConfig) {
        DiscoveryConfig.Cache cache = discoveryConfig.getCache();
        log.info("Dedup cache: ttl={} maxEntries={}", cache.getTtl(), cache.getMaxEntries());
        return new InMemoryDedupCache(clock, cache.getTtl(), cache.getMaxEntries());
    }
}
