package dev.oppscanner.source.impl;

import dev.oppscanner.config.SourcesConfig;
import dev.oppscanner.model.DiscoveryProfile;
import dev.oppscanner.model.Opportunity;
import dev.oppscanner.model.Platform;
import dev.oppscanner.source.OpportunitySource;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

/**
 * A platform that only serves listings behind a login. Registered so it shows up
 * in the source list and in results, but always yields nothing.
 */
@Slf4j
public abstract class CredentialGatedSource implements OpportunitySource {

    private final Platform platform;
    private final SourcesConfig sourcesConfig;

    protected CredentialGatedSource(Platform platform, SourcesConfig sourcesConfig) {
        this.platform = platform;
        this.sourcesConfig = sourcesConfig;
    }

    @Override
    public Platform getPlatform() {
        return platform;
    }

    @Override
    public boolean isEnabled() {
        return sourcesConfig.forPlatform(platform).isEnabled();
    }

    @Override
    public Flux<Opportunity> fetch(DiscoveryProfile profile) {
        log.info("{} requires an authenticated session, skipping", platform.getDisplayName());
        return Flux.empty();
    }
}
