package dev.oppscanner.source;

import dev.oppscanner.model.DiscoveryProfile;
import dev.oppscanner.model.Opportunity;
import dev.oppscanner.model.Platform;
import reactor.core.publisher.Flux;

/**
 * Interface for opportunity sources.
 * Each external platform implements this interface.
 */
public interface OpportunitySource {

    Platform getPlatform();

    /**
     * Name of this source as used in requests and reports (e.g. "github").
     */
    default String getName() {
        return getPlatform().getKey();
    }

    /**
     * Fetch new opportunities for the given profile.
     * Implementations complete empty instead of erroring when the platform misbehaves.
     */
    Flux<Opportunity> fetch(DiscoveryProfile profile);

    /**
     * Check if this source is enabled.
     */
    default boolean isEnabled() {
        return true;
    }
}
