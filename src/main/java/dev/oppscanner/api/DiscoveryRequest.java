package dev.oppscanner.api;

import dev.oppscanner.model.DiscoveryProfile;

import java.util.List;

/**
 * Body of {@code POST /api/discovery}. {@code profile} and {@code sources} are optional.
 */
public record DiscoveryRequest(String caller, DiscoveryProfile profile, List<String> sources) {
}
