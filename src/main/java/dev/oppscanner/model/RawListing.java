package dev.oppscanner.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A candidate as parsed from a platform response, before filtering and normalization.
 */
@Value
@Builder(toBuilder = true)
public class RawListing {
    String nativeId;
    String title;
    String body;
    String url;
    String type;
    String createdAt;

    // Platform-supplied amount, null when the platform gives none
    Integer platformValue;

    @Singular
    Map<String, String> extras;
}
