package dev.oppscanner.model;

/**
 * Where an opportunity's estimated value came from.
 */
public enum ValueOrigin {
    /** The platform supplied a number (salary, bounty). */
    PLATFORM,
    /** A money pattern was found in the listing text. */
    EXTRACTED,
    /** Nothing was found; the value is the placeholder. */
    DEFAULT
}
