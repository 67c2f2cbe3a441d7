package dev.oppscanner.api;

public record SourceStatus(String name, boolean enabled) {
}
