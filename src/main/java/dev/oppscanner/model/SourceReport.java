package dev.oppscanner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Outcome of one source within a discovery call.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SourceReport(
        Status status,
        int count,
        List<Opportunity> opportunities,
        String error,
        long durationMs) {

    public enum Status {
        OK,
        ERROR,
        TIMED_OUT
    }

    public static SourceReport ok(List<Opportunity> opportunities, long durationMs) {
        return new SourceReport(Status.OK, opportunities.size(), List.copyOf(opportunities), null, durationMs);
    }

    public static SourceReport error(String message, long durationMs) {
        return new SourceReport(Status.ERROR, 0, List.of(), message, durationMs);
    }

    /**
     * Deadline hit; whatever the source emitted before it is kept.
     */
    public static SourceReport timedOut(List<Opportunity> partial, long timeoutMs) {
        return new SourceReport(Status.TIMED_OUT, partial.size(), List.copyOf(partial),
                "Timed out after " + timeoutMs + " ms", timeoutMs);
    }

    @JsonIgnore
    public boolean isOk() {
        return status == Status.OK;
    }
}
