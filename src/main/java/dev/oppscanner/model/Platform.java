package dev.oppscanner.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Platforms an opportunity can come from.
 * The key is what appears in {@link Opportunity#getSource()} and in opportunity ids.
 */
public enum Platform {
    GITHUB("github", "GitHub"),
    HACKERNEWS("hackernews", "Hacker News"),
    REMOTEOK("remoteok", "RemoteOK"),
    REMOTIVE("remotive", "Remotive"),
    REDDIT("reddit", "Reddit"),
    WEWORKREMOTELY("weworkremotely", "We Work Remotely"),
    UPWORK("upwork", "Upwork"),
    STACKOVERFLOW("stackoverflow", "Stack Overflow"),
    INDIEHACKERS("indiehackers", "Indie Hackers"),
    CRAIGSLIST("craigslist", "Craigslist"),
    LINKEDIN("linkedin", "LinkedIn"),
    TWITTER("twitter", "Twitter");

    private final String key;
    private final String displayName;

    Platform(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }
}
