package dev.oppscanner.config;

import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for a single source.
 */
@Data
public class SourceSettings {

    private boolean enabled = true;

    // Advisory only, not enforced
    private int rateLimitPerHour = 60;

    private int minValue = 0;
    private int minMatchScore = 0;

    // Candidates considered per sub-feed
    private int maxItems = 25;

    // Pause between sequential sub-requests
    private Duration requestPause = Duration.ofMillis(500);

    // Overrides the platform's default endpoint when set
    private String baseUrl;

    // Bearer credential; the source runs unauthenticated when blank
    private String token;

    // Sub-feeds: search queries, subreddits, RSS urls or cities depending on the source
    private List<String> feeds = new ArrayList<>();

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }
}
