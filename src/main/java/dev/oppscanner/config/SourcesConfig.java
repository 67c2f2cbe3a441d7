package dev.oppscanner.config;

import dev.oppscanner.model.Platform;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Per-source configuration.
 * Loaded from application.yml under 'sources' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "sources")
public class SourcesConfig {

    private SourceSettings github = new SourceSettings();
    private SourceSettings hackernews = new SourceSettings();
    private SourceSettings remoteok = new SourceSettings();
    private SourceSettings remotive = new SourceSettings();
    private SourceSettings reddit = new SourceSettings();
    private SourceSettings weworkremotely = new SourceSettings();
    private SourceSettings upwork = new SourceSettings();
    private SourceSettings stackoverflow = new SourceSettings();
    private SourceSettings indiehackers = new SourceSettings();
    private SourceSettings craigslist = new SourceSettings();
    private SourceSettings linkedin = new SourceSettings();
    private SourceSettings twitter = new SourceSettings();

    public SourceSettings forPlatform(Platform platform) {
        return switch (platform) {
            case GITHUB -> github;
            case HACKERNEWS -> hackernews;
            case REMOTEOK -> remoteok;
            case REMOTIVE -> remotive;
            case REDDIT -> reddit;
            case WEWORKREMOTELY -> weworkremotely;
            case UPWORK -> upwork;
            case STACKOVERFLOW -> stackoverflow;
            case INDIEHACKERS -> indiehackers;
            case CRAIGSLIST -> craigslist;
            case LINKEDIN -> linkedin;
            case TWITTER -> twitter;
        };
    }
}
