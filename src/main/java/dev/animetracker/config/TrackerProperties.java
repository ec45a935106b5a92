package dev.animetracker.config;

import dev.animetracker.model.FeedOrigin;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the polling loop and the selection policy.
 * Loaded from application.yml under 'tracker' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "tracker")
public class TrackerProperties {

    private boolean enabled = true;

    /**
     * How many cycles to run per day. 0 switches to {@link #fallbackCron}.
     */
    private int pollTimesPerDay = 4;

    private String fallbackCron = "0 0 5,17 * * *";
    private Duration initialDelay = Duration.ofSeconds(10);
    private Duration cycleTimeout = Duration.ofMinutes(30);
    private int showConcurrency = 4;

    private int defaultMinResolution = 1080;
    private List<FeedOrigin> sourcePriority = new ArrayList<>(List.of(FeedOrigin.RSS, FeedOrigin.SCRAPE));
    private boolean requireConfirmationOnTie = false;

    private String catalogFile = "shows.json";
    private boolean dryRun = false;
    private int historyRetentionDays = 0;

    /**
     * Interval between two cycles, derived from {@link #pollTimesPerDay}.
     */
    public Duration getPollInterval() {
        if (pollTimesPerDay <= 0) {
            return Duration.ZERO;
        }
        return Duration.ofMinutes(24L * 60 / pollTimesPerDay);
    }
}
