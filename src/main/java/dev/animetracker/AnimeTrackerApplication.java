package dev.animetracker;

import dev.animetracker.config.TrackerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class AnimeTrackerApplication implements CommandLineRunner {

    private final TrackerRunner trackerRunner;
    private final ExitManager exitManager;
    private final TrackerProperties trackerProperties;

    public static void main(String[] args) {
        SpringApplication.run(AnimeTrackerApplication.class, args);
    }

    @Override
    public void run(String... args) {
        if (!trackerProperties.isEnabled()) {
            log.info("Tracker disabled (tracker.enabled=false), not scheduling poll cycles");
            return;
        }

        try {
            trackerRunner.initialize();
            trackerRunner.start();
        } catch (Exception e) {
            log.error("Anime Tracker failed to start: {}", e.getMessage(), e);
            exitManager.exit(1);
        }
    }
}
