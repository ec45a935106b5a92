package dev.animetracker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the upstream release feeds.
 * Loaded from application.yml under 'feeds' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "feeds")
public class FeedsConfig {

    private String nyaaUrl = "https://nyaa.si";
    private String subsPleaseUrl = "https://subsplease.org";

    /**
     * Nyaa category, "1_2" is Anime - English-translated.
     */
    private String nyaaCategory = "1_2";

    private Duration timeout = Duration.ofSeconds(30);
    private int maxRetries = 2;
    private Duration retryBackoff = Duration.ofSeconds(2);
    private String userAgent =
            "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/121.0.0.0 Safari/537.36";
}
