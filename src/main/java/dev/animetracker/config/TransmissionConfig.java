package dev.animetracker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the Transmission RPC client.
 * Loaded from application.yml under 'transmission' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "transmission")
public class TransmissionConfig {

    private String host = "localhost";
    private int port = 9091;
    private String rpcPath = "/transmission/rpc";
    private String username;
    private String password;
    private String downloadRoot = "/data/Anime";
    private Duration timeout = Duration.ofSeconds(20);

    public String getRpcUrl() {
        return "http://" + host + ":" + port + rpcPath;
    }

    public boolean hasCredentials() {
        return username != null && !username.isBlank();
    }
}
