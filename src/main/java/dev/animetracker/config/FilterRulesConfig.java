package dev.animetracker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Default global filter rules, seeded into an empty rule table on startup.
 * Loaded from application.yml under 'filters' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "filters")
public class FilterRulesConfig {

    private List<RuleDefinition> defaults = new ArrayList<>();
}
