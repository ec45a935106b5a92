package dev.animetracker.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Show catalog read from shows.json: the shows the user wants tracked and
 * their per-show rule overrides.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ShowCatalog {
  private List<ShowDefinition> shows = new ArrayList<>();

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ShowDefinition {
    private String title;
    private List<String> aliases = new ArrayList<>();
    private int season = 1;
    private List<String> feeds = new ArrayList<>(List.of("nyaa"));
    private String uploader = "subsplease";
    private Integer minResolution;
    private String preferredGroup;
    private int startEpisode = 0;
    private boolean enabled = true;
    private String downloadPath;
    private List<String> disabledRules = new ArrayList<>();
    private List<RuleDefinition> rules = new ArrayList<>();
  }
}
