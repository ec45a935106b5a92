package dev.animetracker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;

/**
 * Loads the {@link ShowCatalog} from the configured catalog file.
 * Read on startup and again on every explicit reload.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ShowCatalogLoader {

  private final ObjectMapper objectMapper;
  private final TrackerProperties trackerProperties;

  public ShowCatalog load() {
    File file = new File(trackerProperties.getCatalogFile());
    if (!file.exists()) {
      log.warn("{} not found. Using tracked shows already stored in the database.", file.getPath());
      return new ShowCatalog();
    }

    try {
      ShowCatalog catalog = objectMapper.readValue(file, ShowCatalog.class);
      log.info("Loaded show catalog with {} show(s) from {}", catalog.getShows().size(), file.getPath());
      return catalog;
    } catch (IOException e) {
      log.error("Failed to read {}. Ensure it matches the required structure.", file.getPath(), e);
      throw new IllegalStateException("Could not load show catalog", e);
    }
  }
}
