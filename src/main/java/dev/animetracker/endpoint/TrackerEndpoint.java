package dev.animetracker.endpoint;

import dev.animetracker.entity.TrackedShow;
import dev.animetracker.repository.TrackedShowRepository;
import dev.animetracker.service.HistoryService;
import dev.animetracker.service.ShowCatalogService;
import dev.animetracker.service.ShowCatalogService.ImportResult;
import dev.animetracker.service.TrackerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.annotation.WriteOperation;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Actuator endpoint {@code /actuator/tracker}: last cycle status (GET) and catalog reload (POST).
 */
@Slf4j
@Component
@Endpoint(id = "tracker")
@RequiredArgsConstructor
public class TrackerEndpoint {

    private final TrackerService trackerService;
    private final ShowCatalogService showCatalogService;
    private final TrackedShowRepository trackedShowRepository;
    private final HistoryService historyService;

    @ReadOperation
    public Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("lastPollTime", trackerService.getLastPollTime().orElse(null));
        status.put("lastCycle", trackerService.getLastResult().orElse(null));
        status.put("downloadsToday", historyService.getDownloadsToday());

        List<Map<String, Object>> shows = trackedShowRepository.findByEnabledTrue().stream()
                .map(this::describe)
                .toList();
        status.put("shows", shows);
        return status;
    }

    /**
     * Re-read the show catalog file.
     */
    @WriteOperation
    public Map<String, Object> reload() {
        log.info("Show catalog reload requested");
        ImportResult result = showCatalogService.importCatalog();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("created", result.created());
        response.put("updated", result.updated());
        response.put("skipped", result.skipped());
        return response;
    }

    private Map<String, Object> describe(TrackedShow show) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("title", show.getTitle());
        entry.put("season", show.getSeason());
        entry.put("lastDownloadedEpisode", show.getLastDownloadedEpisode());
        entry.put("feeds", show.getFeedSources());
        return entry;
    }
}
