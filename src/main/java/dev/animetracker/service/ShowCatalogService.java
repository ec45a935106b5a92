package dev.animetracker.service;

import dev.animetracker.config.InvalidShowException;
import dev.animetracker.config.ShowCatalog;
import dev.animetracker.config.ShowCatalog.ShowDefinition;
import dev.animetracker.config.ShowCatalogLoader;
import dev.animetracker.entity.TrackedShow;
import dev.animetracker.repository.TrackedShowRepository;
import dev.animetracker.source.FeedSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Imports the show catalog into the database, upserting by title.
 * An imported show never has its watermark lowered.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ShowCatalogService {

    private final ShowCatalogLoader showCatalogLoader;
    private final TrackedShowRepository trackedShowRepository;
    private final FilterRuleService filterRuleService;
    private final List<FeedSource> feedSources;

    public record ImportResult(int created, int updated, int skipped) {
    }

    /**
     * Read the catalog file and import it.
     */
    @Transactional
    public ImportResult importCatalog() {
        return importCatalog(showCatalogLoader.load());
    }

    @Transactional
    public ImportResult importCatalog(ShowCatalog catalog) {
        int created = 0;
        int updated = 0;
        int skipped = 0;

        for (ShowDefinition definition : catalog.getShows()) {
            try {
                validate(definition);
            } catch (InvalidShowException e) {
                log.warn("Skipping show '{}': {}", definition.getTitle(), e.getMessage());
                skipped++;
                continue;
            }

            if (upsert(definition)) {
                created++;
            } else {
                updated++;
            }
        }

        log.info("Show catalog imported: {} created, {} updated, {} skipped", created, updated, skipped);
        return new ImportResult(created, updated, skipped);
    }

    void validate(ShowDefinition definition) {
        if (definition.getTitle() == null || definition.getTitle().isBlank()) {
            throw new InvalidShowException("missing title");
        }
        if (definition.getSeason() < 1) {
            throw new InvalidShowException("season must be 1 or more, got " + definition.getSeason());
        }
        if (definition.getStartEpisode() < 0) {
            throw new InvalidShowException("start episode cannot be negative");
        }
        if (definition.getMinResolution() != null && definition.getMinResolution() <= 0) {
            throw new InvalidShowException("minimum resolution must be positive");
        }
        if (definition.getFeeds() == null || definition.getFeeds().isEmpty()) {
            throw new InvalidShowException("no feed source configured");
        }
        Set<String> known = feedSources.stream().map(FeedSource::getId).collect(Collectors.toSet());
        for (String feed : definition.getFeeds()) {
            if (!known.contains(feed)) {
                throw new InvalidShowException("unknown feed source '" + feed + "', expected one of " + known);
            }
        }
    }

    /**
     * @return true when the show was created, false when it existed
     */
    private boolean upsert(ShowDefinition definition) {
        String title = definition.getTitle().trim();
        Optional<TrackedShow> existing = trackedShowRepository.findByTitleIgnoreCase(title);

        TrackedShow show = existing.orElseGet(() -> TrackedShow.builder()
                .title(title)
                .baselineEpisode(definition.getStartEpisode())
                .lastDownloadedEpisode(definition.getStartEpisode())
                .build());

        if (existing.isPresent() && definition.getStartEpisode() > show.getBaselineEpisode()) {
            show.setBaselineEpisode(definition.getStartEpisode());
            if (definition.getStartEpisode() > show.getLastDownloadedEpisode()) {
                show.setLastDownloadedEpisode(definition.getStartEpisode());
            }
        }

        show.getAliases().clear();
        show.getAliases().addAll(orEmpty(definition.getAliases()));
        show.getFeedSources().clear();
        show.getFeedSources().addAll(definition.getFeeds());
        show.getDisabledRules().clear();
        show.getDisabledRules().addAll(orEmpty(definition.getDisabledRules()));
        show.setSeason(definition.getSeason());
        show.setUploader(definition.getUploader());
        show.setMinResolution(definition.getMinResolution());
        show.setPreferredGroup(definition.getPreferredGroup());
        show.setEnabled(definition.isEnabled());
        show.setDownloadPath(definition.getDownloadPath());

        TrackedShow saved = trackedShowRepository.save(show);
        filterRuleService.replaceShowRules(saved, orEmpty(definition.getRules()));
        log.debug("{} show '{}' (season {}, watermark {})", existing.isPresent() ? "Updated" : "Created",
                saved.getTitle(), saved.getSeason(), saved.getLastDownloadedEpisode());
        return existing.isEmpty();
    }

    private static <T> List<T> orEmpty(List<T> values) {
        return values == null ? List.of() : values;
    }
}
