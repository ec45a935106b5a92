package dev.animetracker;

import dev.animetracker.config.TrackerProperties;
import dev.animetracker.entity.TrackedShow;
import dev.animetracker.metrics.TrackerMetrics;
import dev.animetracker.model.PollCycleResult;
import dev.animetracker.repository.TrackedShowRepository;
import dev.animetracker.service.FilterRuleService;
import dev.animetracker.service.HistoryService;
import dev.animetracker.service.ShowCatalogService;
import dev.animetracker.service.ShowCatalogService.ImportResult;
import dev.animetracker.service.TrackerService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns the tracker lifecycle: startup checks, the recurring poll schedule and shutdown.
 * Separated from the main Application class for better testability.
 */
@Slf4j
@Component
public class TrackerRunner {

  private static final String SEPARATOR = "========================================";

  private final TrackerService trackerService;
  private final ShowCatalogService showCatalogService;
  private final FilterRuleService filterRuleService;
  private final HistoryService historyService;
  private final TrackedShowRepository trackedShowRepository;
  private final TrackerProperties trackerProperties;
  private final TrackerMetrics metrics;
  private final TaskScheduler taskScheduler;

  private ScheduledFuture<?> schedule;

  public TrackerRunner(TrackerService trackerService, ShowCatalogService showCatalogService,
      FilterRuleService filterRuleService, HistoryService historyService,
      TrackedShowRepository trackedShowRepository, TrackerProperties trackerProperties, TrackerMetrics metrics,
      @Qualifier("trackerTaskScheduler") TaskScheduler taskScheduler) {
    this.trackerService = trackerService;
    this.showCatalogService = showCatalogService;
    this.filterRuleService = filterRuleService;
    this.historyService = historyService;
    this.trackedShowRepository = trackedShowRepository;
    this.trackerProperties = trackerProperties;
    this.metrics = metrics;
    this.taskScheduler = taskScheduler;
  }

  /**
   * Startup sequence. Any exception escaping here is fatal to the process.
   */
  public void initialize() {
    log.info(SEPARATOR);
    log.info("Anime Tracker Starting");
    log.info(SEPARATOR);

    long known;
    try {
      known = trackedShowRepository.count();
    } catch (RuntimeException e) {
      throw new IllegalStateException("Database is not reachable", e);
    }
    log.info("Database ready, {} show(s) stored", known);

    filterRuleService.seedDefaults();

    try {
      ImportResult result = showCatalogService.importCatalog();
      log.info("Catalog: {} created, {} updated, {} skipped", result.created(), result.updated(), result.skipped());
    } catch (IllegalStateException e) {
      log.error("Show catalog not imported: {}", e.getMessage());
    }

    List<TrackedShow> shows = trackedShowRepository.findByEnabledTrue();
    log.info("Tracking {} show(s):", shows.size());
    shows.forEach(show -> log.info("  - {} (season {}, last episode {})",
        show.getTitle(), show.getSeason(), show.getLastDownloadedEpisode()));
  }

  /**
   * Start the recurring poll schedule.
   */
  public synchronized void start() {
    if (schedule != null) {
      return;
    }
    if (trackerProperties.getPollTimesPerDay() > 0) {
      Instant firstRun = Instant.now().plus(trackerProperties.getInitialDelay());
      schedule = taskScheduler.scheduleWithFixedDelay(this::execute, firstRun, trackerProperties.getPollInterval());
      log.info("Polling {} time(s) per day, every {}, first cycle at {}",
          trackerProperties.getPollTimesPerDay(), trackerProperties.getPollInterval(), firstRun);
    } else {
      schedule = taskScheduler.schedule(this::execute, new CronTrigger(trackerProperties.getFallbackCron()));
      log.info("Polling on schedule '{}'", trackerProperties.getFallbackCron());
    }
  }

  /**
   * Run one cycle and wait for it. Never throws, so the schedule keeps going.
   *
   * @return the cycle result, or null when the cycle did not complete
   */
  public PollCycleResult execute() {
    if (trackerService.isStopping()) {
      return null;
    }

    try {
      PollCycleResult result = trackerService.runCycle().block(trackerProperties.getCycleTimeout());
      if (result != null && result.hasErrors()) {
        log.warn("Cycle finished with {} error(s)", result.errors().size());
      }
      cleanupHistory();
      return result;
    } catch (Exception e) {
      log.error("Poll cycle failed: {}", e.getMessage(), e);
      metrics.recordCycleFailure();
      return null;
    }
  }

  private void cleanupHistory() {
    if (trackerProperties.getHistoryRetentionDays() > 0) {
      historyService.cleanupFailedRecords(trackerProperties.getHistoryRetentionDays());
    }
  }

  @PreDestroy
  public synchronized void stop() {
    trackerService.requestStop();
    if (schedule != null) {
      schedule.cancel(false);
      schedule = null;
      log.info("Tracker stopped");
    }
  }
}
