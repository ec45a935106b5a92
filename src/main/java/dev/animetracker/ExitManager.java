package dev.animetracker;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Terminates the process after a fatal startup error.
 * Kept as a bean so tests can mock it instead of killing the test runner.
 */
@Slf4j
@Component
public class ExitManager {

  private static final List<String> TEST_RUNNER_MARKERS = List.of("junit", "surefire", "intellij");

  public void exit(int status) {
    if (runningUnderTests()) {
      log.warn("Exit with status {} suppressed under a test runner", status);
      return;
    }
    log.info("Anime Tracker exiting with status {}", status);
    System.exit(status);
  }

  protected boolean runningUnderTests() {
    String classPath = System.getProperty("java.class.path", "");
    return TEST_RUNNER_MARKERS.stream().anyMatch(classPath::contains);
  }
}
