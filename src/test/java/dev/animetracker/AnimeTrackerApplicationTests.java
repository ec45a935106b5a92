package dev.animetracker;

import dev.animetracker.config.TrackerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnimeTrackerApplicationTests {

  @Mock
  private TrackerRunner trackerRunner;

  @Mock
  private ExitManager exitManager;

  private TrackerProperties trackerProperties;
  private AnimeTrackerApplication application;

  @BeforeEach
  void setUp() {
    trackerProperties = new TrackerProperties();
    application = new AnimeTrackerApplication(trackerRunner, exitManager, trackerProperties);
  }

  @Test
  void shouldInitializeThenStartSchedule() {
    application.run();

    InOrder inOrder = inOrder(trackerRunner);
    inOrder.verify(trackerRunner).initialize();
    inOrder.verify(trackerRunner).start();
    verifyNoInteractions(exitManager);
  }

  @Test
  void shouldDoNothingWhenDisabled() {
    trackerProperties.setEnabled(false);

    application.run();

    verifyNoInteractions(trackerRunner, exitManager);
  }

  @Test
  void shouldExitWithErrorWhenStartupFails() {
    doThrow(new IllegalStateException("Database is not reachable")).when(trackerRunner).initialize();

    application.run();

    verify(trackerRunner, never()).start();
    verify(exitManager).exit(1);
  }
}
