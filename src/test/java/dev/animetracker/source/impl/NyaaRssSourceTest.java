package dev.animetracker.source.impl;

import dev.animetracker.config.FeedsConfig;
import dev.animetracker.entity.TrackedShow;
import dev.animetracker.metrics.TrackerMetrics;
import dev.animetracker.model.FeedOrigin;
import dev.animetracker.model.FeedRequest;
import dev.animetracker.model.RawItem;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.ClassPathResource;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class NyaaRssSourceTest {

  private MockWebServer mockWebServer;
  private NyaaRssSource source;

  @Mock
  private TrackerMetrics metrics;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();

    FeedsConfig feedsConfig = new FeedsConfig();
    feedsConfig.setNyaaUrl("http://localhost:" + mockWebServer.getPort());
    source = new NyaaRssSource(WebClient.builder(), metrics, feedsConfig);
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  private String fixture() throws IOException {
    return new ClassPathResource("feeds/nyaa-rss.xml").getContentAsString(StandardCharsets.UTF_8);
  }

  @Test
  void shouldBuildSearchRequestFromUploaderAndTitle() {
    TrackedShow show = TrackedShow.builder()
        .title("Sousou no Frieren 2nd Season")
        .uploader("SubsPlease")
        .build();

    FeedRequest request = source.requestFor(show);

    assertThat(request.sourceId()).isEqualTo("nyaa");
    assertThat(request.query()).isEqualTo("SubsPlease Sousou no Frieren");
    assertThat(request.uploader()).isEqualTo("SubsPlease");
  }

  @Test
  void shouldSearchByTitleAloneWithoutUploader() {
    FeedRequest request = source.requestFor(TrackedShow.builder().title("Dandadan").build());

    assertThat(request.query()).isEqualTo("Dandadan");
    assertThat(request.uploader()).isNull();
  }

  @Test
  void shouldFetchAndNormalizeItems() throws Exception {
    mockWebServer.enqueue(new MockResponse()
        .setBody(fixture())
        .addHeader("Content-Type", "application/rss+xml"));

    StepVerifier.create(source.fetch(new FeedRequest("nyaa", "SubsPlease Sousou no Frieren", "SubsPlease", 0)))
        .assertNext(batch -> {
          assertThat(batch.origin()).isEqualTo(FeedOrigin.RSS);
          assertThat(batch.sourceName()).isEqualTo("Nyaa");
          assertThat(batch.items()).hasSize(3);
          assertThat(batch.skipped()).isEqualTo(1);

          RawItem first = batch.items().get(0);
          assertThat(first.getTitle()).isEqualTo("[SubsPlease] Sousou no Frieren S2 - 05 (1080p) [8E4A2C1F].mkv");
          assertThat(first.getGroup()).isEqualTo("SubsPlease");
          assertThat(first.getTorrentLink()).isEqualTo("https://nyaa.si/download/2059096.torrent");
          assertThat(first.getViewUrl()).isEqualTo("https://nyaa.si/view/2059096");
          assertThat(first.getInfoHash()).isEqualTo("3f5a1c9e2b7d4a6f8e0c1b2d3e4f5a6b7c8d9e0f");
          assertThat(first.getSeeders()).isEqualTo(1520);
          assertThat(first.getSize()).isEqualTo("1.4 GiB");
          assertThat(first.getPublishedAt()).isEqualTo(Instant.parse("2026-01-16T17:02:11Z"));
          assertThat(first.getPosition()).isZero();

          RawItem last = batch.items().get(2);
          assertThat(last.getPosition()).isEqualTo(2);
          assertThat(last.getPublishedAt()).isNull();
          assertThat(last.getSeeders()).isZero();
        })
        .verifyComplete();

    RecordedRequest request = mockWebServer.takeRequest();
    assertThat(request.getPath())
        .startsWith("/?page=rss")
        .contains("q=SubsPlease%20Sousou%20no%20Frieren")
        .contains("c=1_2")
        .contains("f=0");
  }
}
