package dev.animetracker.dispatch;

import dev.animetracker.config.TransmissionConfig;
import dev.animetracker.metrics.TrackerMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TransmissionClientTest {

    private static final String MAGNET = "magnet:?xt=urn:btih:3f5a9c2e1b7d4a6f8e0c1d2b3a4f5e6d7c8b9a0f";
    private static final String DIR = "/data/Anime/Sousou no Frieren/Season 2/";

    private MockWebServer mockWebServer;
    private TransmissionConfig config;
    private SimpleMeterRegistry meterRegistry;
    private TransmissionClient client;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        config = new TransmissionConfig();
        config.setHost("localhost");
        config.setPort(mockWebServer.getPort());
        config.setTimeout(Duration.ofSeconds(5));

        meterRegistry = new SimpleMeterRegistry();
        client = new TransmissionClient(WebClient.builder(), config, new TrackerMetrics(meterRegistry));
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    private MockResponse sessionConflict(String id) {
        return new MockResponse()
                .setResponseCode(409)
                .addHeader(TransmissionClient.SESSION_HEADER, id)
                .setBody("<h1>409: Conflict</h1>");
    }

    private MockResponse json(String body) {
        return new MockResponse()
                .addHeader("Content-Type", "application/json")
                .setBody(body);
    }

    private String added() {
        return """
                {"arguments":{"torrent-added":{"hashString":"3f5a9c2e1b7d4a6f8e0c1d2b3a4f5e6d7c8b9a0f",
                "id":12,"name":"[SubsPlease] Sousou no Frieren S2 - 05 (1080p)"}},"result":"success"}
                """;
    }

    @Nested
    @DisplayName("Session handling")
    class SessionTests {

        @Test
        @DisplayName("Should obtain a session id before the first call")
        void shouldHandshakeFirst() throws InterruptedException {
            mockWebServer.enqueue(sessionConflict("session-1"));
            mockWebServer.enqueue(json(added()));

            StepVerifier.create(client.addTorrent(MAGNET, DIR))
                    .assertNext(result -> {
                        assertThat(result.duplicate()).isFalse();
                        assertThat(result.hashString()).isEqualTo("3f5a9c2e1b7d4a6f8e0c1d2b3a4f5e6d7c8b9a0f");
                    })
                    .verifyComplete();

            RecordedRequest handshake = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
            assertThat(handshake.getPath()).isEqualTo("/transmission/rpc");
            assertThat(handshake.getBody().readUtf8()).contains("session-get");

            RecordedRequest add = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
            assertThat(add.getHeader(TransmissionClient.SESSION_HEADER)).isEqualTo("session-1");
            assertThat(add.getBody().readUtf8())
                    .contains("\"method\":\"torrent-add\"")
                    .contains("\"download-dir\":\"" + DIR + "\"")
                    .contains(MAGNET);
            assertThat(client.currentSessionId()).isEqualTo("session-1");
        }

        @Test
        @DisplayName("Should retry once with the fresh id after a 409")
        void shouldRetryWithFreshSession() throws InterruptedException {
            mockWebServer.enqueue(sessionConflict("session-1"));
            mockWebServer.enqueue(sessionConflict("session-2"));
            mockWebServer.enqueue(json(added()));

            StepVerifier.create(client.addTorrent(MAGNET, DIR))
                    .assertNext(result -> assertThat(result.duplicate()).isFalse())
                    .verifyComplete();

            assertThat(mockWebServer.getRequestCount()).isEqualTo(3);
            mockWebServer.takeRequest();
            assertThat(mockWebServer.takeRequest().getHeader(TransmissionClient.SESSION_HEADER)).isEqualTo("session-1");
            assertThat(mockWebServer.takeRequest().getHeader(TransmissionClient.SESSION_HEADER)).isEqualTo("session-2");
            assertThat(client.currentSessionId()).isEqualTo("session-2");
        }

        @Test
        @DisplayName("Should fail when the refreshed session is rejected too")
        void shouldFailOnSecondConflict() {
            mockWebServer.enqueue(sessionConflict("session-1"));
            mockWebServer.enqueue(sessionConflict("session-2"));
            mockWebServer.enqueue(sessionConflict("session-3"));

            StepVerifier.create(client.addTorrent(MAGNET, DIR))
                    .expectErrorSatisfies(e -> assertThat(e)
                            .isInstanceOf(DispatchException.class)
                            .hasMessageContaining("refreshed session"))
                    .verify();

            assertThat(mockWebServer.getRequestCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should reuse a known session id")
        void shouldReuseSession() {
            mockWebServer.enqueue(sessionConflict("session-1"));
            mockWebServer.enqueue(json(added()));
            mockWebServer.enqueue(json(added()));

            client.addTorrent(MAGNET, DIR).block();
            client.addTorrent(MAGNET, DIR).block();

            assertThat(mockWebServer.getRequestCount()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("Error answers")
    class ErrorTests {

        @Test
        @DisplayName("Should report rejected credentials")
        void shouldReportUnauthorized() {
            mockWebServer.enqueue(new MockResponse().setResponseCode(401));

            StepVerifier.create(client.addTorrent(MAGNET, DIR))
                    .expectErrorSatisfies(e -> assertThat(e)
                            .isInstanceOf(DispatchException.class)
                            .hasMessageContaining("credentials"))
                    .verify();
        }

        @Test
        @DisplayName("Should report a server error")
        void shouldReportServerError() {
            mockWebServer.enqueue(sessionConflict("session-1"));
            mockWebServer.enqueue(new MockResponse().setResponseCode(500));

            StepVerifier.create(client.addTorrent(MAGNET, DIR))
                    .expectErrorMessage("Transmission answered HTTP 500")
                    .verify();
        }

        @Test
        @DisplayName("Should report a non-success result")
        void shouldReportRejectedTorrent() {
            mockWebServer.enqueue(sessionConflict("session-1"));
            mockWebServer.enqueue(json("{\"arguments\":{},\"result\":\"invalid or corrupt torrent file\"}"));

            StepVerifier.create(client.addTorrent(MAGNET, DIR))
                    .expectErrorMessage("Transmission rejected the torrent: invalid or corrupt torrent file")
                    .verify();
        }

        @Test
        @DisplayName("Should wrap connection failures")
        void shouldWrapConnectionFailure() throws IOException {
            mockWebServer.shutdown();

            StepVerifier.create(client.addTorrent(MAGNET, DIR))
                    .expectError(DispatchException.class)
                    .verify();
        }
    }

    @Test
    @DisplayName("Should flag torrents Transmission already has")
    void shouldFlagDuplicate() {
        mockWebServer.enqueue(sessionConflict("session-1"));
        mockWebServer.enqueue(json("""
                {"arguments":{"torrent-duplicate":{"hashString":"aa","id":3,"name":"x"}},"result":"success"}
                """));

        StepVerifier.create(client.addTorrent(MAGNET, DIR))
                .assertNext(result -> {
                    assertThat(result.duplicate()).isTrue();
                    assertThat(result.hashString()).isEqualTo("aa");
                })
                .verifyComplete();
        assertThat(meterRegistry.timer("anime_tracker_rpc_duration").count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should send basic auth when credentials are configured")
    void shouldSendBasicAuth() throws InterruptedException {
        config.setUsername("transmission");
        config.setPassword("secret");
        client = new TransmissionClient(WebClient.builder(), config, new TrackerMetrics(new SimpleMeterRegistry()));
        mockWebServer.enqueue(sessionConflict("session-1"));
        mockWebServer.enqueue(json(added()));

        client.addTorrent(MAGNET, DIR).block();

        assertThat(mockWebServer.takeRequest().getHeader("Authorization"))
                .isEqualTo("Basic dHJhbnNtaXNzaW9uOnNlY3JldA==");
    }
}
