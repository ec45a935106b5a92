package dev.animetracker.dispatch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.animetracker.config.TransmissionConfig;
import dev.animetracker.metrics.TrackerMetrics;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Transmission RPC client.
 *
 * <p>Every call carries the {@value #SESSION_HEADER} token. Transmission answers 409 with a
 * fresh token when the current one is missing or stale; the call is then repeated once with
 * the new token. A second 409 fails the call.
 */
@Slf4j
@Component
public class TransmissionClient {

    static final String SESSION_HEADER = "X-Transmission-Session-Id";

    private static final int CONFLICT = 409;
    private static final int UNAUTHORIZED = 401;

    private final WebClient webClient;
    private final TransmissionConfig config;
    private final TrackerMetrics metrics;

    // Guarded by this
    private String sessionId;

    public TransmissionClient(WebClient.Builder webClientBuilder, TransmissionConfig config, TrackerMetrics metrics) {
        WebClient.Builder builder = webClientBuilder
                .baseUrl(config.getRpcUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (config.hasCredentials()) {
            String password = config.getPassword() == null ? "" : config.getPassword();
            builder.defaultHeaders(headers -> headers.setBasicAuth(config.getUsername(), password));
        }
        this.webClient = builder.build();
        this.config = config;
        this.metrics = metrics;
    }

    public synchronized String currentSessionId() {
        return sessionId;
    }

    private synchronized void updateSessionId(String id) {
        this.sessionId = id;
    }

    /**
     * Obtain a session token. Transmission hands it out on a 409 to any unauthenticated call.
     */
    public Mono<String> handshake() {
        return webClient.post()
                .bodyValue(new RpcRequest("session-get", Map.of()))
                .exchangeToMono(response -> {
                    int status = response.statusCode().value();
                    String id = response.headers().asHttpHeaders().getFirst(SESSION_HEADER);
                    if (status == UNAUTHORIZED) {
                        return response.releaseBody().then(Mono.<String>error(authenticationRejected()));
                    }
                    if (id == null || id.isBlank()) {
                        return response.releaseBody().then(Mono.<String>error(
                                new DispatchException("Transmission handshake returned no session id (HTTP " + status + ")")));
                    }
                    return response.releaseBody().thenReturn(id);
                })
                .timeout(config.getTimeout())
                .doOnNext(id -> {
                    updateSessionId(id);
                    log.debug("Transmission session established");
                })
                .onErrorMap(e -> !(e instanceof DispatchException),
                        e -> new DispatchException("Transmission handshake failed: " + describe(e), e));
    }

    /**
     * Add a torrent by magnet link or .torrent URL.
     *
     * @param downloadDir target directory on the Transmission host
     */
    public Mono<AddResult> addTorrent(String uri, String downloadDir) {
        RpcRequest request = new RpcRequest("torrent-add", Map.of("filename", uri, "download-dir", downloadDir));
        long start = System.currentTimeMillis();

        String known = currentSessionId();
        Mono<String> session = known != null ? Mono.just(known) : handshake();

        return session
                .flatMap(id -> call(request, id))
                .onErrorResume(StaleSessionException.class, stale -> {
                    log.info("Transmission session expired, retrying with a new session id");
                    Mono<String> refreshed;
                    if (stale.freshId != null) {
                        updateSessionId(stale.freshId);
                        refreshed = Mono.just(stale.freshId);
                    } else {
                        refreshed = handshake();
                    }
                    return refreshed.flatMap(id -> call(request, id))
                            .onErrorMap(StaleSessionException.class,
                                    e -> new DispatchException("Transmission rejected the refreshed session (HTTP 409)"));
                })
                .map(this::toAddResult)
                .onErrorMap(e -> !(e instanceof DispatchException),
                        e -> new DispatchException("Transmission call failed: " + describe(e), e))
                .doOnTerminate(() -> metrics.recordRpcLatency(System.currentTimeMillis() - start));
    }

    private Mono<RpcResponse> call(RpcRequest request, String id) {
        return webClient.post()
                .header(SESSION_HEADER, id)
                .bodyValue(request)
                .exchangeToMono(this::readResponse)
                .timeout(config.getTimeout());
    }

    private Mono<RpcResponse> readResponse(ClientResponse response) {
        int status = response.statusCode().value();
        if (status == CONFLICT) {
            String freshId = response.headers().asHttpHeaders().getFirst(SESSION_HEADER);
            return response.releaseBody().then(Mono.error(new StaleSessionException(freshId)));
        }
        if (status == UNAUTHORIZED) {
            return response.releaseBody().then(Mono.error(authenticationRejected()));
        }
        if (response.statusCode().isError()) {
            return response.releaseBody().then(Mono.error(new DispatchException("Transmission answered HTTP " + status)));
        }
        return response.bodyToMono(RpcResponse.class)
                .switchIfEmpty(Mono.error(new DispatchException("Transmission returned an empty response")));
    }

    private AddResult toAddResult(RpcResponse response) {
        if (!"success".equals(response.getResult())) {
            throw new DispatchException("Transmission rejected the torrent: " + response.getResult());
        }
        AddArguments args = response.getArguments();
        if (args != null && args.getTorrentDuplicate() != null) {
            TorrentInfo info = args.getTorrentDuplicate();
            return new AddResult(info.getHashString(), info.getName(), true);
        }
        if (args != null && args.getTorrentAdded() != null) {
            TorrentInfo info = args.getTorrentAdded();
            return new AddResult(info.getHashString(), info.getName(), false);
        }
        return new AddResult(null, null, false);
    }

    private DispatchException authenticationRejected() {
        return new DispatchException("Transmission rejected the credentials (HTTP 401)");
    }

    private String describe(Throwable e) {
        if (e instanceof TimeoutException) {
            return "no answer within " + config.getTimeout().toSeconds() + "s";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * What Transmission reported for an added torrent.
     *
     * @param duplicate the client already had the torrent
     */
    public record AddResult(String hashString, String name, boolean duplicate) {
    }

    record RpcRequest(String method, Map<String, Object> arguments) {
    }

    private static final class StaleSessionException extends RuntimeException {
        private final String freshId;

        StaleSessionException(String freshId) {
            super("Stale Transmission session", null, false, false);
            this.freshId = freshId;
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class RpcResponse {
        private String result;
        private AddArguments arguments;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class AddArguments {
        @JsonProperty("torrent-added")
        private TorrentInfo torrentAdded;

        @JsonProperty("torrent-duplicate")
        private TorrentInfo torrentDuplicate;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TorrentInfo {
        private Long id;
        private String name;
        private String hashString;
    }
}
