package dev.animetracker.source.impl;

import dev.animetracker.config.FeedsConfig;
import dev.animetracker.metrics.TrackerMetrics;
import dev.animetracker.model.FeedBatch;
import dev.animetracker.model.FeedRequest;
import dev.animetracker.model.RawItem;
import dev.animetracker.source.FeedFetchException;
import dev.animetracker.source.FeedSource;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.http.HttpStatus;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
public abstract class AbstractFeedSource implements FeedSource {

    protected static final String UNKNOWN_GROUP = "unknown";

    private static final Pattern GROUP_PREFIX = Pattern.compile("^\\s*\\[([^\\]]+)\\]");
    private static final Pattern BTIH = Pattern.compile("urn:btih:([0-9a-fA-F]{40})");

    protected final WebClient webClient;
    protected final TrackerMetrics metrics;
    protected final FeedsConfig feedsConfig;

    protected AbstractFeedSource(WebClient.Builder webClientBuilder, TrackerMetrics metrics, FeedsConfig feedsConfig) {
        HttpClient httpClient = HttpClient.create()
                .httpResponseDecoder(spec -> spec.maxHeaderSize(32768));

        this.webClient = webClientBuilder
                .codecs(config -> config.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader("User-Agent", feedsConfig.getUserAgent())
                .defaultHeader("Accept", "application/rss+xml, application/xml, text/html;q=0.9, */*;q=0.8")
                .build();
        this.metrics = metrics;
        this.feedsConfig = feedsConfig;
    }

    /**
     * Build the URL for a request.
     */
    protected abstract URI buildUri(FeedRequest request);

    /**
     * Normalize a fetched document into a batch. Throws {@link FeedFetchException} when the
     * document as a whole is unreadable; single bad items are skipped and counted.
     */
    protected abstract FeedBatch parse(String body, FeedRequest request);

    @Override
    public Mono<FeedBatch> fetch(FeedRequest request) {
        URI uri = buildUri(request);
        log.debug("{} - GET {}", getName(), uri);

        return timedGet(uri)
                .retryWhen(Retry.backoff(feedsConfig.getMaxRetries(), feedsConfig.getRetryBackoff())
                        .filter(this::isRetryable)
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .map(body -> parse(body, request))
                .doOnNext(batch -> {
                    if (batch.skipped() > 0) {
                        log.warn("{} - skipped {} malformed item(s)", getName(), batch.skipped());
                    }
                    log.debug("{} - {} item(s) for {}", getName(), batch.items().size(), request);
                })
                .onErrorMap(e -> !(e instanceof FeedFetchException),
                        e -> new FeedFetchException(getName() + " fetch failed: " + describe(e), e))
                .doOnError(e -> {
                    log.warn("{} - {}", getName(), e.getMessage());
                    metrics.incrementFetchFailures(getName());
                });
    }

    /**
     * Execute a timed GET request.
     */
    @SuppressWarnings("null")
    protected Mono<String> timedGet(URI uri) {
        long start = System.currentTimeMillis();
        return webClient.get()
                .uri(uri)
                .retrieve()
                .bodyToMono(String.class)
                .defaultIfEmpty("")
                .timeout(feedsConfig.getTimeout())
                .doOnTerminate(() -> {
                    long latency = System.currentTimeMillis() - start;
                    metrics.recordFetchLatency(getName(), latency);
                });
    }

    private boolean isRetryable(Throwable e) {
        if (e instanceof WebClientResponseException response) {
            return response.getStatusCode().isSameCodeAs(HttpStatus.TOO_MANY_REQUESTS)
                    || response.getStatusCode().isSameCodeAs(HttpStatus.SERVICE_UNAVAILABLE);
        }
        return false;
    }

    private String describe(Throwable e) {
        if (e instanceof WebClientResponseException response) {
            return "HTTP " + response.getStatusCode().value();
        }
        if (e instanceof TimeoutException) {
            return "timed out after " + feedsConfig.getTimeout().toSeconds() + "s";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * Parse an RSS document, rejecting anything that is not one.
     */
    protected Document parseRss(String body) {
        if (body == null || !body.contains("<rss") || !body.contains("<channel")) {
            throw new FeedFetchException(getName() + " returned a document that is not an RSS feed");
        }
        return Jsoup.parse(body, "", Parser.xmlParser());
    }

    /**
     * Text of the first direct child with the given tag, empty when absent.
     * Matches namespaced tags such as {@code nyaa:infoHash} by their full name.
     */
    protected String childText(Element parent, String tagName) {
        for (Element child : parent.children()) {
            if (child.tagName().equalsIgnoreCase(tagName)) {
                return child.text().trim();
            }
        }
        return "";
    }

    /**
     * Release group from the leading bracket tag, "unknown" when the title has none.
     */
    protected String detectGroup(String title) {
        if (title == null) {
            return UNKNOWN_GROUP;
        }
        Matcher m = GROUP_PREFIX.matcher(title);
        return m.find() && !m.group(1).isBlank() ? m.group(1).trim() : UNKNOWN_GROUP;
    }

    protected String infoHashFromMagnet(String magnet) {
        if (magnet == null) {
            return "";
        }
        Matcher m = BTIH.matcher(magnet);
        return m.find() ? m.group(1).toLowerCase(Locale.ROOT) : "";
    }

    protected Instant parsePubDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return ZonedDateTime.parse(value.trim(), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("{} - unreadable pubDate '{}'", getName(), value);
            return null;
        }
    }

    protected int parseIntOrZero(String value) {
        try {
            return value == null || value.isBlank() ? 0 : Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * Build a RawItem with common defaults.
     */
    protected RawItem.RawItemBuilder baseItem(String title, int position) {
        return RawItem.builder()
                .title(title)
                .group(detectGroup(title))
                .sourceName(getName())
                .origin(getOrigin())
                .position(position);
    }

    protected String absolute(String href) {
        if (href == null || href.isBlank() || href.startsWith("http") || href.startsWith("magnet:")) {
            return href;
        }
        String base = feedsConfig.getNyaaUrl();
        if (base.endsWith("/") && href.startsWith("/")) {
            return base + href.substring(1);
        }
        return href.startsWith("/") ? base + href : base + "/" + href;
    }
}
