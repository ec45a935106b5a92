package dev.animetracker.source.impl;

import dev.animetracker.config.FeedsConfig;
import dev.animetracker.entity.TrackedShow;
import dev.animetracker.metrics.TrackerMetrics;
import dev.animetracker.model.FeedBatch;
import dev.animetracker.model.FeedOrigin;
import dev.animetracker.model.FeedRequest;
import dev.animetracker.model.RawItem;
import dev.animetracker.parser.TitleNormalizer;
import dev.animetracker.source.FeedFetchException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scraped Nyaa search listing, used when the RSS endpoint is unavailable.
 * Rows are read from the torrent table: view link (with the release title), .torrent link and magnet.
 */
@Slf4j
@Component
public class NyaaListingSource extends AbstractFeedSource {

  public static final String ID = "nyaa-listing";

  private static final String VIEW_LINK = "a[href^='/view/']:not([href*='#comments'])";
  private static final String TORRENT_LINK = "a[href*='.torrent']";
  private static final String MAGNET_LINK = "a[href^='magnet']";

  public NyaaListingSource(WebClient.Builder webClientBuilder, TrackerMetrics metrics, FeedsConfig feedsConfig) {
    super(webClientBuilder, metrics, feedsConfig);
  }

  @Override
  public String getId() {
    return ID;
  }

  @Override
  public String getName() {
    return "Nyaa listing";
  }

  @Override
  public FeedOrigin getOrigin() {
    return FeedOrigin.SCRAPE;
  }

  @Override
  public FeedRequest requestFor(TrackedShow show) {
    String uploader = show.getUploader() == null || show.getUploader().isBlank() ? null : show.getUploader().trim();
    return new FeedRequest(ID, TitleNormalizer.normalizeForSearch(show.getTitle()), uploader, 0);
  }

  @Override
  protected URI buildUri(FeedRequest request) {
    UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(feedsConfig.getNyaaUrl());
    if (request.uploader() != null) {
      builder.path("/user/{uploader}");
    } else {
      builder.path("/");
    }
    return builder
        .queryParam("f", 0)
        .queryParam("c", feedsConfig.getNyaaCategory())
        .queryParam("q", request.query())
        .queryParam("s", "id")
        .queryParam("o", "desc")
        .encode()
        .buildAndExpand(request.uploader() != null ? new Object[]{request.uploader()} : new Object[0])
        .toUri();
  }

  @Override
  protected FeedBatch parse(String body, FeedRequest request) {
    if (body == null || body.isBlank() || !body.toLowerCase(Locale.ROOT).contains("<html")) {
      throw new FeedFetchException(getName() + " returned an empty or non-HTML document");
    }

    Document doc = Jsoup.parse(body);
    List<RawItem> items = new ArrayList<>();
    int skipped = 0;
    int position = 0;

    for (Element row : doc.select("tr")) {
      Element view = row.selectFirst(VIEW_LINK);
      if (view == null) {
        // Header and spacer rows
        continue;
      }

      String title = view.hasAttr("title") ? view.attr("title").trim() : view.text().trim();
      Element torrent = row.selectFirst(TORRENT_LINK);
      Element magnet = row.selectFirst(MAGNET_LINK);
      if (title.isEmpty() || (torrent == null && magnet == null)) {
        skipped++;
        continue;
      }

      String magnetLink = magnet != null ? magnet.attr("href") : null;
      items.add(baseItem(title, position++)
          .viewUrl(absolute(view.attr("href")))
          .torrentLink(torrent != null ? absolute(torrent.attr("href")) : null)
          .magnetLink(magnetLink)
          .infoHash(infoHashFromMagnet(magnetLink))
          .build());
    }
    return new FeedBatch(getName(), getOrigin(), List.copyOf(items), skipped);
  }
}
