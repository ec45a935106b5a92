package dev.animetracker.source.impl;

import dev.animetracker.config.FeedsConfig;
import dev.animetracker.config.TrackerProperties;
import dev.animetracker.entity.TrackedShow;
import dev.animetracker.metrics.TrackerMetrics;
import dev.animetracker.model.FeedBatch;
import dev.animetracker.model.FeedOrigin;
import dev.animetracker.model.FeedRequest;
import dev.animetracker.model.RawItem;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * SubsPlease direct RSS. One feed per resolution carries every show, so all shows at the same
 * resolution share a single fetch per cycle and are told apart by title matching downstream.
 */
@Slf4j
@Component
public class SubsPleaseRssSource extends AbstractFeedSource {

  public static final String ID = "subsplease";

  private final TrackerProperties trackerProperties;

  public SubsPleaseRssSource(WebClient.Builder webClientBuilder, TrackerMetrics metrics, FeedsConfig feedsConfig,
      TrackerProperties trackerProperties) {
    super(webClientBuilder, metrics, feedsConfig);
    this.trackerProperties = trackerProperties;
  }

  @Override
  public String getId() {
    return ID;
  }

  @Override
  public String getName() {
    return "SubsPlease";
  }

  @Override
  public FeedOrigin getOrigin() {
    return FeedOrigin.RSS;
  }

  @Override
  public FeedRequest requestFor(TrackedShow show) {
    int resolution = show.getMinResolution() != null
        ? show.getMinResolution()
        : trackerProperties.getDefaultMinResolution();
    return new FeedRequest(ID, null, null, resolution);
  }

  @Override
  protected URI buildUri(FeedRequest request) {
    // The feed expects a bare "t" flag for torrent links
    return UriComponentsBuilder.fromUriString(feedsConfig.getSubsPleaseUrl())
        .path("/rss/")
        .query("t")
        .queryParam("r", request.resolution())
        .build()
        .toUri();
  }

  @Override
  protected FeedBatch parse(String body, FeedRequest request) {
    Document doc = parseRss(body);
    List<RawItem> items = new ArrayList<>();
    int skipped = 0;
    int position = 0;

    for (Element item : doc.getElementsByTag("item")) {
      String title = childText(item, "title");
      String link = childText(item, "link");
      if (title.isEmpty() || link.isEmpty()) {
        skipped++;
        continue;
      }

      RawItem.RawItemBuilder builder = baseItem(title, position++)
          .publishedAt(parsePubDate(childText(item, "pubDate")));

      if (link.startsWith("magnet:")) {
        builder.magnetLink(link).infoHash(infoHashFromMagnet(link));
      } else if (link.contains("/view/")) {
        // Links to the Nyaa page of the release; the torrent lives under /download/
        String id = link.substring(link.lastIndexOf('/') + 1);
        builder.viewUrl(link).torrentLink(absolute("/download/" + id + ".torrent"));
      } else {
        builder.torrentLink(link);
      }
      items.add(builder.build());
    }
    return new FeedBatch(getName(), getOrigin(), List.copyOf(items), skipped);
  }
}
