package dev.animetracker.source.impl;

import dev.animetracker.config.FeedsConfig;
import dev.animetracker.entity.TrackedShow;
import dev.animetracker.metrics.TrackerMetrics;
import dev.animetracker.model.FeedBatch;
import dev.animetracker.model.FeedOrigin;
import dev.animetracker.model.FeedRequest;
import dev.animetracker.model.RawItem;
import dev.animetracker.parser.TitleNormalizer;
import lombok.extern.slf4j.Slf4j;
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
 * Nyaa search RSS. The query is the uploader followed by the show title stripped of season
 * suffixes, the same way the site's own search box is used.
 */
@Slf4j
@Component
public class NyaaRssSource extends AbstractFeedSource {

  public static final String ID = "nyaa";

  public NyaaRssSource(WebClient.Builder webClientBuilder, TrackerMetrics metrics, FeedsConfig feedsConfig) {
    super(webClientBuilder, metrics, feedsConfig);
  }

  @Override
  public String getId() {
    return ID;
  }

  @Override
  public String getName() {
    return "Nyaa";
  }

  @Override
  public FeedOrigin getOrigin() {
    return FeedOrigin.RSS;
  }

  @Override
  public FeedRequest requestFor(TrackedShow show) {
    String title = TitleNormalizer.normalizeForSearch(show.getTitle());
    String uploader = show.getUploader() == null ? "" : show.getUploader().trim();
    String query = uploader.isEmpty() ? title : uploader + " " + title;
    return new FeedRequest(ID, query, uploader.isEmpty() ? null : uploader, 0);
  }

  @Override
  protected URI buildUri(FeedRequest request) {
    return UriComponentsBuilder.fromUriString(feedsConfig.getNyaaUrl())
        .path("/")
        .queryParam("page", "rss")
        .queryParam("q", request.query())
        .queryParam("c", feedsConfig.getNyaaCategory())
        .queryParam("f", 0)
        .encode()
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
      items.add(baseItem(title, position++)
          .torrentLink(link)
          .viewUrl(childText(item, "guid"))
          .infoHash(childText(item, "nyaa:infoHash").toLowerCase(Locale.ROOT))
          .seeders(parseIntOrZero(childText(item, "nyaa:seeders")))
          .size(childText(item, "nyaa:size"))
          .publishedAt(parsePubDate(childText(item, "pubDate")))
          .build());
    }
    return new FeedBatch(getName(), getOrigin(), List.copyOf(items), skipped);
  }
}
