package dev.animetracker.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * A release listing normalized from any feed format, before title parsing.
 */
@Data
@Builder
public class RawItem {
    private String title;
    private String torrentLink;
    private String viewUrl;
    private String magnetLink;
    private String infoHash;
    private Instant publishedAt;

    // Release group, explicit from the feed or detected from the title
    private String group;

    private int seeders;
    private String size;

    private String sourceName;
    private FeedOrigin origin;

    // Position in its own feed
    private int position;
}
