package dev.animetracker.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * A parsed release that may match a tracked show. Lives for one poll cycle.
 */
@Data
@Builder
public class ReleaseCandidate {
    private String rawTitle;
    private String showGuess;
    private Integer season;
    private int episode;
    private boolean batch;
    private String group;
    private int resolution;

    // Info-hash when known, otherwise "torrent:" + the torrent URL
    private String contentId;

    // What gets handed to the download client: magnet link or torrent URL
    private String downloadUri;

    private String sourceName;
    private FeedOrigin origin;
    // First-seen order across all feeds of the show
    private int position;
    private Instant publishedAt;
}
