package dev.animetracker.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A show the user asked to track.
 * The tracker only ever moves {@code lastDownloadedEpisode} forward, and only after a confirmed download.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "tracked_shows", indexes = {
        @Index(name = "idx_show_title", columnList = "title", unique = true)
})
public class TrackedShow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String title;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "show_aliases", joinColumns = @JoinColumn(name = "show_id"))
    @Column(name = "alias")
    private Set<String> aliases = new LinkedHashSet<>();

    @Builder.Default
    @Column(nullable = false)
    private int season = 1;

    // Feed source ids, in the order they are queried
    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "show_feeds", joinColumns = @JoinColumn(name = "show_id"))
    @OrderColumn(name = "position")
    @Column(name = "source_id")
    private List<String> feedSources = new ArrayList<>();

    private String uploader;

    // Null means the configured default
    private Integer minResolution;

    private String preferredGroup;

    // Watermark at creation time; episodes at or below it count as owned
    @Column(nullable = false)
    private int baselineEpisode;

    @Column(nullable = false)
    private int lastDownloadedEpisode;

    private String lastDownloadedHash;

    @Builder.Default
    @Column(nullable = false)
    private boolean enabled = true;

    private String downloadPath;

    // Names of global rules switched off for this show
    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "show_disabled_rules", joinColumns = @JoinColumn(name = "show_id"))
    @Column(name = "rule_name")
    private Set<String> disabledRules = new LinkedHashSet<>();

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /**
     * Advance the watermark, never moving it backwards.
     */
    public void advanceWatermark(int episode, String contentId) {
        if (episode > lastDownloadedEpisode) {
            lastDownloadedEpisode = episode;
            lastDownloadedHash = contentId;
        }
    }
}
