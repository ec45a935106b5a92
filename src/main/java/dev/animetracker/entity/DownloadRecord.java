package dev.animetracker.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Entity for every download attempt handed to the download client.
 * At most one SUCCESS row exists per (show, episode); FAILED rows may repeat.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "download_history", indexes = {
        @Index(name = "idx_history_show_episode", columnList = "showId, episode"),
        @Index(name = "idx_history_content", columnList = "contentId"),
        @Index(name = "idx_history_created_at", columnList = "createdAt")
})
public class DownloadRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long showId;

    @Column(nullable = false)
    private int episode;

    @Column(nullable = false, length = 2048)
    private String contentId;

    @Column(length = 4096)
    private String downloadUri;

    @Column(nullable = false, length = 1024)
    private String title;

    private String sourceName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DownloadOutcome outcome;

    @Column(length = 1000)
    private String message;

    @Column(nullable = false)
    private LocalDateTime createdAt;
}
