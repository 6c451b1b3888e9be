package com.anime.tracker.catalogue.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A playable source of one episode. {@code episodeUrl} is a lookup key by value,
 * deliberately without a foreign key: sources may outlive their episode until the
 * reconciliation pass removes them.
 */
@Entity
@Table(
        name = "video_sources",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uk_video_sources_episode_server_quality",
                        columnNames = {"episode_url", "server", "quality"}
                )
        },
        indexes = {
                @Index(name = "idx_video_sources_episode_url", columnList = "episode_url")
        }
)
@Data
@NoArgsConstructor
public class VideoSource {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @JsonIgnore
    private Long id;

    @Column(name = "episode_url", nullable = false, length = 1000)
    private String episodeUrl;

    @Column(name = "server", nullable = false, length = 100)
    private String server = "";

    @Column(name = "quality", nullable = false, length = 20)
    private String quality = "";

    @Column(length = 2000)
    private String url;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public VideoSource(String episodeUrl, String server, String quality) {
        this.episodeUrl = episodeUrl;
        this.server = server;
        this.quality = quality;
    }
}
