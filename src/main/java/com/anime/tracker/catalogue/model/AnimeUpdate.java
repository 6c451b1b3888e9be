package com.anime.tracker.catalogue.model;

import com.anime.tracker.catalogue.crawler.Slugs;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One entry of the latest-episodes feed, keyed by the episode url.
 */
@Entity
@Table(
        name = "anime_updates",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_anime_updates_episode_url", columnNames = {"episode_url"})
        }
)
@Data
@NoArgsConstructor
public class AnimeUpdate {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @JsonIgnore
    private Long id;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(name = "episode_url", nullable = false, length = 1000)
    private String episodeUrl;

    @Column(length = 1000)
    private String thumbnail;

    @Column(length = 50)
    private String episodeNumber;

    @Column(name = "type", length = 50)
    private String animeType;

    @Column(length = 500)
    private String seriesTitle;

    @Column(length = 1000)
    private String seriesUrl;

    @Column(length = 50)
    private String status;

    @Column(length = 200)
    private String releaseInfo;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public String getSlug() {
        return Slugs.fromUrl(seriesUrl);
    }
}
