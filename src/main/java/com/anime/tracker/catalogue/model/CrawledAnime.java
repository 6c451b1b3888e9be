package com.anime.tracker.catalogue.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * What the bulk crawler last saw of an anime on the browse listing. Independent of
 * {@link AnimeDetail}'s lifecycle.
 */
@Entity
@Table(
        name = "crawled_anime",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_crawled_anime_slug", columnNames = {"slug"}),
                @UniqueConstraint(name = "uk_crawled_anime_url", columnNames = {"url"})
        },
        indexes = {
                @Index(name = "idx_crawled_anime_status", columnList = "status"),
                @Index(name = "idx_crawled_anime_type", columnList = "type")
        }
)
@Data
@NoArgsConstructor
public class CrawledAnime {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @JsonIgnore
    private Long id;

    @Column(name = "slug", nullable = false, length = 500)
    private String slug;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(name = "url", nullable = false, length = 1000)
    private String url;

    @Column(length = 1000)
    private String thumbnail;

    @Column(name = "status", length = 50)
    private String status;

    @Column(name = "type", length = 50)
    private String animeType;

    @Column(length = 50)
    private String episodeStatus;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;
}
