package com.anime.tracker.catalogue.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical detail record of one anime. {@code slug} and {@code url} are identity
 * fields and never change after the first insert.
 */
@Entity
@Table(
        name = "anime_details",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_anime_details_slug", columnNames = {"slug"}),
                @UniqueConstraint(name = "uk_anime_details_url", columnNames = {"url"})
        }
)
@Data
@NoArgsConstructor
public class AnimeDetail implements Serializable {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @JsonIgnore
    private Long id;

    @Column(name = "slug", nullable = false, length = 500)
    private String slug;

    @Column(name = "url", length = 1000)
    private String url;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(length = 2000)
    private String alternateTitles;

    @Column(length = 1000)
    private String poster;

    @Column(length = 20)
    private String rating;

    @Column(length = 1000)
    private String trailerUrl;

    @Column(length = 50)
    private String status;

    @Column(length = 200)
    private String studio;

    @Column(length = 100)
    private String releaseDate;

    @Column(length = 50)
    private String duration;

    @Column(length = 100)
    private String season;

    @Column(name = "type", length = 50)
    private String animeType;

    @Column(length = 50)
    private String totalEpisodes;

    @Column(length = 200)
    private String director;

    @Convert(converter = StringListConverter.class)
    @Column(length = 4000)
    private List<String> casts = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(length = 2000)
    private List<String> genres = new ArrayList<>();

    @Column(length = 20000)
    private String synopsis;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public AnimeDetail(String slug, String url) {
        this.slug = slug;
        this.url = url;
    }
}
