package com.anime.tracker.catalogue.model;

import com.anime.tracker.catalogue.crawler.Slugs;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(
        name = "completed_anime",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_completed_anime_url", columnNames = {"url"})
        }
)
@Data
@NoArgsConstructor
public class CompletedAnime {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @JsonIgnore
    private Long id;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(name = "url", nullable = false, length = 1000)
    private String url;

    @Column(length = 1000)
    private String thumbnail;

    @Column(name = "type", length = 50)
    private String animeType;

    @Column(length = 50)
    private String episodeCount;

    @Column(length = 50)
    private String status;

    @Column(length = 100)
    private String postedBy;

    @Column(length = 100)
    private String postedAt;

    @Column(length = 500)
    private String seriesTitle;

    @Column(length = 1000)
    private String seriesUrl;

    @Convert(converter = StringListConverter.class)
    @Column(length = 2000)
    private List<String> genres = new ArrayList<>();

    @Column(length = 20)
    private String rating;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public String getSlug() {
        return Slugs.fromUrl(url);
    }
}
