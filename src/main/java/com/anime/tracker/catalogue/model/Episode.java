package com.anime.tracker.catalogue.model;

import com.anime.tracker.catalogue.crawler.Slugs;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

@Entity
@Table(
        name = "episodes",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_episodes_url", columnNames = {"url"})
        },
        indexes = {
                @Index(name = "idx_episodes_anime_slug", columnList = "anime_slug")
        }
)
@Data
@NoArgsConstructor
public class Episode {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @JsonIgnore
    private Long id;

    @Column(name = "anime_slug", nullable = false, length = 500)
    private String animeSlug;

    // Read-only view of the owning anime; carries the cascading foreign key.
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(
            name = "anime_slug",
            referencedColumnName = "slug",
            insertable = false,
            updatable = false,
            foreignKey = @ForeignKey(name = "fk_episodes_anime_slug")
    )
    @OnDelete(action = OnDeleteAction.CASCADE)
    @JsonIgnore
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private AnimeDetail anime;

    @Column(length = 20)
    private String number;

    @Column(length = 500)
    private String title;

    @Column(name = "url", nullable = false, length = 1000)
    private String url;

    @Column(length = 100)
    private String releaseDate;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public Episode(String animeSlug, String url) {
        this.animeSlug = animeSlug;
        this.url = url;
    }

    public String getSlug() {
        return Slugs.fromUrl(url);
    }
}
