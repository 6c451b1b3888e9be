package com.anime.tracker.catalogue.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

/**
 * Watch history entry. Titles and thumbnail are a snapshot taken when the episode
 * was watched; they are not kept in sync with the catalogue.
 */
@Entity
@Table(
        name = "user_history",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_user_history_user_episode", columnNames = {"user_id", "episode_slug"})
        },
        indexes = {
                @Index(name = "idx_user_history_user_watched", columnList = "user_id, watched_at")
        }
)
@Data
@NoArgsConstructor
public class UserHistory {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @JsonIgnore
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(
            name = "user_id",
            insertable = false,
            updatable = false,
            foreignKey = @ForeignKey(name = "fk_user_history_user")
    )
    @OnDelete(action = OnDeleteAction.CASCADE)
    @JsonIgnore
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private UserAccount user;

    @Column(name = "episode_slug", nullable = false, length = 500)
    private String episodeSlug;

    @Column(name = "anime_slug", length = 500)
    private String animeSlug;

    @Column(length = 500)
    private String episodeTitle;

    @Column(length = 500)
    private String animeTitle;

    @Column(length = 1000)
    private String thumbnail;

    @Column(name = "watched_at", nullable = false)
    private Instant watchedAt;

    public UserHistory(Long userId, String episodeSlug) {
        this.userId = userId;
        this.episodeSlug = episodeSlug;
    }
}
