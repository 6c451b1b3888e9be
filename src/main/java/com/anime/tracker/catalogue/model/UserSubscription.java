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

@Entity
@Table(
        name = "user_subscriptions",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_user_subscriptions_user_anime", columnNames = {"user_id", "anime_slug"})
        }
)
@Data
@NoArgsConstructor
public class UserSubscription {
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
            foreignKey = @ForeignKey(name = "fk_user_subscriptions_user")
    )
    @OnDelete(action = OnDeleteAction.CASCADE)
    @JsonIgnore
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private UserAccount user;

    @Column(name = "anime_slug", nullable = false, length = 500)
    private String animeSlug;

    @Column(length = 500)
    private String animeTitle;

    @Column(length = 1000)
    private String thumbnail;

    @Column(nullable = false)
    private Instant createdAt;
}
