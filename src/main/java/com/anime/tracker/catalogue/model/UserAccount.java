package com.anime.tracker.catalogue.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(
        name = "users",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_users_email", columnNames = {"email"}),
                @UniqueConstraint(name = "uk_users_google_id", columnNames = {"google_id"})
        }
)
@Data
@NoArgsConstructor
public class UserAccount {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "email", nullable = false, length = 320)
    private String email;

    // Opaque hash produced by the auth subsystem; null for Google-only accounts.
    @JsonIgnore
    @Column(length = 255)
    private String passwordHash;

    @Column(length = 200)
    private String name;

    @Column(name = "google_id", length = 100)
    private String googleId;

    @Column(length = 1000)
    private String avatar;

    @Column(nullable = false)
    private boolean emailVerified;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;
}
