package com.anime.tracker.catalogue.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Ledger row: when the content behind {@code cacheKey} was last refreshed successfully.
 */
@Entity
@Table(
        name = "cache_metadata",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_cache_metadata_key", columnNames = {"cache_key"})
        }
)
@Data
@NoArgsConstructor
public class CacheMetadata {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "cache_key", nullable = false, length = 500)
    private String cacheKey;

    @Column(nullable = false)
    private Instant lastFetched;

    @Column(nullable = false)
    private Instant createdAt;

    public CacheMetadata(String cacheKey, Instant lastFetched) {
        this.cacheKey = cacheKey;
        this.lastFetched = lastFetched;
        this.createdAt = lastFetched;
    }
}
