package com.anime.tracker.catalogue.service;

import com.anime.tracker.catalogue.model.CacheKey;
import com.anime.tracker.catalogue.model.CacheMetadata;
import com.anime.tracker.catalogue.repository.CacheMetadataRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Records when each cache key was last refreshed successfully. Rows are created on
 * the first refresh, updated on later ones and removed only by explicit invalidation.
 */
@Service
public class CacheLedger {
    private final CacheMetadataRepository cacheMetadataRepository;

    public CacheLedger(CacheMetadataRepository cacheMetadataRepository) {
        this.cacheMetadataRepository = cacheMetadataRepository;
    }

    @Transactional(readOnly = true)
    public Optional<Instant> lastFetched(CacheKey key) {
        return cacheMetadataRepository.findByCacheKey(key.render())
                .map(CacheMetadata::getLastFetched);
    }

    /**
     * Fresh when an entry exists and {@code now - lastFetched <= maxAge}. A non-positive
     * max age is never fresh.
     */
    @Transactional(readOnly = true)
    public boolean isFresh(CacheKey key, Duration maxAge, Instant now) {
        return lastFetched(key)
                .map(fetched -> isWithin(fetched, maxAge, now))
                .orElse(false);
    }

    static boolean isWithin(Instant lastFetched, Duration maxAge, Instant now) {
        if (maxAge == null || maxAge.isZero() || maxAge.isNegative()) {
            return false;
        }
        return Duration.between(lastFetched, now).compareTo(maxAge) <= 0;
    }

    @Transactional
    public CacheMetadata markFetched(CacheKey key, Instant fetchedAt) {
        CacheMetadata entry = cacheMetadataRepository.findByCacheKey(key.render())
                .orElseGet(() -> new CacheMetadata(key.render(), fetchedAt));
        entry.setLastFetched(fetchedAt);
        return cacheMetadataRepository.save(entry);
    }

    @Transactional
    public boolean invalidate(CacheKey key) {
        return cacheMetadataRepository.deleteByCacheKey(key.render()) > 0;
    }

    @Transactional
    public int invalidateAll() {
        return cacheMetadataRepository.deleteAllEntries();
    }
}
