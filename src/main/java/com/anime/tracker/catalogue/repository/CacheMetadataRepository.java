package com.anime.tracker.catalogue.repository;

import com.anime.tracker.catalogue.model.CacheMetadata;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CacheMetadataRepository extends JpaRepository<CacheMetadata, Long> {
    Optional<CacheMetadata> findByCacheKey(String cacheKey);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from CacheMetadata c where c.cacheKey = :cacheKey")
    int deleteByCacheKey(@Param("cacheKey") String cacheKey);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from CacheMetadata c")
    int deleteAllEntries();
}
