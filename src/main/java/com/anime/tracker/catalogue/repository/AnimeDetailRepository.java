package com.anime.tracker.catalogue.repository;

import com.anime.tracker.catalogue.model.AnimeDetail;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AnimeDetailRepository extends JpaRepository<AnimeDetail, Long> {
    Optional<AnimeDetail> findBySlug(String slug);

    Optional<AnimeDetail> findByUrl(String url);

    boolean existsBySlug(String slug);

    // Bulk delete so the database-level cascade removes the episodes.
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from AnimeDetail a where a.slug = :slug")
    int deleteBySlug(@Param("slug") String slug);
}
