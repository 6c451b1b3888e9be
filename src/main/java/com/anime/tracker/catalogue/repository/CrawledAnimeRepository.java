package com.anime.tracker.catalogue.repository;

import com.anime.tracker.catalogue.model.CrawledAnime;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CrawledAnimeRepository extends JpaRepository<CrawledAnime, Long> {
    Optional<CrawledAnime> findBySlug(String slug);

    Optional<CrawledAnime> findByUrl(String url);

    List<CrawledAnime> findAllByOrderByTitleAsc();

    // Empty filter values match everything.
    @Query("""
            select c from CrawledAnime c
            where (:type = '' or lower(c.animeType) = lower(:type))
              and (:status = '' or lower(c.status) = lower(:status))
            """)
    Page<CrawledAnime> findFiltered(@Param("type") String type,
                                    @Param("status") String status,
                                    Pageable pageable);
}
