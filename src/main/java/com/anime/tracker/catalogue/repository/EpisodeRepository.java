package com.anime.tracker.catalogue.repository;

import com.anime.tracker.catalogue.model.Episode;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EpisodeRepository extends JpaRepository<Episode, Long> {
    Optional<Episode> findByUrl(String url);

    List<Episode> findAllByAnimeSlugOrderByIdAsc(String animeSlug);

    long countByAnimeSlug(String animeSlug);
}
