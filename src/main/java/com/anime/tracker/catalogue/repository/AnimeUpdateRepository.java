package com.anime.tracker.catalogue.repository;

import com.anime.tracker.catalogue.model.AnimeUpdate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AnimeUpdateRepository extends JpaRepository<AnimeUpdate, Long> {
    Optional<AnimeUpdate> findByEpisodeUrl(String episodeUrl);

    List<AnimeUpdate> findAllByOrderByUpdatedAtDescIdAsc();
}
