package com.anime.tracker.catalogue.repository;

import com.anime.tracker.catalogue.model.CompletedAnime;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CompletedAnimeRepository extends JpaRepository<CompletedAnime, Long> {
    Optional<CompletedAnime> findByUrl(String url);

    List<CompletedAnime> findAllByOrderByUpdatedAtDescIdAsc();
}
