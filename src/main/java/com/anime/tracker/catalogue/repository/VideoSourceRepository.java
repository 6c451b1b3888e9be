package com.anime.tracker.catalogue.repository;

import com.anime.tracker.catalogue.model.VideoSource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface VideoSourceRepository extends JpaRepository<VideoSource, Long> {
    Optional<VideoSource> findByEpisodeUrlAndServerAndQuality(String episodeUrl, String server, String quality);

    List<VideoSource> findAllByEpisodeUrlOrderByIdAsc(String episodeUrl);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from VideoSource v where v.episodeUrl = :episodeUrl")
    int deleteByEpisodeUrl(@Param("episodeUrl") String episodeUrl);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            delete from VideoSource v
            where v.episodeUrl not in (select e.url from Episode e)
            """)
    int deleteOrphans();
}
