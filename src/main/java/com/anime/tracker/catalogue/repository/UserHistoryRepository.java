package com.anime.tracker.catalogue.repository;

import com.anime.tracker.catalogue.model.UserHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserHistoryRepository extends JpaRepository<UserHistory, Long> {
    Optional<UserHistory> findByUserIdAndEpisodeSlug(Long userId, String episodeSlug);

    List<UserHistory> findAllByUserIdOrderByWatchedAtDescIdDesc(Long userId);

    long countByUserId(Long userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from UserHistory h where h.userId = :userId and h.episodeSlug = :episodeSlug")
    int deleteEntry(@Param("userId") Long userId, @Param("episodeSlug") String episodeSlug);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update UserHistory h
               set h.animeTitle = :title, h.thumbnail = :thumbnail
             where h.animeSlug = :animeSlug
            """)
    int refreshSnapshots(@Param("animeSlug") String animeSlug,
                         @Param("title") String title,
                         @Param("thumbnail") String thumbnail);
}
