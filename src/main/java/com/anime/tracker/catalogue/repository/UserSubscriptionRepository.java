package com.anime.tracker.catalogue.repository;

import com.anime.tracker.catalogue.model.UserSubscription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserSubscriptionRepository extends JpaRepository<UserSubscription, Long> {
    Optional<UserSubscription> findByUserIdAndAnimeSlug(Long userId, String animeSlug);

    boolean existsByUserIdAndAnimeSlug(Long userId, String animeSlug);

    List<UserSubscription> findAllByUserIdOrderByCreatedAtDescIdDesc(Long userId);

    long countByUserId(Long userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from UserSubscription x where x.userId = :userId and x.animeSlug = :animeSlug")
    int deleteEntry(@Param("userId") Long userId, @Param("animeSlug") String animeSlug);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update UserSubscription x
               set x.animeTitle = :title, x.thumbnail = :thumbnail
             where x.animeSlug = :animeSlug
            """)
    int refreshSnapshots(@Param("animeSlug") String animeSlug,
                         @Param("title") String title,
                         @Param("thumbnail") String thumbnail);
}
