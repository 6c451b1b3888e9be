package com.anime.tracker.catalogue.service;

import com.anime.tracker.catalogue.exception.ForeignKeyViolationException;
import com.anime.tracker.catalogue.model.AnimeSnapshot;
import com.anime.tracker.catalogue.model.HistorySnapshot;
import com.anime.tracker.catalogue.model.UserFavorite;
import com.anime.tracker.catalogue.model.UserHistory;
import com.anime.tracker.catalogue.model.UserSubscription;
import com.anime.tracker.catalogue.repository.UserAccountRepository;
import com.anime.tracker.catalogue.repository.UserFavoriteRepository;
import com.anime.tracker.catalogue.repository.UserHistoryRepository;
import com.anime.tracker.catalogue.repository.UserSubscriptionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;
import java.util.function.Supplier;

/**
 * Per-user history, favorites and subscriptions. Rows hold a snapshot of titles and
 * thumbnails and are never checked against the catalogue; only the user must exist.
 * <p>
 * Writes keyed by {@code (user, slug)} run in their own transaction. When a concurrent
 * call inserts the same key first, the write is retried once and lands on that row.
 */
@Slf4j
@Service
public class UserRelationStore {
    private final UserAccountRepository userAccountRepository;
    private final UserHistoryRepository userHistoryRepository;
    private final UserFavoriteRepository userFavoriteRepository;
    private final UserSubscriptionRepository userSubscriptionRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public UserRelationStore(UserAccountRepository userAccountRepository,
                             UserHistoryRepository userHistoryRepository,
                             UserFavoriteRepository userFavoriteRepository,
                             UserSubscriptionRepository userSubscriptionRepository,
                             PlatformTransactionManager transactionManager,
                             Clock clock) {
        this.userAccountRepository = userAccountRepository;
        this.userHistoryRepository = userHistoryRepository;
        this.userFavoriteRepository = userFavoriteRepository;
        this.userSubscriptionRepository = userSubscriptionRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    /**
     * Records a watch. Re-watching the same episode moves it to the top and refreshes
     * the snapshot instead of adding a row.
     */
    public UserHistory recordHistory(Long userId, HistorySnapshot snapshot) {
        String episodeSlug = requireSlug(snapshot.episodeSlug());
        return upsertWithRetry("history " + userId + "/" + episodeSlug, () -> {
            requireUser(userId);
            UserHistory entry = userHistoryRepository.findByUserIdAndEpisodeSlug(userId, episodeSlug)
                    .orElseGet(() -> new UserHistory(userId, episodeSlug));
            entry.setAnimeSlug(snapshot.animeSlug());
            entry.setEpisodeTitle(snapshot.episodeTitle());
            entry.setAnimeTitle(snapshot.animeTitle());
            entry.setThumbnail(snapshot.thumbnail());
            entry.setWatchedAt(clock.instant());
            return userHistoryRepository.saveAndFlush(entry);
        });
    }

    @Transactional
    public boolean removeHistory(Long userId, String episodeSlug) {
        return userHistoryRepository.deleteEntry(userId, episodeSlug) > 0;
    }

    @Transactional(readOnly = true)
    public List<UserHistory> getHistory(Long userId) {
        return userHistoryRepository.findAllByUserIdOrderByWatchedAtDescIdDesc(userId);
    }

    /**
     * @return the new favorite, or the existing one unchanged when already favorited
     */
    public UserFavorite addFavorite(Long userId, AnimeSnapshot snapshot) {
        String animeSlug = requireSlug(snapshot.animeSlug());
        return upsertWithRetry("favorite " + userId + "/" + animeSlug, () -> {
            requireUser(userId);
            return userFavoriteRepository.findByUserIdAndAnimeSlug(userId, animeSlug)
                    .orElseGet(() -> {
                        UserFavorite favorite = new UserFavorite();
                        favorite.setUserId(userId);
                        favorite.setAnimeSlug(animeSlug);
                        favorite.setAnimeTitle(snapshot.animeTitle());
                        favorite.setThumbnail(snapshot.thumbnail());
                        favorite.setCreatedAt(clock.instant());
                        return userFavoriteRepository.saveAndFlush(favorite);
                    });
        });
    }

    @Transactional
    public boolean removeFavorite(Long userId, String animeSlug) {
        return userFavoriteRepository.deleteEntry(userId, animeSlug) > 0;
    }

    @Transactional(readOnly = true)
    public boolean isFavorite(Long userId, String animeSlug) {
        return userFavoriteRepository.existsByUserIdAndAnimeSlug(userId, animeSlug);
    }

    @Transactional(readOnly = true)
    public List<UserFavorite> getFavorites(Long userId) {
        return userFavoriteRepository.findAllByUserIdOrderByCreatedAtDescIdDesc(userId);
    }

    public UserSubscription subscribe(Long userId, AnimeSnapshot snapshot) {
        String animeSlug = requireSlug(snapshot.animeSlug());
        return upsertWithRetry("subscription " + userId + "/" + animeSlug, () -> {
            requireUser(userId);
            return userSubscriptionRepository.findByUserIdAndAnimeSlug(userId, animeSlug)
                    .orElseGet(() -> {
                        UserSubscription subscription = new UserSubscription();
                        subscription.setUserId(userId);
                        subscription.setAnimeSlug(animeSlug);
                        subscription.setAnimeTitle(snapshot.animeTitle());
                        subscription.setThumbnail(snapshot.thumbnail());
                        subscription.setCreatedAt(clock.instant());
                        return userSubscriptionRepository.saveAndFlush(subscription);
                    });
        });
    }

    @Transactional
    public boolean unsubscribe(Long userId, String animeSlug) {
        return userSubscriptionRepository.deleteEntry(userId, animeSlug) > 0;
    }

    @Transactional(readOnly = true)
    public boolean isSubscribed(Long userId, String animeSlug) {
        return userSubscriptionRepository.existsByUserIdAndAnimeSlug(userId, animeSlug);
    }

    @Transactional(readOnly = true)
    public List<UserSubscription> getSubscriptions(Long userId) {
        return userSubscriptionRepository.findAllByUserIdOrderByCreatedAtDescIdDesc(userId);
    }

    /**
     * Rewrites the anime title and thumbnail snapshot in every history, favorite and
     * subscription row of {@code animeSlug}. Snapshots change only through this call.
     *
     * @return number of rows rewritten
     */
    @Transactional
    public int refreshSnapshots(String animeSlug, String title, String thumbnail) {
        int updated = userHistoryRepository.refreshSnapshots(animeSlug, title, thumbnail)
                + userFavoriteRepository.refreshSnapshots(animeSlug, title, thumbnail)
                + userSubscriptionRepository.refreshSnapshots(animeSlug, title, thumbnail);
        log.info("Refreshed {} user snapshots of {}", updated, animeSlug);
        return updated;
    }

    private <T> T upsertWithRetry(String entry, Supplier<T> upsert) {
        try {
            return transactionTemplate.execute(status -> upsert.get());
        } catch (DataIntegrityViolationException ex) {
            // The other writer has committed its row by now; the second pass finds it.
            log.debug("Concurrent insert of {}, retrying once: {}", entry, ex.getMostSpecificCause().getMessage());
            return transactionTemplate.execute(status -> upsert.get());
        }
    }

    private void requireUser(Long userId) {
        if (userId == null || !userAccountRepository.existsById(userId)) {
            throw new ForeignKeyViolationException("No user with id " + userId);
        }
    }

    private static String requireSlug(String slug) {
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("Slug must not be blank");
        }
        return slug.trim();
    }
}
