package com.anime.tracker.catalogue.api;

import com.anime.tracker.catalogue.model.AnimeSnapshot;
import com.anime.tracker.catalogue.model.HistorySnapshot;
import com.anime.tracker.catalogue.model.UserFavorite;
import com.anime.tracker.catalogue.model.UserHistory;
import com.anime.tracker.catalogue.model.UserSubscription;
import com.anime.tracker.catalogue.service.IdentityStore;
import com.anime.tracker.catalogue.service.UserRelationStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Per-user library. The user id comes from the upstream auth gateway; nothing here
 * authenticates.
 */
@RestController
@RequestMapping("/api/users/{userId}")
public class UserLibraryController {
    private final UserRelationStore userRelationStore;
    private final IdentityStore identityStore;

    public UserLibraryController(UserRelationStore userRelationStore, IdentityStore identityStore) {
        this.userRelationStore = userRelationStore;
        this.identityStore = identityStore;
    }

    @GetMapping("/history")
    public List<UserHistory> getHistory(@PathVariable Long userId) {
        return userRelationStore.getHistory(userId);
    }

    @PostMapping("/history")
    public UserHistory recordHistory(@PathVariable Long userId, @RequestBody HistorySnapshot snapshot) {
        return userRelationStore.recordHistory(userId, snapshot);
    }

    @DeleteMapping("/history/{episodeSlug}")
    public ResponseEntity<Void> removeHistory(@PathVariable Long userId, @PathVariable String episodeSlug) {
        return noContentOrNotFound(userRelationStore.removeHistory(userId, episodeSlug));
    }

    @GetMapping("/favorites")
    public List<UserFavorite> getFavorites(@PathVariable Long userId) {
        return userRelationStore.getFavorites(userId);
    }

    @GetMapping("/favorites/{animeSlug}")
    public Map<String, Boolean> isFavorite(@PathVariable Long userId, @PathVariable String animeSlug) {
        return Map.of("favorite", userRelationStore.isFavorite(userId, animeSlug));
    }

    @PostMapping("/favorites")
    public UserFavorite addFavorite(@PathVariable Long userId, @RequestBody AnimeSnapshot snapshot) {
        return userRelationStore.addFavorite(userId, snapshot);
    }

    @DeleteMapping("/favorites/{animeSlug}")
    public ResponseEntity<Void> removeFavorite(@PathVariable Long userId, @PathVariable String animeSlug) {
        return noContentOrNotFound(userRelationStore.removeFavorite(userId, animeSlug));
    }

    @GetMapping("/subscriptions")
    public List<UserSubscription> getSubscriptions(@PathVariable Long userId) {
        return userRelationStore.getSubscriptions(userId);
    }

    @GetMapping("/subscriptions/{animeSlug}")
    public Map<String, Boolean> isSubscribed(@PathVariable Long userId, @PathVariable String animeSlug) {
        return Map.of("subscribed", userRelationStore.isSubscribed(userId, animeSlug));
    }

    @PostMapping("/subscriptions")
    public UserSubscription subscribe(@PathVariable Long userId, @RequestBody AnimeSnapshot snapshot) {
        return userRelationStore.subscribe(userId, snapshot);
    }

    @DeleteMapping("/subscriptions/{animeSlug}")
    public ResponseEntity<Void> unsubscribe(@PathVariable Long userId, @PathVariable String animeSlug) {
        return noContentOrNotFound(userRelationStore.unsubscribe(userId, animeSlug));
    }

    @DeleteMapping
    public ResponseEntity<Void> deleteUser(@PathVariable Long userId) {
        return noContentOrNotFound(identityStore.deleteUser(userId));
    }

    private static ResponseEntity<Void> noContentOrNotFound(boolean removed) {
        return removed ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }
}
