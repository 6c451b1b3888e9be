package com.anime.tracker.catalogue.batch;

import com.anime.tracker.catalogue.service.IdentityStore;
import com.anime.tracker.catalogue.service.VideoSourceReconciler;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "app.gc", name = "enabled", havingValue = "true")
public class ReconciliationScheduler {
    private final VideoSourceReconciler videoSourceReconciler;
    private final IdentityStore identityStore;

    public ReconciliationScheduler(VideoSourceReconciler videoSourceReconciler, IdentityStore identityStore) {
        this.videoSourceReconciler = videoSourceReconciler;
        this.identityStore = identityStore;
    }

    @Scheduled(cron = "${app.gc.cron:0 30 3 * * *}", zone = "${app.gc.zone:UTC}")
    public void runReconciliation() {
        videoSourceReconciler.collectOrphans();
        identityStore.purgeExpiredTokens();
    }
}
