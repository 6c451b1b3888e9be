package com.anime.tracker.catalogue.api;

import com.anime.tracker.catalogue.model.BatchJobView;
import com.anime.tracker.catalogue.model.BatchStartResponse;
import com.anime.tracker.catalogue.service.BatchControlService;
import com.anime.tracker.catalogue.service.FreshnessCoordinator;
import com.anime.tracker.catalogue.service.IdentityStore;
import com.anime.tracker.catalogue.service.VideoSourceReconciler;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Operator endpoints: catalogue crawl jobs, cache ledger reset and the reconciliation pass.
 */
@RestController
@RequestMapping("/api/admin")
public class CatalogueAdminController {
    private final BatchControlService batchControlService;
    private final FreshnessCoordinator freshnessCoordinator;
    private final VideoSourceReconciler videoSourceReconciler;
    private final IdentityStore identityStore;

    public CatalogueAdminController(BatchControlService batchControlService,
                                    FreshnessCoordinator freshnessCoordinator,
                                    VideoSourceReconciler videoSourceReconciler,
                                    IdentityStore identityStore) {
        this.batchControlService = batchControlService;
        this.freshnessCoordinator = freshnessCoordinator;
        this.videoSourceReconciler = videoSourceReconciler;
        this.identityStore = identityStore;
    }

    @GetMapping("/jobs")
    public List<BatchJobView> listJobs() {
        return batchControlService.listJobs();
    }

    @GetMapping("/jobs/{jobName}")
    public BatchJobView getJob(@PathVariable String jobName) {
        return batchControlService.getJob(jobName);
    }

    @PostMapping("/jobs/{jobName}/start")
    public BatchStartResponse startJob(@PathVariable String jobName) throws Exception {
        return batchControlService.startJob(jobName);
    }

    @PostMapping("/jobs/{jobName}/stop")
    public BatchStartResponse stopJob(@PathVariable String jobName) throws Exception {
        return batchControlService.stopJob(jobName);
    }

    @DeleteMapping("/cache")
    public Map<String, Integer> invalidateAll() {
        return Map.of("invalidated", freshnessCoordinator.invalidateAll());
    }

    @PostMapping("/reconcile")
    public Map<String, Integer> reconcile() {
        return Map.of(
                "orphanedSources", videoSourceReconciler.collectOrphans(),
                "purgedTokens", identityStore.purgeExpiredTokens());
    }
}
