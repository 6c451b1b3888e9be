package com.anime.tracker.catalogue.api;

import com.anime.tracker.catalogue.model.BatchJobView;
import com.anime.tracker.catalogue.model.BatchStartResponse;
import com.anime.tracker.catalogue.service.BatchControlService;
import com.anime.tracker.catalogue.service.FreshnessCoordinator;
import com.anime.tracker.catalogue.service.IdentityStore;
import com.anime.tracker.catalogue.service.VideoSourceReconciler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CatalogueAdminController.class)
class CatalogueAdminControllerTest {
    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BatchControlService batchControlService;

    @MockBean
    private FreshnessCoordinator freshnessCoordinator;

    @MockBean
    private VideoSourceReconciler videoSourceReconciler;

    @MockBean
    private IdentityStore identityStore;

    @Test
    void listsJobs() throws Exception {
        given(batchControlService.listJobs()).willReturn(List.of(new BatchJobView(
                "catalogueCrawlJob", "Catalogue Crawl", false, null, "NEVER_RUN", null, null, null, 0, 0, 0, 0)));

        mockMvc.perform(get("/api/admin/jobs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].jobName").value("catalogueCrawlJob"))
                .andExpect(jsonPath("$[0].status").value("NEVER_RUN"));
    }

    @Test
    void startingARunningJobIs409() throws Exception {
        given(batchControlService.startJob("catalogueCrawlJob"))
                .willThrow(new IllegalStateException("Job is already running (executionId=3)"));

        mockMvc.perform(post("/api/admin/jobs/catalogueCrawlJob/start"))
                .andExpect(status().isConflict());
    }

    @Test
    void startsJob() throws Exception {
        given(batchControlService.startJob("catalogueCrawlJob"))
                .willReturn(new BatchStartResponse("catalogueCrawlJob", 4L, "Started"));

        mockMvc.perform(post("/api/admin/jobs/catalogueCrawlJob/start"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.executionId").value(4));
    }

    @Test
    void reportsReconciliationCounts() throws Exception {
        given(videoSourceReconciler.collectOrphans()).willReturn(5);
        given(identityStore.purgeExpiredTokens()).willReturn(2);

        mockMvc.perform(post("/api/admin/reconcile"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.orphanedSources").value(5))
                .andExpect(jsonPath("$.purgedTokens").value(2));
    }

    @Test
    void resetsTheCacheLedger() throws Exception {
        given(freshnessCoordinator.invalidateAll()).willReturn(7);

        mockMvc.perform(delete("/api/admin/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.invalidated").value(7));
    }
}
