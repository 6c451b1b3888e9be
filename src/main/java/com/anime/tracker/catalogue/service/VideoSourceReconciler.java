package com.anime.tracker.catalogue.service;

import com.anime.tracker.catalogue.repository.VideoSourceRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Removes video sources whose episode no longer exists. Deleting an anime cascades to
 * its episodes but not to their sources; this pass collects those.
 */
@Slf4j
@Service
public class VideoSourceReconciler {
    private final VideoSourceRepository videoSourceRepository;

    public VideoSourceReconciler(VideoSourceRepository videoSourceRepository) {
        this.videoSourceRepository = videoSourceRepository;
    }

    @Transactional
    public int collectOrphans() {
        int removed = videoSourceRepository.deleteOrphans();
        log.info("Video source reconciliation removed {} orphaned sources", removed);
        return removed;
    }
}
