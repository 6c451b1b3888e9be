package com.anime.tracker.catalogue.batch;

import com.anime.tracker.catalogue.crawler.ListingItemPayload;
import com.anime.tracker.catalogue.exception.CatalogueException;
import com.anime.tracker.catalogue.exception.DuplicateKeyConflictException;
import com.anime.tracker.catalogue.model.CacheKey;
import com.anime.tracker.catalogue.model.CrawledAnime;
import com.anime.tracker.catalogue.service.CatalogueStore;
import com.anime.tracker.catalogue.service.FreshnessCoordinator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Slf4j
@Component
public class CatalogueListingProcessor implements ItemProcessor<ListingItemPayload, CrawledAnime> {
    private final CatalogueStore catalogueStore;
    private final FreshnessCoordinator freshnessCoordinator;

    @Value("${app.crawl.include-details:false}")
    private boolean includeDetails;

    @Value("${app.cache.max-age.anime-minutes:60}")
    private long animeMaxAgeMinutes;

    public CatalogueListingProcessor(CatalogueStore catalogueStore, FreshnessCoordinator freshnessCoordinator) {
        this.catalogueStore = catalogueStore;
        this.freshnessCoordinator = freshnessCoordinator;
    }

    @Override
    public CrawledAnime process(ListingItemPayload item) {
        if (item.url() == null || item.url().isBlank() || item.title() == null || item.title().isBlank()) {
            log.warn("Skipping listing item without url or title: {}", item.slug());
            return null;
        }

        CrawledAnime crawled;
        try {
            crawled = catalogueStore.upsertCrawledAnime(item);
        } catch (DuplicateKeyConflictException ex) {
            log.warn("Skipping listing item {}: {}", item.slug(), ex.getMessage());
            return null;
        }

        if (includeDetails) {
            refreshDetail(item.slug());
        }
        return crawled;
    }

    private void refreshDetail(String slug) {
        try {
            freshnessCoordinator.ensureFresh(CacheKey.anime(slug), Duration.ofMinutes(animeMaxAgeMinutes));
        } catch (CatalogueException ex) {
            log.warn("Detail refresh failed for {}, continuing: {}", slug, ex.getMessage());
        }
    }
}
