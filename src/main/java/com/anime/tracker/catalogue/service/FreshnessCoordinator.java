package com.anime.tracker.catalogue.service;

import com.anime.tracker.catalogue.crawler.AnimeCrawler;
import com.anime.tracker.catalogue.crawler.AnimeDetailPayload;
import com.anime.tracker.catalogue.crawler.AnimeUpdatePayload;
import com.anime.tracker.catalogue.crawler.CompletedAnimePayload;
import com.anime.tracker.catalogue.crawler.EpisodePayload;
import com.anime.tracker.catalogue.crawler.EpisodeSourcesPayload;
import com.anime.tracker.catalogue.crawler.ListingItemPayload;
import com.anime.tracker.catalogue.exception.CrawlFailureException;
import com.anime.tracker.catalogue.exception.CrawlTimeoutException;
import com.anime.tracker.catalogue.model.CacheKey;
import com.anime.tracker.catalogue.model.FreshnessOutcome;
import com.anime.tracker.catalogue.model.FreshnessResult;
import com.anime.tracker.catalogue.model.ListingQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decides per cache key whether stored content may be served or must be re-crawled.
 * <p>
 * A refresh crawls on the crawl executor with no transaction open, then applies every
 * upsert and the ledger write in one new transaction, ledger last. A failed crawl or
 * merge leaves the ledger as it was, so the next call crawls again. Content the store
 * rejects as malformed counts as a failed crawl. Concurrent misses
 * on one key may both crawl; their upserts converge.
 */
@Slf4j
@Service
public class FreshnessCoordinator {
    private final AnimeCrawler crawler;
    private final CatalogueStore catalogueStore;
    private final CacheLedger cacheLedger;
    private final ExecutorService crawlExecutor;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Duration defaultCrawlTimeout;

    public FreshnessCoordinator(AnimeCrawler crawler,
                                CatalogueStore catalogueStore,
                                CacheLedger cacheLedger,
                                @Qualifier("crawlExecutor") ExecutorService crawlExecutor,
                                PlatformTransactionManager transactionManager,
                                Clock clock,
                                @Value("${app.crawler.timeout-ms:60000}") long crawlTimeoutMs) {
        this.crawler = crawler;
        this.catalogueStore = catalogueStore;
        this.cacheLedger = cacheLedger;
        this.crawlExecutor = crawlExecutor;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
        this.defaultCrawlTimeout = Duration.ofMillis(crawlTimeoutMs);
    }

    public FreshnessResult ensureFresh(CacheKey key, Duration maxAge) {
        return ensureFresh(key, maxAge, defaultCrawlTimeout);
    }

    public FreshnessResult ensureFresh(CacheKey key, Duration maxAge, Duration crawlTimeout) {
        Optional<Instant> lastFetched = cacheLedger.lastFetched(key);
        if (lastFetched.isPresent() && CacheLedger.isWithin(lastFetched.get(), maxAge, clock.instant())) {
            log.debug("Cache hit for {} (last fetched {})", key, lastFetched.get());
            return new FreshnessResult(key, FreshnessOutcome.HIT, lastFetched.get());
        }

        Optional<Runnable> merge = crawlWithTimeout(key, crawlTimeout);
        if (merge.isEmpty()) {
            log.info("Crawler found nothing for {}", key);
            return new FreshnessResult(key, FreshnessOutcome.NOT_FOUND, lastFetched.orElse(null));
        }

        Instant refreshedAt = mergeWithRetry(key, merge.get());
        log.info("Refreshed {} at {}", key, refreshedAt);
        return new FreshnessResult(key, FreshnessOutcome.REFRESHED, refreshedAt);
    }

    public boolean isFresh(CacheKey key, Duration maxAge) {
        return cacheLedger.isFresh(key, maxAge, clock.instant());
    }

    public boolean invalidate(CacheKey key) {
        boolean removed = cacheLedger.invalidate(key);
        if (removed) {
            log.info("Invalidated cache entry {}", key);
        }
        return removed;
    }

    public int invalidateAll() {
        int removed = cacheLedger.invalidateAll();
        log.info("Invalidated {} cache entries", removed);
        return removed;
    }

    private Optional<Runnable> crawlWithTimeout(CacheKey key, Duration timeout) {
        Future<Optional<Runnable>> future;
        try {
            future = crawlExecutor.submit(() -> crawl(key));
        } catch (RejectedExecutionException ex) {
            log.warn("Crawl queue is full, rejecting {}", key);
            throw new CrawlFailureException("Crawl queue is full, rejected " + key, ex);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.error("Crawl for {} timed out after {}ms", key, timeout.toMillis());
            throw new CrawlTimeoutException(key.render(), timeout);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.error("Crawl for {} failed: {}", key, cause.getMessage());
            throw new CrawlFailureException("Crawl for " + key + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CrawlFailureException("Interrupted while crawling " + key, ex);
        }
    }

    /**
     * Fetches the content behind {@code key} and returns the store writes it calls for,
     * or empty when the source has nothing under that key.
     */
    private Optional<Runnable> crawl(CacheKey key) throws IOException {
        switch (key.namespace()) {
            case ANIME:
                return crawler.fetchAnimeDetail(key.id()).<Runnable>map(detail -> () -> mergeAnime(detail));
            case EPISODE_SOURCES:
                return crawler.fetchEpisodeSources(key.id()).<Runnable>map(episode -> () -> mergeEpisode(episode));
            case UPDATES: {
                List<AnimeUpdatePayload> updates = crawler.fetchUpdates();
                return updates.isEmpty() ? Optional.empty() : Optional.<Runnable>of(() -> mergeUpdates(updates));
            }
            case COMPLETED: {
                List<CompletedAnimePayload> completed = crawler.fetchCompleted();
                return completed.isEmpty() ? Optional.empty() : Optional.<Runnable>of(() -> mergeCompleted(completed));
            }
            case LISTING: {
                List<ListingItemPayload> items = crawler.fetchListing(ListingQuery.fromKeyId(key.id()));
                return items.isEmpty() ? Optional.empty() : Optional.<Runnable>of(() -> mergeListing(items));
            }
            default:
                throw new IllegalArgumentException("Unsupported cache namespace: " + key.namespace());
        }
    }

    private Instant mergeWithRetry(CacheKey key, Runnable merge) {
        try {
            return mergeOnce(key, merge);
        } catch (DataIntegrityViolationException ex) {
            // A concurrent refresh inserted the same natural key first; re-running now finds its rows.
            log.warn("Unique constraint race while merging {}, retrying once: {}", key, ex.getMostSpecificCause().getMessage());
            return mergeOnce(key, merge);
        } catch (IllegalArgumentException ex) {
            log.error("Crawled content for {} is malformed: {}", key, ex.getMessage());
            throw new CrawlFailureException("Crawled content for " + key + " is malformed: " + ex.getMessage(), ex);
        }
    }

    private Instant mergeOnce(CacheKey key, Runnable merge) {
        return transactionTemplate.execute(status -> {
            merge.run();
            Instant fetchedAt = clock.instant();
            cacheLedger.markFetched(key, fetchedAt);
            return fetchedAt;
        });
    }

    private void mergeAnime(AnimeDetailPayload detail) {
        catalogueStore.upsertAnime(detail);
        int skipped = 0;
        for (EpisodePayload episode : detail.episodes()) {
            if (episode.url() == null || episode.url().isBlank()) {
                skipped++;
                continue;
            }
            catalogueStore.upsertEpisode(detail.slug(), episode);
        }
        if (skipped > 0) {
            log.warn("Skipped {} episodes without url for {}", skipped, detail.slug());
        }
    }

    private void mergeEpisode(EpisodeSourcesPayload episode) {
        catalogueStore.mergeVideoSources(episode.episodeUrl(), episode.sources());
    }

    private void mergeUpdates(List<AnimeUpdatePayload> updates) {
        updates.stream()
                .filter(update -> update.episodeUrl() != null && !update.episodeUrl().isBlank())
                .forEach(catalogueStore::upsertAnimeUpdate);
    }

    private void mergeCompleted(List<CompletedAnimePayload> completed) {
        completed.stream()
                .filter(item -> item.url() != null && !item.url().isBlank())
                .forEach(catalogueStore::upsertCompletedAnime);
    }

    private void mergeListing(List<ListingItemPayload> items) {
        items.stream()
                .filter(item -> item.slug() != null && !item.slug().isBlank())
                .forEach(catalogueStore::upsertCrawledAnime);
    }
}
