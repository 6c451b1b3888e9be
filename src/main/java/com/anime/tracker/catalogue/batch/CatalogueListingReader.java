package com.anime.tracker.catalogue.batch;

import com.anime.tracker.catalogue.crawler.AnimeCrawler;
import com.anime.tracker.catalogue.crawler.ListingItemPayload;
import com.anime.tracker.catalogue.model.ListingQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.annotation.BeforeStep;
import org.springframework.batch.item.ItemReader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pages through the browse listing one page at a time. Stops at the first empty page,
 * after {@code app.crawl.max-pages}, or once {@code app.crawl.stale-page-limit}
 * consecutive pages bring no slug not seen before.
 */
@Slf4j
@Component
public class CatalogueListingReader implements ItemReader<ListingItemPayload> {
    private final AnimeCrawler crawler;
    private final Deque<ListingItemPayload> buffer = new ArrayDeque<>();
    private final Set<String> seenSlugs = new HashSet<>();
    private int nextPage = 1;
    private int stalePages = 0;
    private boolean exhausted = false;

    @Value("${app.crawl.max-pages:1000}")
    private int maxPages;

    @Value("${app.crawl.stale-page-limit:2}")
    private int stalePageLimit;

    @Value("${app.crawl.page-delay-ms:1000}")
    private long pageDelayMs;

    @Value("${app.crawl.type:}")
    private String typeFilter;

    @Value("${app.crawl.status:}")
    private String statusFilter;

    @Value("${app.crawl.order:}")
    private String order;

    public CatalogueListingReader(AnimeCrawler crawler) {
        this.crawler = crawler;
    }

    @BeforeStep
    public void beforeStep(StepExecution stepExecution) {
        buffer.clear();
        seenSlugs.clear();
        nextPage = 1;
        stalePages = 0;
        exhausted = false;
    }

    @Override
    public ListingItemPayload read() throws Exception {
        while (buffer.isEmpty() && !exhausted) {
            loadNextPage();
        }
        return buffer.poll();
    }

    private void loadNextPage() throws Exception {
        if (nextPage > maxPages) {
            log.info("Catalogue crawl reached the page limit of {}", maxPages);
            exhausted = true;
            return;
        }
        if (nextPage > 1 && pageDelayMs > 0) {
            Thread.sleep(pageDelayMs);
        }

        int page = nextPage++;
        List<ListingItemPayload> items = crawler.fetchListing(new ListingQuery(page, typeFilter, statusFilter, order));
        if (items.isEmpty()) {
            log.info("Catalogue crawl finished: page {} is empty ({} anime seen)", page, seenSlugs.size());
            exhausted = true;
            return;
        }

        int newItems = 0;
        for (ListingItemPayload item : items) {
            if (item.slug() != null && !item.slug().isBlank() && seenSlugs.add(item.slug())) {
                buffer.add(item);
                newItems++;
            }
        }
        stalePages = newItems == 0 ? stalePages + 1 : 0;
        log.info("Catalogue crawl page {}: {} items, {} new", page, items.size(), newItems);

        if (stalePageLimit > 0 && stalePages >= stalePageLimit) {
            log.info("Catalogue crawl stopped at page {} after {} pages with no new anime", page, stalePages);
            exhausted = true;
        }
    }
}
