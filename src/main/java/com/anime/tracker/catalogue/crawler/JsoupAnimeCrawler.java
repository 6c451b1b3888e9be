package com.anime.tracker.catalogue.crawler;

import com.anime.tracker.catalogue.model.ListingQuery;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

@Slf4j
@Component
public class JsoupAnimeCrawler implements AnimeCrawler {
    private static final List<String> USER_AGENTS = List.of(
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/119.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:121.0) Gecko/20100101 Firefox/121.0",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10.15; rv:121.0) Gecko/20100101 Firefox/121.0",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.2 Safari/605.1.15",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36 Edg/120.0.0.0"
    );

    private final AnimePageParser parser;
    private final SourceUrls sourceUrls;

    // Blank means rotate through the built-in browser agents.
    @Value("${app.crawler.user-agent:}")
    private String userAgent;

    @Value("${app.crawler.request-timeout-ms:30000}")
    private int requestTimeoutMs;

    @Value("${app.crawler.max-retries:3}")
    private int maxRetries;

    @Value("${app.crawler.backoff-base-ms:1000}")
    private long backoffBaseMs;

    public JsoupAnimeCrawler(AnimePageParser parser, SourceUrls sourceUrls) {
        this.parser = parser;
        this.sourceUrls = sourceUrls;
    }

    @Override
    public Optional<AnimeDetailPayload> fetchAnimeDetail(String slug) throws IOException {
        String url = sourceUrls.anime(slug);
        Optional<String> html = fetchOptional(url);
        if (html.isEmpty()) {
            return Optional.empty();
        }
        AnimeDetailPayload detail = parser.parseAnimeDetail(slug, url, html.get());
        if (detail.title().isEmpty()) {
            log.info("Anime page {} has no title, treating as missing", url);
            return Optional.empty();
        }
        return Optional.of(detail);
    }

    @Override
    public Optional<EpisodeSourcesPayload> fetchEpisodeSources(String episodeSlug) throws IOException {
        String url = sourceUrls.episode(episodeSlug);
        Optional<String> html = fetchOptional(url);
        if (html.isEmpty()) {
            return Optional.empty();
        }
        EpisodeSourcesPayload episode = parser.parseEpisode(episodeSlug, url, html.get());
        if (episode.title().isEmpty() && episode.sources().isEmpty()) {
            log.info("Episode page {} has neither title nor sources, treating as missing", url);
            return Optional.empty();
        }
        return Optional.of(episode);
    }

    @Override
    public List<AnimeUpdatePayload> fetchUpdates() throws IOException {
        return parser.parseUpdates(fetch(sourceUrls.home()));
    }

    @Override
    public List<CompletedAnimePayload> fetchCompleted() throws IOException {
        return parser.parseCompleted(fetch(sourceUrls.home()));
    }

    @Override
    public List<ListingItemPayload> fetchListing(ListingQuery query) throws IOException {
        return parser.parseListing(fetch(sourceUrls.listing(query)));
    }

    private Optional<String> fetchOptional(String url) throws IOException {
        try {
            return Optional.of(fetch(url));
        } catch (HttpStatusException ex) {
            if (ex.getStatusCode() == 404) {
                return Optional.empty();
            }
            throw ex;
        }
    }

    /**
     * GETs a page, retrying HTTP 429 and 5xx with exponential backoff plus jitter.
     * Other non-200 statuses fail immediately.
     */
    private String fetch(String url) throws IOException {
        HttpStatusException lastError = null;
        int attempts = Math.max(1, maxRetries);
        for (int attempt = 0; attempt < attempts; attempt++) {
            if (attempt > 0) {
                backoff(attempt);
            }
            Connection.Response response = Jsoup.connect(url)
                    .userAgent(pickUserAgent())
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .header("Accept-Language", "en-US,en;q=0.9,id;q=0.8")
                    .timeout(requestTimeoutMs)
                    .ignoreHttpErrors(true)
                    .execute();
            int status = response.statusCode();
            if (status == 200) {
                return response.body();
            }
            lastError = new HttpStatusException("HTTP error fetching URL", status, url);
            if (status == 429 || status >= 500) {
                log.warn("HTTP {} from {} on attempt {}/{}", status, url, attempt + 1, attempts);
                continue;
            }
            throw lastError;
        }
        throw lastError;
    }

    private void backoff(int attempt) throws InterruptedIOException {
        long delay = backoffBaseMs * (1L << attempt) + ThreadLocalRandom.current().nextLong(500);
        try {
            Thread.sleep(delay);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while backing off");
        }
    }

    private String pickUserAgent() {
        if (userAgent != null && !userAgent.isBlank()) {
            return userAgent;
        }
        return USER_AGENTS.get(ThreadLocalRandom.current().nextInt(USER_AGENTS.size()));
    }
}
