package com.anime.tracker.catalogue.service;

import com.anime.tracker.catalogue.crawler.AnimeDetailPayload;
import com.anime.tracker.catalogue.crawler.AnimeUpdatePayload;
import com.anime.tracker.catalogue.crawler.CompletedAnimePayload;
import com.anime.tracker.catalogue.crawler.EpisodePayload;
import com.anime.tracker.catalogue.crawler.ListingItemPayload;
import com.anime.tracker.catalogue.crawler.VideoSourcePayload;
import com.anime.tracker.catalogue.exception.CatalogueException;
import com.anime.tracker.catalogue.exception.DuplicateKeyConflictException;
import com.anime.tracker.catalogue.exception.ForeignKeyViolationException;
import com.anime.tracker.catalogue.model.AnimeDetail;
import com.anime.tracker.catalogue.model.AnimeUpdate;
import com.anime.tracker.catalogue.model.CompletedAnime;
import com.anime.tracker.catalogue.model.CrawledAnime;
import com.anime.tracker.catalogue.model.Episode;
import com.anime.tracker.catalogue.model.ListingQuery;
import com.anime.tracker.catalogue.model.VideoSource;
import com.anime.tracker.catalogue.repository.AnimeDetailRepository;
import com.anime.tracker.catalogue.repository.AnimeUpdateRepository;
import com.anime.tracker.catalogue.repository.CompletedAnimeRepository;
import com.anime.tracker.catalogue.repository.CrawledAnimeRepository;
import com.anime.tracker.catalogue.repository.EpisodeRepository;
import com.anime.tracker.catalogue.repository.VideoSourceRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Upserts and lookups for crawled catalogue content. Every upsert matches on the row's
 * natural key, overwrites the mutable fields and leaves identity fields untouched.
 * Lookup misses are empty results, never errors.
 */
@Slf4j
@Service
public class CatalogueStore {
    private final AnimeDetailRepository animeDetailRepository;
    private final EpisodeRepository episodeRepository;
    private final VideoSourceRepository videoSourceRepository;
    private final CrawledAnimeRepository crawledAnimeRepository;
    private final CompletedAnimeRepository completedAnimeRepository;
    private final AnimeUpdateRepository animeUpdateRepository;
    private final Clock clock;

    public CatalogueStore(AnimeDetailRepository animeDetailRepository,
                          EpisodeRepository episodeRepository,
                          VideoSourceRepository videoSourceRepository,
                          CrawledAnimeRepository crawledAnimeRepository,
                          CompletedAnimeRepository completedAnimeRepository,
                          AnimeUpdateRepository animeUpdateRepository,
                          Clock clock) {
        this.animeDetailRepository = animeDetailRepository;
        this.episodeRepository = episodeRepository;
        this.videoSourceRepository = videoSourceRepository;
        this.crawledAnimeRepository = crawledAnimeRepository;
        this.completedAnimeRepository = completedAnimeRepository;
        this.animeUpdateRepository = animeUpdateRepository;
        this.clock = clock;
    }

    // Conflict checks run before any write, so a rejected upsert leaves the caller's
    // transaction usable.
    @Transactional(noRollbackFor = CatalogueException.class)
    public AnimeDetail upsertAnime(AnimeDetailPayload payload) {
        String slug = requireText(payload.slug(), "Anime slug");
        String url = blankToNull(payload.url());
        if (url != null) {
            animeDetailRepository.findByUrl(url)
                    .filter(owner -> !owner.getSlug().equals(slug))
                    .ifPresent(owner -> {
                        throw new DuplicateKeyConflictException(
                                "Anime url " + url + " already belongs to " + owner.getSlug());
                    });
        }

        Instant now = clock.instant();
        AnimeDetail anime = animeDetailRepository.findBySlug(slug)
                .orElseGet(() -> {
                    AnimeDetail created = new AnimeDetail(slug, url);
                    created.setCreatedAt(now);
                    return created;
                });
        if (anime.getUrl() == null) {
            anime.setUrl(url);
        }
        anime.setTitle(requireText(payload.title(), "Anime title"));
        anime.setAlternateTitles(payload.alternateTitles());
        anime.setPoster(payload.poster());
        anime.setRating(payload.rating());
        anime.setTrailerUrl(payload.trailerUrl());
        anime.setStatus(payload.status());
        anime.setStudio(payload.studio());
        anime.setReleaseDate(payload.releaseDate());
        anime.setDuration(payload.duration());
        anime.setSeason(payload.season());
        anime.setAnimeType(payload.animeType());
        anime.setTotalEpisodes(payload.totalEpisodes());
        anime.setDirector(payload.director());
        anime.setCasts(new ArrayList<>(payload.casts()));
        anime.setGenres(new ArrayList<>(payload.genres()));
        anime.setSynopsis(payload.synopsis());
        anime.setUpdatedAt(now);
        return animeDetailRepository.save(anime);
    }

    @Transactional(noRollbackFor = CatalogueException.class)
    public Episode upsertEpisode(String animeSlug, EpisodePayload payload) {
        String url = requireText(payload.url(), "Episode url");
        if (animeSlug == null || !animeDetailRepository.existsBySlug(animeSlug)) {
            throw new ForeignKeyViolationException("No anime with slug " + animeSlug + " for episode " + url);
        }

        Instant now = clock.instant();
        Episode episode = episodeRepository.findByUrl(url)
                .orElseGet(() -> {
                    Episode created = new Episode(animeSlug, url);
                    created.setCreatedAt(now);
                    return created;
                });
        if (!episode.getAnimeSlug().equals(animeSlug)) {
            throw new DuplicateKeyConflictException(
                    "Episode " + url + " already belongs to " + episode.getAnimeSlug());
        }
        episode.setNumber(payload.number());
        episode.setTitle(payload.title());
        episode.setReleaseDate(payload.releaseDate());
        episode.setUpdatedAt(now);
        return episodeRepository.save(episode);
    }

    @Transactional
    public VideoSource upsertVideoSource(String episodeUrl, VideoSourcePayload payload) {
        String episode = requireText(episodeUrl, "Episode url");
        String server = nullToEmpty(payload.server());
        String quality = nullToEmpty(payload.quality());

        Instant now = clock.instant();
        VideoSource source = videoSourceRepository.findByEpisodeUrlAndServerAndQuality(episode, server, quality)
                .orElseGet(() -> {
                    VideoSource created = new VideoSource(episode, server, quality);
                    created.setCreatedAt(now);
                    return created;
                });
        source.setUrl(payload.url());
        source.setUpdatedAt(now);
        return videoSourceRepository.save(source);
    }

    /**
     * Makes the stored sources of one episode equal to {@code sources}: upserts each of
     * them and removes stored sources whose server/quality pair is absent. Duplicate
     * pairs in the input collapse onto the last one.
     */
    @Transactional
    public List<VideoSource> mergeVideoSources(String episodeUrl, List<VideoSourcePayload> sources) {
        String episode = requireText(episodeUrl, "Episode url");
        Map<String, VideoSourcePayload> fresh = new LinkedHashMap<>();
        for (VideoSourcePayload source : sources) {
            fresh.put(sourceKey(source.server(), source.quality()), source);
        }

        List<VideoSource> merged = new ArrayList<>();
        for (VideoSourcePayload source : fresh.values()) {
            merged.add(upsertVideoSource(episode, source));
        }

        List<VideoSource> stale = videoSourceRepository.findAllByEpisodeUrlOrderByIdAsc(episode).stream()
                .filter(existing -> !fresh.containsKey(sourceKey(existing.getServer(), existing.getQuality())))
                .toList();
        if (!stale.isEmpty()) {
            log.info("Removing {} stale video sources of {}", stale.size(), episode);
            videoSourceRepository.deleteAll(stale);
        }
        return merged;
    }

    @Transactional(noRollbackFor = CatalogueException.class)
    public CrawledAnime upsertCrawledAnime(ListingItemPayload payload) {
        String slug = requireText(payload.slug(), "Listing slug");
        String url = requireText(payload.url(), "Listing url");
        crawledAnimeRepository.findByUrl(url)
                .filter(owner -> !owner.getSlug().equals(slug))
                .ifPresent(owner -> {
                    throw new DuplicateKeyConflictException(
                            "Listing url " + url + " already belongs to " + owner.getSlug());
                });

        Instant now = clock.instant();
        CrawledAnime crawled = crawledAnimeRepository.findBySlug(slug)
                .orElseGet(() -> {
                    CrawledAnime created = new CrawledAnime();
                    created.setSlug(slug);
                    created.setUrl(url);
                    created.setCreatedAt(now);
                    return created;
                });
        crawled.setTitle(requireText(payload.title(), "Listing title"));
        crawled.setThumbnail(payload.thumbnail());
        crawled.setStatus(payload.status());
        crawled.setAnimeType(payload.animeType());
        crawled.setEpisodeStatus(payload.episodeStatus());
        crawled.setUpdatedAt(now);
        return crawledAnimeRepository.save(crawled);
    }

    @Transactional
    public CompletedAnime upsertCompletedAnime(CompletedAnimePayload payload) {
        String url = requireText(payload.url(), "Completed anime url");
        Instant now = clock.instant();
        CompletedAnime completed = completedAnimeRepository.findByUrl(url)
                .orElseGet(() -> {
                    CompletedAnime created = new CompletedAnime();
                    created.setUrl(url);
                    created.setCreatedAt(now);
                    return created;
                });
        completed.setTitle(requireText(payload.title(), "Completed anime title"));
        completed.setThumbnail(payload.thumbnail());
        completed.setAnimeType(payload.animeType());
        completed.setEpisodeCount(payload.episodeCount());
        completed.setStatus(payload.status());
        completed.setPostedBy(payload.postedBy());
        completed.setPostedAt(payload.postedAt());
        completed.setSeriesTitle(payload.seriesTitle());
        completed.setSeriesUrl(payload.seriesUrl());
        completed.setGenres(new ArrayList<>(payload.genres()));
        completed.setRating(payload.rating());
        completed.setUpdatedAt(now);
        return completedAnimeRepository.save(completed);
    }

    @Transactional
    public AnimeUpdate upsertAnimeUpdate(AnimeUpdatePayload payload) {
        String episodeUrl = requireText(payload.episodeUrl(), "Update episode url");
        Instant now = clock.instant();
        AnimeUpdate update = animeUpdateRepository.findByEpisodeUrl(episodeUrl)
                .orElseGet(() -> {
                    AnimeUpdate created = new AnimeUpdate();
                    created.setEpisodeUrl(episodeUrl);
                    created.setCreatedAt(now);
                    return created;
                });
        update.setTitle(requireText(payload.title(), "Update title"));
        update.setThumbnail(payload.thumbnail());
        update.setEpisodeNumber(payload.episodeNumber());
        update.setAnimeType(payload.animeType());
        update.setSeriesTitle(payload.seriesTitle());
        update.setSeriesUrl(payload.seriesUrl());
        update.setStatus(payload.status());
        update.setReleaseInfo(payload.releaseInfo());
        update.setUpdatedAt(now);
        return animeUpdateRepository.save(update);
    }

    @Transactional(readOnly = true)
    public Optional<AnimeDetail> getAnimeBySlug(String slug) {
        return animeDetailRepository.findBySlug(slug);
    }

    @Transactional(readOnly = true)
    public List<Episode> getEpisodesForAnime(String animeSlug) {
        return episodeRepository.findAllByAnimeSlugOrderByIdAsc(animeSlug);
    }

    @Transactional(readOnly = true)
    public Optional<Episode> getEpisodeByUrl(String url) {
        return episodeRepository.findByUrl(url);
    }

    @Transactional(readOnly = true)
    public List<VideoSource> getVideoSourcesForEpisode(String episodeUrl) {
        return videoSourceRepository.findAllByEpisodeUrlOrderByIdAsc(episodeUrl);
    }

    @Transactional(readOnly = true)
    public Optional<CrawledAnime> getCrawledAnime(String slug) {
        return crawledAnimeRepository.findBySlug(slug);
    }

    @Transactional(readOnly = true)
    public List<CrawledAnime> getAllCrawledAnime() {
        return crawledAnimeRepository.findAllByOrderByTitleAsc();
    }

    /**
     * One page of crawled anime filtered by type and status. Pages are 1-based like the
     * source site's.
     */
    @Transactional(readOnly = true)
    public List<CrawledAnime> getCrawledAnimePage(ListingQuery query, int pageSize) {
        Sort sort = switch (query.order()) {
            case "titlereverse" -> Sort.by(Sort.Direction.DESC, "title");
            case "update", "latest" -> Sort.by(Sort.Direction.DESC, "updatedAt").and(Sort.by("title"));
            default -> Sort.by("title");
        };
        return crawledAnimeRepository.findFiltered(
                query.type(), query.status(), PageRequest.of(query.page() - 1, pageSize, sort)).getContent();
    }

    @Transactional(readOnly = true)
    public long countCrawledAnime() {
        return crawledAnimeRepository.count();
    }

    @Transactional(readOnly = true)
    public List<CompletedAnime> getCompletedAnime() {
        return completedAnimeRepository.findAllByOrderByUpdatedAtDescIdAsc();
    }

    @Transactional(readOnly = true)
    public List<AnimeUpdate> getAnimeUpdates() {
        return animeUpdateRepository.findAllByOrderByUpdatedAtDescIdAsc();
    }

    /**
     * Deletes the anime; the database cascades to its episodes. Video sources stay
     * until the reconciliation pass collects them.
     *
     * @return whether an anime was deleted
     */
    @Transactional
    public boolean deleteAnime(String slug) {
        boolean deleted = animeDetailRepository.deleteBySlug(slug) > 0;
        if (deleted) {
            log.info("Deleted anime {}", slug);
        }
        return deleted;
    }

    @Transactional
    public int deleteVideoSources(String episodeUrl) {
        return videoSourceRepository.deleteByEpisodeUrl(episodeUrl);
    }

    private static String sourceKey(String server, String quality) {
        return nullToEmpty(server) + '\u0000' + nullToEmpty(quality);
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value.trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
