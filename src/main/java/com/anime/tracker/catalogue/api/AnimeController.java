package com.anime.tracker.catalogue.api;

import com.anime.tracker.catalogue.model.AnimeDetail;
import com.anime.tracker.catalogue.model.AnimeUpdate;
import com.anime.tracker.catalogue.model.CompletedAnime;
import com.anime.tracker.catalogue.model.CrawledAnime;
import com.anime.tracker.catalogue.model.Episode;
import com.anime.tracker.catalogue.model.EpisodeSourcesView;
import com.anime.tracker.catalogue.model.ListingQuery;
import com.anime.tracker.catalogue.service.CatalogueQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class AnimeController {
    private final CatalogueQueryService catalogueQueryService;

    public AnimeController(CatalogueQueryService catalogueQueryService) {
        this.catalogueQueryService = catalogueQueryService;
    }

    @GetMapping("/anime/{slug}")
    public ResponseEntity<AnimeDetail> getAnime(@PathVariable String slug) {
        return ResponseEntity.of(catalogueQueryService.getAnime(slug));
    }

    @GetMapping("/anime/{slug}/episodes")
    public ResponseEntity<List<Episode>> getEpisodes(@PathVariable String slug) {
        return ResponseEntity.of(catalogueQueryService.getEpisodes(slug));
    }

    @GetMapping("/episode/{slug}/sources")
    public ResponseEntity<EpisodeSourcesView> getEpisodeSources(@PathVariable String slug) {
        return ResponseEntity.of(catalogueQueryService.getEpisodeSources(slug));
    }

    @GetMapping("/updates")
    public List<AnimeUpdate> getUpdates() {
        return catalogueQueryService.getUpdates();
    }

    @GetMapping("/completed")
    public List<CompletedAnime> getCompleted() {
        return catalogueQueryService.getCompleted();
    }

    @GetMapping("/anime-list")
    public List<CrawledAnime> getAnimeList(@RequestParam(defaultValue = "1") int page,
                                           @RequestParam(defaultValue = "") String type,
                                           @RequestParam(defaultValue = "") String status,
                                           @RequestParam(defaultValue = "") String order) {
        return catalogueQueryService.getListing(new ListingQuery(page, type, status, order));
    }

    @DeleteMapping("/cache/{key}")
    public ResponseEntity<Void> invalidate(@PathVariable String key) {
        return catalogueQueryService.invalidate(key)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
