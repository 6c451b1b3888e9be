package com.anime.tracker.catalogue.crawler;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AnimePageParserTest {
    private final AnimePageParser parser = new AnimePageParser();

    @Test
    void parsesDetailPageWithEpisodes() {
        String html = """
                <html><body>
                <h1 class="entry-title">Naruto</h1>
                <span class="alter">ナルト</span>
                <div class="thumb"><img src="https://img.example/naruto.jpg"></div>
                <meta itemprop="ratingValue" content="8.1">
                <div class="spe">
                  <span><b>Status:</b> Completed</span>
                  <span><b>Studio:</b> Pierrot</span>
                  <span><b>Tipe:</b> TV</span>
                </div>
                <div class="genxed"><a>Action</a><a>Adventure</a></div>
                <a class="casts">Junko Takeuchi</a>
                <div class="desc">A ninja story.</div>
                <div class="eplister"><ul>
                  <li><a href="https://x3.sokuja.uk/naruto-episode-2/">
                    <div class="epl-num">2</div><div class="epl-title">Episode 2</div><div class="epl-date">2024-01-08</div></a></li>
                  <li><a href="https://x3.sokuja.uk/naruto-episode-1/">
                    <div class="epl-num">1</div><div class="epl-title">Episode 1</div><div class="epl-date">2024-01-01</div></a></li>
                </ul></div>
                </body></html>
                """;

        AnimeDetailPayload detail = parser.parseAnimeDetail("naruto", "https://x3.sokuja.uk/anime/naruto/", html);

        assertThat(detail.slug()).isEqualTo("naruto");
        assertThat(detail.title()).isEqualTo("Naruto");
        assertThat(detail.poster()).isEqualTo("https://img.example/naruto.jpg");
        assertThat(detail.rating()).isEqualTo("8.1");
        assertThat(detail.status()).isEqualTo("Completed");
        assertThat(detail.studio()).isEqualTo("Pierrot");
        assertThat(detail.animeType()).isEqualTo("TV");
        assertThat(detail.season()).isNull();
        assertThat(detail.genres()).containsExactly("Action", "Adventure");
        assertThat(detail.casts()).containsExactly("Junko Takeuchi");
        assertThat(detail.episodes()).extracting(EpisodePayload::number).containsExactly("2", "1");
        assertThat(detail.episodes().get(1).slug()).isEqualTo("naruto-episode-1");
    }

    @Test
    void parsesMirrorOptionsIntoSources() {
        String html = """
                <html><body>
                <h1 class="entry-title">Naruto Episode 1</h1>
                <select class="mirror">
                  <option value="">Pilih Server</option>
                  <option value="PGlmcmFtZSBzcmM9Imh0dHBzOi8vY2RuLmV4YW1wbGUvdi83MjAubXA0Ij48L2lmcmFtZT4=">SOKUJA - 720p</option>
                  <option value="PHZpZGVvPjxzb3VyY2Ugc3JjPSJodHRwczovL2Nkbi5leGFtcGxlL3YvNDgwLm1wNCI+PC92aWRlbz4=">BACKUP 480p</option>
                  <option value="%%%not-base64">BROKEN</option>
                </select>
                </body></html>
                """;

        EpisodeSourcesPayload episode = parser.parseEpisode("naruto-episode-1", "https://x3.sokuja.uk/naruto-episode-1/", html);

        assertThat(episode.title()).isEqualTo("Naruto Episode 1");
        assertThat(episode.sources()).containsExactly(
                new VideoSourcePayload("SOKUJA", "720p", "https://cdn.example/v/720.mp4"),
                new VideoSourcePayload("BACKUP", "480p", "https://cdn.example/v/480.mp4"));
    }

    @Test
    void parsesListingArticles() {
        String html = """
                <div class="listupd">
                  <article class="bs"><a itemprop="url" href="https://x3.sokuja.uk/anime/bleach/">
                    <img class="ts-post-image" data-src="https://img.example/bleach.jpg">
                    <div class="status">Completed</div><div class="typez">TV</div><span class="epx">366</span>
                    <h2 itemprop="headline">Bleach</h2></a></article>
                </div>
                """;

        List<ListingItemPayload> items = parser.parseListing(html);

        assertThat(items).hasSize(1);
        ListingItemPayload item = items.get(0);
        assertThat(item.slug()).isEqualTo("bleach");
        assertThat(item.title()).isEqualTo("Bleach");
        assertThat(item.thumbnail()).isEqualTo("https://img.example/bleach.jpg");
        assertThat(item.episodeStatus()).isEqualTo("366");
    }

    @Test
    void missingElementsYieldEmptyResults() {
        assertThat(parser.parseUpdates("<html></html>")).isEmpty();
        assertThat(parser.parseAnimeDetail("x", "u", "<html></html>").title()).isEmpty();
    }

    @Test
    void splitsServerAndQualityLabels() {
        assertThat(AnimePageParser.splitServerQuality("SOKUJA - 1080p")).containsExactly("SOKUJA", "1080p");
        assertThat(AnimePageParser.splitServerQuality("Mega 360p")).containsExactly("Mega", "360p");
        assertThat(AnimePageParser.splitServerQuality("Drive")).containsExactly("Drive", "");
        assertThat(AnimePageParser.splitServerQuality(null)).containsExactly("", "");
    }
}
