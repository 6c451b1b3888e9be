package com.anime.tracker.catalogue.crawler;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SlugsTest {

    @Test
    void takesLastPathSegment() {
        assertThat(Slugs.fromUrl("https://x3.sokuja.uk/anime/one-piece/")).isEqualTo("one-piece");
        assertThat(Slugs.fromUrl("https://x3.sokuja.uk/one-piece-episode-1100")).isEqualTo("one-piece-episode-1100");
    }

    @Test
    void toleratesNullAndBareValues() {
        assertThat(Slugs.fromUrl(null)).isEmpty();
        assertThat(Slugs.fromUrl("naruto")).isEqualTo("naruto");
    }
}
