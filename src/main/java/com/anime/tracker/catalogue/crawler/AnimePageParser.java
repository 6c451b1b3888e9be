package com.anime.tracker.catalogue.crawler;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

/**
 * Extracts catalogue payloads from the source site's theme markup. Missing elements
 * yield empty strings, never failures.
 */
@Slf4j
@Component
public class AnimePageParser {
    private static final List<String> QUALITY_MARKERS = List.of("1080p", "720p", "480p", "360p", "240p");
    private static final List<String> EMBED_TAGS = List.of("source", "video", "iframe", "embed");

    public List<AnimeUpdatePayload> parseUpdates(String html) {
        Document doc = Jsoup.parse(html);
        List<AnimeUpdatePayload> updates = new ArrayList<>();
        for (Element article : doc.select("article.seventh")) {
            Element seriesLink = article.selectFirst("div.sosev span a");
            updates.add(AnimeUpdatePayload.builder()
                    .title(text(article, "h2[itemprop=headline] a"))
                    .episodeUrl(attr(article, "a[itemprop=url]", "href"))
                    .thumbnail(imageSource(article.selectFirst("img.ts-post-image")))
                    .episodeNumber(text(article, "div.epin"))
                    .animeType(text(article, "span.type"))
                    .seriesTitle(seriesLink == null ? "" : seriesLink.text().trim())
                    .seriesUrl(seriesLink == null ? "" : seriesLink.attr("href"))
                    .status(text(article, "span.status"))
                    .releaseInfo(releaseInfo(article))
                    .build());
        }
        return updates;
    }

    public List<CompletedAnimePayload> parseCompleted(String html) {
        Document doc = Jsoup.parse(html);
        List<CompletedAnimePayload> completed = new ArrayList<>();
        for (Element article : doc.select("article.stylesix")) {
            CompletedAnimePayload.CompletedAnimePayloadBuilder builder = CompletedAnimePayload.builder()
                    .title(text(article, "h2[itemprop=headline] a"))
                    .url(attr(article, "a[itemprop=url]", "href"))
                    .thumbnail(imageSource(article.selectFirst("img.ts-post-image")))
                    .animeType(text(article, "div.typez"))
                    .episodeCount(text(article, "span.epx"))
                    .rating(text(article, "span.scr"))
                    .genres(texts(article.select("a[rel=tag]")));

            String status = "";
            String postedBy = "";
            String postedAt = "";
            String seriesTitle = "";
            String seriesUrl = "";
            for (Element li : article.select("li")) {
                String line = li.text();
                String lower = line.toLowerCase(Locale.ROOT);
                if (lower.contains("status:") || lower.contains("status :")) {
                    status = firstValue(line);
                } else if (lower.contains("dipos oleh:") || lower.contains("posted by:")) {
                    postedBy = firstValue(line);
                } else if (lower.contains("dipos pada:") || lower.contains("posted at:") || lower.contains("posted on:")) {
                    postedAt = valueAfterLabel(line);
                }
                Element link = li.selectFirst("a");
                if (link != null && seriesUrl.isEmpty() && link.attr("href").contains("/anime/")) {
                    seriesTitle = link.text().trim();
                    seriesUrl = link.attr("href");
                }
            }
            completed.add(builder
                    .status(status)
                    .postedBy(postedBy)
                    .postedAt(postedAt)
                    .seriesTitle(seriesTitle)
                    .seriesUrl(seriesUrl)
                    .build());
        }
        return completed;
    }

    public List<ListingItemPayload> parseListing(String html) {
        Document doc = Jsoup.parse(html);
        Element container = doc.selectFirst("div.listupd");
        Elements articles = container != null ? container.select("article.bs") : doc.select("article.bs");

        List<ListingItemPayload> items = new ArrayList<>();
        for (Element article : articles) {
            String url = attr(article, "a[itemprop=url]", "href");
            items.add(new ListingItemPayload(
                    Slugs.fromUrl(url),
                    text(article, "h2[itemprop=headline]"),
                    url,
                    imageSource(article.selectFirst("img.ts-post-image")),
                    text(article, "div.status"),
                    text(article, "div.typez"),
                    text(article, "span.epx")
            ));
        }
        return items;
    }

    /**
     * Parses an anime detail page. Episodes keep page order (newest first on the source).
     */
    public AnimeDetailPayload parseAnimeDetail(String slug, String url, String html) {
        Document doc = Jsoup.parse(html);
        AnimeDetailPayload.AnimeDetailPayloadBuilder builder = AnimeDetailPayload.builder()
                .slug(slug)
                .url(url)
                .title(text(doc, "h1.entry-title"))
                .alternateTitles(text(doc, "span.alter"))
                .poster(imageSource(doc.selectFirst("div.thumb img")))
                .rating(attr(doc, "meta[itemprop=ratingValue]", "content"))
                .trailerUrl(attr(doc, "a.trailerbutton", "href"))
                .casts(texts(doc.select("a.casts")))
                .genres(texts(doc.select("div.genxed a")))
                .synopsis(text(doc, "div.desc"));

        for (Element span : doc.select("div.spe span")) {
            String line = span.text();
            String lower = line.toLowerCase(Locale.ROOT);
            String value = valueAfterLabel(line);
            if (lower.contains("status")) {
                builder.status(value);
            } else if (lower.contains("studio")) {
                builder.studio(value);
            } else if (lower.contains("tanggal rilis") || lower.contains("release")) {
                builder.releaseDate(value);
            } else if (lower.contains("durasi") || lower.contains("duration")) {
                builder.duration(value);
            } else if (lower.contains("season")) {
                builder.season(value);
            } else if (lower.contains("tipe") || lower.contains("type")) {
                builder.animeType(value);
            } else if (lower.contains("total episode") || lower.contains("episodes")) {
                builder.totalEpisodes(value);
            } else if (lower.contains("director") || lower.contains("sutradara")) {
                builder.director(value);
            }
        }

        List<EpisodePayload> episodes = new ArrayList<>();
        for (Element li : doc.select("div.eplister ul li")) {
            episodes.add(new EpisodePayload(
                    text(li, "div.epl-num"),
                    text(li, "div.epl-title"),
                    attr(li, "a", "href"),
                    text(li, "div.epl-date")
            ));
        }
        return builder.episodes(episodes).build();
    }

    public EpisodeSourcesPayload parseEpisode(String episodeSlug, String episodeUrl, String html) {
        Document doc = Jsoup.parse(html);
        List<VideoSourcePayload> sources = new ArrayList<>();
        for (Element option : doc.select("select.mirror option")) {
            String encoded = option.attr("value");
            if (encoded.isEmpty()) {
                continue;
            }
            String decoded = decodeBase64(encoded);
            if (decoded == null) {
                log.debug("Skipping mirror option with undecodable value on {}", episodeUrl);
                continue;
            }
            String videoUrl = embeddedVideoUrl(decoded);
            if (videoUrl.isEmpty()) {
                continue;
            }
            String[] serverQuality = splitServerQuality(option.text());
            sources.add(new VideoSourcePayload(serverQuality[0], serverQuality[1], videoUrl));
        }
        return new EpisodeSourcesPayload(
                episodeSlug,
                episodeUrl,
                text(doc, "h1.entry-title"),
                attr(doc, "div#embed_holder video source", "src"),
                sources
        );
    }

    /**
     * Splits mirror labels such as {@code "SOKUJA - 720p"}, {@code "SOKUJA 720p"} or
     * {@code "SOKUJA"} into server and quality.
     */
    static String[] splitServerQuality(String label) {
        String text = label == null ? "" : label.trim();
        int dash = text.indexOf(" - ");
        if (dash >= 0) {
            return new String[]{text.substring(0, dash).trim(), text.substring(dash + 3).trim()};
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String marker : QUALITY_MARKERS) {
            int index = lower.indexOf(marker);
            if (index >= 0) {
                String server = text.substring(0, index).trim();
                String quality = text.substring(index).trim();
                return new String[]{server.isEmpty() ? text : server, quality};
            }
        }
        return new String[]{text, ""};
    }

    private String embeddedVideoUrl(String fragment) {
        Document embedded = Jsoup.parseBodyFragment(fragment);
        for (String tag : EMBED_TAGS) {
            Element element = embedded.selectFirst(tag);
            if (element != null && element.hasAttr("src")) {
                return element.attr("src");
            }
        }
        return "";
    }

    private String decodeBase64(String value) {
        try {
            return new String(Base64.getDecoder().decode(value.trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    private String releaseInfo(Element article) {
        for (Element span : article.select("div.sosev span")) {
            String text = span.text().trim();
            if (!text.isEmpty() && span.selectFirst("a") == null) {
                return text;
            }
        }
        return "";
    }

    private String text(Element root, String cssQuery) {
        Element element = root.selectFirst(cssQuery);
        return element == null ? "" : element.text().trim();
    }

    private String attr(Element root, String cssQuery, String attribute) {
        Element element = root.selectFirst(cssQuery);
        return element == null ? "" : element.attr(attribute);
    }

    private String imageSource(Element image) {
        if (image == null) {
            return "";
        }
        String src = image.attr("src");
        return src.isEmpty() ? image.attr("data-src") : src;
    }

    private List<String> texts(Elements elements) {
        return elements.stream()
                .map(element -> element.text().trim())
                .filter(text -> !text.isEmpty())
                .toList();
    }

    private String firstValue(String line) {
        String[] parts = line.split(":", -1);
        return parts.length > 1 ? parts[1].trim() : "";
    }

    private String valueAfterLabel(String line) {
        int colon = line.indexOf(':');
        return colon < 0 ? "" : line.substring(colon + 1).trim();
    }
}
