package com.anime.tracker.catalogue.crawler;

import com.anime.tracker.catalogue.model.ListingQuery;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Page urls of the source site. Episode urls built here are the keys video sources
 * are stored under.
 */
@Component
public class SourceUrls {
    private final String baseUrl;

    public SourceUrls(@Value("${app.crawler.base-url:https://x3.sokuja.uk}") String baseUrl) {
        String trimmed = baseUrl.trim();
        this.baseUrl = trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    public String home() {
        return baseUrl;
    }

    public String anime(String slug) {
        return baseUrl + "/anime/" + slug + "/";
    }

    public String episode(String episodeSlug) {
        return baseUrl + "/" + episodeSlug + "/";
    }

    public String listing(ListingQuery query) {
        return baseUrl + "/anime/?page=" + query.page()
                + "&status=" + encode(query.status())
                + "&type=" + encode(query.type())
                + "&order=" + encode(query.order());
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
