package com.anime.tracker.catalogue.exception;

import java.time.Duration;

public class CrawlTimeoutException extends CrawlFailureException {
    public CrawlTimeoutException(String key, Duration timeout) {
        super("Crawl for " + key + " did not finish within " + timeout.toMillis() + "ms");
    }
}
