package com.anime.tracker.catalogue.exception;

public class CrawlFailureException extends CatalogueException {
    public CrawlFailureException(String message) {
        super(message);
    }

    public CrawlFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
