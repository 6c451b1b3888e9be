package com.anime.tracker.catalogue.exception;

/**
 * Base type of every failure the catalogue stores and the freshness coordinator raise.
 */
public abstract class CatalogueException extends RuntimeException {
    protected CatalogueException(String message) {
        super(message);
    }

    protected CatalogueException(String message, Throwable cause) {
        super(message, cause);
    }
}
