package com.anime.tracker.catalogue.exception;

/**
 * A write would give a natural key to a second owner, e.g. an episode url already
 * attached to another anime.
 */
public class DuplicateKeyConflictException extends CatalogueException {
    public DuplicateKeyConflictException(String message) {
        super(message);
    }
}
