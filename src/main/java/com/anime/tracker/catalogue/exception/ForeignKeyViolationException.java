package com.anime.tracker.catalogue.exception;

public class ForeignKeyViolationException extends CatalogueException {
    public ForeignKeyViolationException(String message) {
        super(message);
    }
}
