package com.anime.tracker.catalogue.exception;

public class InvalidTokenException extends CatalogueException {
    public InvalidTokenException(String message) {
        super(message);
    }
}
