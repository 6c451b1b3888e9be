package com.anime.tracker.catalogue.exception;

public class TokenExpiredException extends CatalogueException {
    public TokenExpiredException(String message) {
        super(message);
    }
}
