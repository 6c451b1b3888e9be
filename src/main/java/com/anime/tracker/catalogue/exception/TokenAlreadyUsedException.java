package com.anime.tracker.catalogue.exception;

public class TokenAlreadyUsedException extends CatalogueException {
    public TokenAlreadyUsedException(String message) {
        super(message);
    }
}
