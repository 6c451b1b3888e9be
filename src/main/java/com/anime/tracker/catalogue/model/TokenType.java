package com.anime.tracker.catalogue.model;

public enum TokenType {
    EMAIL_VERIFICATION,
    PASSWORD_RESET
}
