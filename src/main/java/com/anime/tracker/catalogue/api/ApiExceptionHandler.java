package com.anime.tracker.catalogue.api;

import com.anime.tracker.catalogue.exception.CrawlFailureException;
import com.anime.tracker.catalogue.exception.CrawlTimeoutException;
import com.anime.tracker.catalogue.exception.DuplicateKeyConflictException;
import com.anime.tracker.catalogue.exception.ForeignKeyViolationException;
import com.anime.tracker.catalogue.exception.InvalidTokenException;
import com.anime.tracker.catalogue.exception.TokenAlreadyUsedException;
import com.anime.tracker.catalogue.exception.TokenExpiredException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {
    @ExceptionHandler(DuplicateKeyConflictException.class)
    public ResponseEntity<ApiError> handleDuplicate(DuplicateKeyConflictException ex) {
        return error(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(ForeignKeyViolationException.class)
    public ResponseEntity<ApiError> handleForeignKey(ForeignKeyViolationException ex) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
    }

    @ExceptionHandler(CrawlTimeoutException.class)
    public ResponseEntity<ApiError> handleCrawlTimeout(CrawlTimeoutException ex) {
        return error(HttpStatus.GATEWAY_TIMEOUT, ex.getMessage());
    }

    @ExceptionHandler(CrawlFailureException.class)
    public ResponseEntity<ApiError> handleCrawlFailure(CrawlFailureException ex) {
        return error(HttpStatus.BAD_GATEWAY, ex.getMessage());
    }

    @ExceptionHandler({InvalidTokenException.class, TokenExpiredException.class, TokenAlreadyUsedException.class})
    public ResponseEntity<ApiError> handleToken(RuntimeException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleBadRequest(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiError> handleConflict(IllegalStateException ex) {
        return error(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handle(Exception ex) {
        log.error("Unhandled API error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error. Please try again.");
    }

    private ResponseEntity<ApiError> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(new ApiError(message, Instant.now()));
    }
}
