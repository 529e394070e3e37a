package com.skillmap.catalog.api;

import com.skillmap.catalog.service.CatalogException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.util.Map;

/**
 * Translates exceptions from every controller into HTTP responses.
 *
 * Catalog rule violations become {@code {"error": "..."}} with 404/422/409.
 * Spring MVC's own request errors (bad query parameter types, unreadable
 * JSON) keep their standard 4xx handling from the superclass. Anything else
 * is a 500 and is logged with its stack trace.
 */
@RestControllerAdvice
public class CatalogExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(CatalogExceptionHandler.class);

    @ExceptionHandler(CatalogException.class)
    public ResponseEntity<Map<String, String>> handleCatalogException(CatalogException ex, WebRequest request) {
        HttpStatus status = switch (ex.getKind()) {
            case NOT_FOUND  -> HttpStatus.NOT_FOUND;
            case VALIDATION -> HttpStatus.UNPROCESSABLE_ENTITY;
            case CONFLICT   -> HttpStatus.CONFLICT;
        };
        log.warn("{} {} ({}): {}", status.value(), request.getDescription(false),
                ex.getReason(), ex.getMessage());
        return ResponseEntity.status(status).body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleUnexpected(Exception ex, WebRequest request) {
        log.error("Unexpected error on {}", request.getDescription(false), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "Internal server error"));
    }
}
