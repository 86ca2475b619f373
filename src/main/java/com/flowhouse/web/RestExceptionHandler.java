package com.flowhouse.web;

import com.flowhouse.query.QueryExecutionException;
import com.flowhouse.query.QueryValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.UncheckedIOException;

/**
 * Maps failures to status codes. Error responses carry no body.
 *
 * Status Code Mapping:
 * - QueryValidationException -> 400 (missing or malformed query parameters)
 * - QueryExecutionException -> 500 (database failure, timeout, undecodable result)
 * - DataAccessException -> 500 (dictionary lookups)
 * - UncheckedIOException -> 500 (response serialization)
 */
@RestControllerAdvice
public class RestExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler(QueryValidationException.class)
    public ResponseEntity<Void> handleValidation(QueryValidationException e) {
        log.warn("Unable to generate SQL query ({}): {}", e.getReason(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).build();
    }

    @ExceptionHandler(QueryExecutionException.class)
    public ResponseEntity<Void> handleExecution(QueryExecutionException e) {
        log.error("Unable to process query: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Void> handleDataAccess(DataAccessException e) {
        log.error("Storage access failed: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }

    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<Void> handleSerialization(UncheckedIOException e) {
        log.error("Unable to write response: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }
}
