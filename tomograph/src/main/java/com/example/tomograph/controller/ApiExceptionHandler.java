package com.example.tomograph.controller;

import com.example.tomograph.algorithm.TomographyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.UncheckedIOException;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(TomographyException.class)
    public ResponseEntity<Map<String, String>> scannerError(TomographyException e) {
        logger.warn("{}: {}", e.kind(), e.getMessage());
        return body(HttpStatus.BAD_REQUEST, e.kind(), e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        logger.warn("Rejected request: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "BadRequest", e.getMessage());
    }

    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<Map<String, String>> ioFailure(UncheckedIOException e) {
        logger.error("I/O failure", e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "IOFailure", e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of("error", error, "message", String.valueOf(message)));
    }
}
