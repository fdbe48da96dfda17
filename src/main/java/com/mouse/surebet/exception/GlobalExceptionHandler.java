package com.mouse.surebet.exception;

import com.mouse.surebet.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ApiError> handleConfiguration(ConfigurationException e, HttpServletRequest request) {
        log.warn("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException e, HttpServletRequest request) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Malformed request body", request);
    }

    @ExceptionHandler(EngineNotFoundException.class)
    public ResponseEntity<ApiError> handleEngineNotFound(EngineNotFoundException e, HttpServletRequest request) {
        return error(HttpStatus.NOT_FOUND, "ENGINE_NOT_FOUND", e.getMessage(), request);
    }

    @ExceptionHandler(MatchNotFoundException.class)
    public ResponseEntity<ApiError> handleMatchNotFound(MatchNotFoundException e, HttpServletRequest request) {
        return error(HttpStatus.NOT_FOUND, "MATCH_NOT_FOUND", e.getMessage(), request);
    }

    @ExceptionHandler(TransientFetchException.class)
    public ResponseEntity<ApiError> handleTransient(TransientFetchException e, HttpServletRequest request) {
        log.warn("Feed unavailable during {}: {}", request.getRequestURI(), e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "FEED_UNAVAILABLE", e.getMessage(), request);
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, HttpServletRequest request) {
        return ResponseEntity.status(status).body(new ApiError(code, message, request.getRequestURI(), Instant.now()));
    }
}
