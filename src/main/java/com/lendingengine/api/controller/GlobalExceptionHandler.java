package com.lendingengine.api.controller;

import com.lendingengine.common.exception.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for REST APIs.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(UnknownMarketException.class)
    public ResponseEntity<Map<String, String>> handleUnknownMarket(UnknownMarketException e) {
        return buildErrorResponse(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(MarketAlreadyExistsException.class)
    public ResponseEntity<Map<String, String>> handleMarketExists(MarketAlreadyExistsException e) {
        return buildErrorResponse(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler({UnauthorizedException.class, InvalidSignatureException.class})
    public ResponseEntity<Map<String, String>> handleUnauthorized(LendingEngineException e) {
        return buildErrorResponse(HttpStatus.FORBIDDEN, e);
    }

    @ExceptionHandler({InvalidInputException.class, UnsupportedRateModelException.class,
        UnsupportedLltvException.class, UnknownOracleException.class})
    public ResponseEntity<Map<String, String>> handleInvalidInput(LendingEngineException e) {
        return buildErrorResponse(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(OracleUnavailableException.class)
    public ResponseEntity<Map<String, String>> handleOracleUnavailable(OracleUnavailableException e) {
        return buildErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    @ExceptionHandler(ReentrantCallException.class)
    public ResponseEntity<Map<String, String>> handleReentrantCall(ReentrantCallException e) {
        log.error("Reentrant call reached the API", e);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    /**
     * Liquidity, solvency, balance and transfer failures.
     */
    @ExceptionHandler(LendingEngineException.class)
    public ResponseEntity<Map<String, String>> handleRejected(LendingEngineException e) {
        return buildErrorResponse(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidationErrors(MethodArgumentNotValidException e) {
        Map<String, String> errors = new HashMap<>();
        e.getBindingResult().getFieldErrors().forEach(error ->
            errors.put(error.getField(), error.getDefaultMessage())
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errors);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        Map<String, String> error = new HashMap<>();
        error.put("error", e.getMessage());
        error.put("status", String.valueOf(HttpStatus.BAD_REQUEST.value()));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        Map<String, String> error = new HashMap<>();
        error.put("error", "An unexpected error occurred: " + e.getMessage());
        error.put("status", String.valueOf(HttpStatus.INTERNAL_SERVER_ERROR.value()));
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ResponseEntity<Map<String, String>> buildErrorResponse(HttpStatus status, LendingEngineException e) {
        Map<String, String> error = new HashMap<>();
        error.put("error", e.getMessage());
        error.put("code", e.getErrorCode().name());
        error.put("status", String.valueOf(status.value()));
        return ResponseEntity.status(status).body(error);
    }
}
