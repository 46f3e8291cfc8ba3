package com.restaurantai.chat.controller;

import com.restaurantai.chat.dto.ChatResponse;
import com.restaurantai.chat.service.EmptyMessageException;
import com.restaurantai.chat.service.StoreUnavailableException;
import com.restaurantai.chat.service.TenantNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps pipeline failures to the {@code {success:false, error}} envelope.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String RESTAURANT_NOT_FOUND = "Restaurant not found";
    static final String RESTAURANT_NOT_SPECIFIED = "Restaurant not specified";
    static final String GENERIC_FAILURE = "Failed to generate response";

    @ExceptionHandler(TenantNotFoundException.class)
    public ResponseEntity<ChatResponse> handleTenantNotFound(TenantNotFoundException e) {
        logger.info("Tenant lookup failed: {}", e.getMessage());
        String error = e.isUnrouted() ? RESTAURANT_NOT_SPECIFIED : RESTAURANT_NOT_FOUND;
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ChatResponse.failure(error));
    }

    @ExceptionHandler(EmptyMessageException.class)
    public ResponseEntity<ChatResponse> handleEmptyMessage(EmptyMessageException e) {
        return ResponseEntity.badRequest().body(ChatResponse.failure(e.getMessage()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ChatResponse> handleBadRequest(Exception e) {
        logger.debug("Rejected malformed request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ChatResponse.failure("Invalid request"));
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ChatResponse> handleStoreUnavailable(StoreUnavailableException e) {
        logger.error("Store unavailable: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ChatResponse.failure("Service unavailable"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ChatResponse> handleUnexpected(Exception e) {
        logger.error("Unhandled error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ChatResponse.failure(GENERIC_FAILURE));
    }
}
