package com.anchorsync.api.controller;

import com.anchorsync.api.dto.ErrorBody;
import com.anchorsync.chain.RpcException;
import com.anchorsync.indexing.IndexQueryNotAvailableException;
import com.anchorsync.indexing.ModelNotIndexedException;
import com.anchorsync.indexing.ModelReindexException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Optional;

/**
 * Maps admin API failures to ErrorBody: validation 400, not indexed 404, re-index 409, sync pending or chain
 * unavailable 503.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = ex.getFieldErrors().stream()
                .findFirst()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(ModelNotIndexedException.class)
    public ResponseEntity<ErrorBody> handleNotIndexed(ModelNotIndexedException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of("MODEL_NOT_INDEXED", ex.getMessage()));
    }

    @ExceptionHandler(ModelReindexException.class)
    public ResponseEntity<ErrorBody> handleReindex(ModelReindexException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorBody.of("MODEL_REINDEX_REFUSED", ex.getMessage()));
    }

    @ExceptionHandler(IndexQueryNotAvailableException.class)
    public ResponseEntity<ErrorBody> handleQueryNotAvailable(IndexQueryNotAvailableException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("INDEX_QUERY_NOT_AVAILABLE", ex.getMessage()));
    }

    @ExceptionHandler(RpcException.class)
    public ResponseEntity<ErrorBody> handleRpc(RpcException ex) {
        log.warn("Chain unavailable for admin request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("CHAIN_UNAVAILABLE", ex.getMessage()));
    }
}
