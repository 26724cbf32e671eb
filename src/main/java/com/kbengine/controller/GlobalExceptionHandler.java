package com.kbengine.controller;

import com.kbengine.exception.ConfigurationException;
import com.kbengine.exception.EntityNotFoundException;
import com.kbengine.exception.PipelineException;
import com.kbengine.exception.StoreUnavailableException;
import com.kbengine.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(DuplicateKeyException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateKey(DuplicateKeyException ex) {
        return error("Duplicate entity", HttpStatus.CONFLICT, null);
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(EntityNotFoundException ex) {
        return error(ex.getMessage(), HttpStatus.NOT_FOUND, Map.of("id", ex.getEntityId()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParams(MissingServletRequestParameterException ex) {
        String message = String.format("Parameter '%s' is missing", ex.getParameterName());
        return error(message, HttpStatus.BAD_REQUEST, null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String message = String.format("Parameter '%s' has an invalid value", ex.getName());
        return error(message, HttpStatus.BAD_REQUEST, null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        Map<String, Object> fields = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors()
            .forEach(fieldError -> fields.put(fieldError.getField(), fieldError.getDefaultMessage()));
        return error("Invalid request body", HttpStatus.BAD_REQUEST, fields);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex) {
        return error(ex.getMessage(), HttpStatus.BAD_REQUEST, null);
    }

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<ErrorResponse> handlePipeline(PipelineException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("documentId", ex.getDocumentId());
        return error(ex.getMessage(), HttpStatus.UNPROCESSABLE_ENTITY, details);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(StoreUnavailableException ex) {
        log.error("Store unavailable: {}", ex.getStore(), ex);
        return error(ex.getMessage(), HttpStatus.SERVICE_UNAVAILABLE, Map.of("store", ex.getStore()));
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(ConfigurationException ex) {
        return error(ex.getMessage(), HttpStatus.SERVICE_UNAVAILABLE, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled error", ex);
        return error("An unexpected error occurred", HttpStatus.INTERNAL_SERVER_ERROR, null);
    }

    private static ResponseEntity<ErrorResponse> error(String message, HttpStatus status, Map<String, Object> details) {
        ErrorResponse body = new ErrorResponse(message, status.value(), Instant.now().toEpochMilli(), details);
        return new ResponseEntity<>(body, status);
    }
}
