package com.openforge.docrouter.web;

import com.openforge.docrouter.knowledge.KnowledgeValidationException;
import com.openforge.docrouter.routing.StorageUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;

/** Maps service exceptions to {code, message} bodies. */
@Slf4j
@RestControllerAdvice
public class ErrorHandler {

    @ExceptionHandler(KnowledgeValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(KnowledgeValidationException ex) {
        return body("VALIDATION_FAILED", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidRequest(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return body("VALIDATION_FAILED", message);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleMalformed(Exception ex) {
        return body("MALFORMED_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(NoSuchElementException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(NoSuchElementException ex) {
        return body("NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleIllegalState(IllegalStateException ex) {
        return body("ILLEGAL_STATE", ex.getMessage());
    }

    @ExceptionHandler(StorageUnavailableException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleStorage(StorageUnavailableException ex) {
        log.error("[Web] {}", ex.getMessage(), ex.getCause());
        return body("STORAGE_UNAVAILABLE", ex.getMessage());
    }

    @ExceptionHandler(CancellationException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleCancelled(CancellationException ex) {
        return body("CANCELLED", ex.getMessage());
    }

    private static Map<String, Object> body(String code, String message) {
        return Map.of("code", code, "message", message == null ? "" : message);
    }
}
