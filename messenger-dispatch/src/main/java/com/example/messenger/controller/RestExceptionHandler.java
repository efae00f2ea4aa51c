package com.example.messenger.controller;

import com.example.messenger.service.exception.CaptchaRequiredException;
import com.example.messenger.service.exception.ServiceException;
import com.example.messenger.store.SharedStoreException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class RestExceptionHandler {

    @ExceptionHandler(CaptchaRequiredException.class)
    public ResponseEntity<?> handleCaptchaRequired(CaptchaRequiredException ex) {
        Map<String, Object> payload = basePayload(ex.getMessage(), ex.getErrorCode());
        payload.put("captcha_required", true);
        if (ex.getCaptchaToken() != null) {
            payload.put("captcha_token", ex.getCaptchaToken());
            payload.put("captcha_question", ex.getCaptchaQuestion());
        }
        return ResponseEntity.status(ex.getStatus()).body(payload);
    }

    @ExceptionHandler(ServiceException.class)
    public ResponseEntity<?> handleServiceException(ServiceException ex) {
        return ResponseEntity.status(ex.getStatus()).body(basePayload(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(SharedStoreException.class)
    public ResponseEntity<?> handleStoreUnavailable(SharedStoreException ex) {
        log.error("Shared store unavailable operation={} key={}", ex.getOperation(), ex.getKey(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(basePayload("Service temporarily unavailable", "store_unavailable"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<?> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, Object> payload = basePayload("validation_error", "validation_error");
        payload.put("details", ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList());
        return ResponseEntity.badRequest().body(payload);
    }

    @ExceptionHandler({
        MissingServletRequestParameterException.class,
        MissingRequestHeaderException.class,
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    public ResponseEntity<?> handleBadRequest(Exception ex) {
        return ResponseEntity.badRequest().body(basePayload(ex.getMessage(), "validation_error"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<?> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(basePayload(ex.getMessage(), null));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<?> handleIllegalState(IllegalStateException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(basePayload(ex.getMessage(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<?> handleGeneric(Exception ex) {
        log.error("Unhandled request failure", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(basePayload("Internal server error", "internal_error"));
    }

    private Map<String, Object> basePayload(String message, String code) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("timestamp", Instant.now().toString());
        payload.put("error", message);
        if (code != null) {
            payload.put("code", code);
        }
        return payload;
    }
}
