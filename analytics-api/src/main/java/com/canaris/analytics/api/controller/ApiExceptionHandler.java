package com.canaris.analytics.api.controller;

import com.canaris.analytics.api.dto.ErrorResponseDto;
import com.canaris.analytics.exception.AnalyticsException;
import com.canaris.analytics.exception.InsufficientDataException;
import com.canaris.analytics.exception.InvalidMetricSetException;
import com.canaris.analytics.exception.ModelNotTrainedException;
import com.canaris.analytics.exception.ModelVersionNotFoundException;
import com.canaris.analytics.exception.PersistenceException;
import com.canaris.analytics.exception.TrainingTimeoutException;
import com.canaris.analytics.exception.UpstreamFetchException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({InsufficientDataException.class, InvalidMetricSetException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponseDto> badRequest(RuntimeException e, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponseDto> invalidBody(MethodArgumentNotValidException e, HttpServletRequest request) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, message, request);
    }

    @ExceptionHandler({ModelNotTrainedException.class, ModelVersionNotFoundException.class})
    public ResponseEntity<ErrorResponseDto> notFound(AnalyticsException e, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, e.getMessage(), request);
    }

    @ExceptionHandler(UpstreamFetchException.class)
    public ResponseEntity<ErrorResponseDto> upstream(UpstreamFetchException e, HttpServletRequest request) {
        log.error("Metric source failed for asset {}", e.getAssetId(), e);
        return respond(HttpStatus.BAD_GATEWAY, e.getMessage(), request);
    }

    @ExceptionHandler(TrainingTimeoutException.class)
    public ResponseEntity<ErrorResponseDto> timeout(TrainingTimeoutException e, HttpServletRequest request) {
        return respond(HttpStatus.GATEWAY_TIMEOUT, e.getMessage(), request);
    }

    @ExceptionHandler({PersistenceException.class, AnalyticsException.class})
    public ResponseEntity<ErrorResponseDto> internal(AnalyticsException e, HttpServletRequest request) {
        log.error("Request {} failed", request.getRequestURI(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), request);
    }

    private static ResponseEntity<ErrorResponseDto> respond(HttpStatus status, String message, HttpServletRequest request) {
        ErrorResponseDto body = ErrorResponseDto.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
