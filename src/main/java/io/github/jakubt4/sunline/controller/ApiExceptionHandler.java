package io.github.jakubt4.sunline.controller;

import io.github.jakubt4.sunline.astro.InvalidDateException;
import io.github.jakubt4.sunline.dto.ErrorResponse;
import io.github.jakubt4.sunline.service.NoCrossingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps model failures to HTTP responses: invalid input to {@code 400}, a day without sunrise
 * or sunset to {@code 404}.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({InvalidDateException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleInvalidInput(final RuntimeException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(ErrorResponse.REJECTED, e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(final MethodArgumentTypeMismatchException e) {
        final var message = String.format("Invalid value for parameter '%s': %s", e.getName(), e.getValue());
        log.warn("Rejected request: {}", message);
        return ResponseEntity.badRequest().body(new ErrorResponse(ErrorResponse.REJECTED, message));
    }

    @ExceptionHandler(NoCrossingException.class)
    public ResponseEntity<ErrorResponse> handleNoCrossing(final NoCrossingException e) {
        log.info("No crossing: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse(ErrorResponse.NO_CROSSING, e.getMessage()));
    }
}
