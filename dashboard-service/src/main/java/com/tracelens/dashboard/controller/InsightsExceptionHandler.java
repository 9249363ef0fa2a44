package com.tracelens.dashboard.controller;

import com.tracelens.common.exception.TraceValidationException;
import com.tracelens.dashboard.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/** Maps engine and input failures onto HTTP answers with an {@link ErrorResponse} body. */
@RestControllerAdvice
public class InsightsExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(InsightsExceptionHandler.class);

    @ExceptionHandler(TraceValidationException.class)
    public ResponseEntity<ErrorResponse> invalidRecord(TraceValidationException e) {
        log.warn("Rejecting invalid trace batch. {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(ErrorResponse.validation(e));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badArgument(IllegalArgumentException e) {
        log.warn("Rejecting request. reason={}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of("bad_request", e.getMessage()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> unreadableInput(ServerWebInputException e) {
        String reason = e.getMostSpecificCause().getMessage();
        log.warn("Rejecting unreadable request body. reason={}", reason);
        return ResponseEntity.badRequest().body(ErrorResponse.of("bad_request", reason));
    }
}
