package com.example.smartroll.config;

import com.example.smartroll.dto.CheckInResponse;
import com.example.smartroll.exception.CheckInUnavailableException;
import com.example.smartroll.exception.InvalidRequestException;
import com.example.smartroll.service.OutcomeEncoder;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Precondition faults become the invalid-argument response; infrastructure faults become
 * a 503 "try again" that no client can mistake for off-network or session-not-found.
 */
@RestControllerAdvice
@RequiredArgsConstructor
public class ApiExceptionHandler {

    private final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private final OutcomeEncoder outcomeEncoder;

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<CheckInResponse> handleInvalidArgument(InvalidRequestException ex) {
        log.debug("Rejected malformed request: {}", ex.getMessage());
        return outcomeEncoder.encodeInvalidArgument(ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<CheckInResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Rejected unreadable request body: {}", ex.getMessage());
        return outcomeEncoder.encodeInvalidArgument("request body must be a JSON object");
    }

    @ExceptionHandler(CheckInUnavailableException.class)
    public ResponseEntity<CheckInResponse> handleUnavailable(CheckInUnavailableException ex) {
        log.warn("Check-in unavailable ({}): {}", ex.getComponent(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(CheckInResponse.builder()
                .status(CheckInResponse.STATUS_ERROR)
                .error("service_unavailable")
                .message("Check-in is temporarily unavailable, please try again")
                .retryable(true)
                .build());
    }
}
