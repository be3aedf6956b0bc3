package io.github.drompincen.carebridge.gateway.controller;

import io.github.drompincen.carebridge.protocol.api.ErrorResponse;
import io.github.drompincen.carebridge.protocol.api.InvalidTransitionResponse;
import io.github.drompincen.carebridge.runtime.workflow.DuplicateTransitionException;
import io.github.drompincen.carebridge.runtime.workflow.InvalidTransitionException;
import io.github.drompincen.carebridge.runtime.workflow.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> sessionNotFound(SessionNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(e.getMessage()));
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<InvalidTransitionResponse> invalidTransition(InvalidTransitionException e) {
        log.info("Rejected transition for session {}: {} -> {}",
                e.getSessionCouchId(), e.getCurrentState(), e.getRequestedState());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(new InvalidTransitionResponse(
                e.getMessage(),
                e.getSessionCouchId(),
                e.getCurrentState(),
                e.getRequestedState(),
                e.getAllowedNextStates()));
    }

    @ExceptionHandler(DuplicateTransitionException.class)
    public ResponseEntity<ErrorResponse> duplicateTransition(DuplicateTransitionException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.of(e.getMessage()));
    }
}
