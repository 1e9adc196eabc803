package com.autonomous.orchestrator.controller;

import com.autonomous.orchestrator.exception.UnknownAgentException;
import com.autonomous.orchestrator.exception.UnknownMessageTypeException;
import com.autonomous.orchestrator.exception.WorkerUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ControlExceptionHandler {

    @ExceptionHandler(UnknownAgentException.class)
    public ResponseEntity<Map<String, String>> unknownAgent(UnknownAgentException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(WorkerUnavailableException.class)
    public ResponseEntity<Map<String, String>> unavailable(WorkerUnavailableException e) {
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler({UnknownMessageTypeException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, String>> badRequest(RuntimeException e) {
        log.debug("Rejected control request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message == null ? status.getReasonPhrase() : message));
    }
}
