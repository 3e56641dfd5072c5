package com.boxsort.controller;

import com.boxsort.service.ErrorKind;
import com.boxsort.service.ScanCoordinationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ScanCoordinationException.class)
    public ResponseEntity<Map<String, Object>> handleCoordination(ScanCoordinationException e) {
        HttpStatus status = statusFor(e.getKind());
        if (e.getKind() == ErrorKind.UNKNOWN_REQUIREMENT) {
            log.error("Requirement contract violated (job={}, session={}, barCode={})",
                e.getJobId(), e.getSessionId(), e.getBarCode(), e);
        } else {
            log.debug("{}: {}", e.getKind(), e.getMessage());
        }
        return ResponseEntity.status(status)
            .body(errorBody(e.getKind(), e.getMessage(), e.getJobId(), e.getSessionId(), e.getBarCode()));
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        return ResponseEntity.badRequest()
            .body(errorBody(ErrorKind.INVALID_REQUEST, "Invalid request body", null, null, null));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case SESSION_NOT_FOUND, ASSIGNMENT_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case SESSION_NOT_ACTIVE, ALREADY_ASSIGNED, INVALID_SESSION_TRANSITION, UNDO_TARGET_EMPTIED -> HttpStatus.CONFLICT;
            case NO_ASSIGNMENT -> HttpStatus.UNPROCESSABLE_ENTITY;
            case STORE_BUSY -> HttpStatus.SERVICE_UNAVAILABLE;
            case INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
            case UNKNOWN_REQUIREMENT -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static Map<String, Object> errorBody(ErrorKind kind, String message, String jobId,
                                                 Long sessionId, String barCode) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", kind.name());
        body.put("message", message);
        body.put("jobId", jobId);
        body.put("sessionId", sessionId);
        body.put("barCode", barCode);
        return body;
    }
}
