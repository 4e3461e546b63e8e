package com.jay.formulaengine.controller;

import com.jay.formulaengine.layer2_formula.FormulaSyntaxException;
import com.jay.formulaengine.layer6_execution.ApprovalNotFoundException;
import com.jay.formulaengine.layer6_execution.ApprovalStateException;
import com.jay.formulaengine.layer6_execution.UnknownBrokerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Maps domain exceptions to HTTP status codes with a {@code {"error": reason}} body.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({ApprovalNotFoundException.class, NoSuchElementException.class, UnknownBrokerException.class})
    public ResponseEntity<Map<String, String>> notFound(RuntimeException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(ApprovalStateException.class)
    public ResponseEntity<Map<String, String>> conflict(ApprovalStateException e) {
        log.info("Rejected approval decision: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, FormulaSyntaxException.class})
    public ResponseEntity<Map<String, String>> badRequest(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    private ResponseEntity<Map<String, String>> error(HttpStatus status, String reason) {
        return ResponseEntity.status(status).body(Map.of("error", reason != null ? reason : status.getReasonPhrase()));
    }
}
