package com.al.clinicalsummary.exception;

import com.al.clinicalsummary.dto.ErrorResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.stream.Collectors;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({ JsonProcessingException.class, HttpMessageNotReadableException.class })
    public ResponseEntity<ErrorResponse> handleJsonError(Exception e, HttpServletRequest request) {
        log.error("JSON Processing Error: {}", e.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "Invalid JSON format", e.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e,
            HttpServletRequest request) {
        String details = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("Request validation failed: {}", details);
        return buildResponse(HttpStatus.BAD_REQUEST, "Invalid Input", details, request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadInput(IllegalArgumentException e, HttpServletRequest request) {
        log.warn("Invalid Input: {}", e.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "Invalid Input", e.getMessage(), request);
    }

    @ExceptionHandler(DuplicateProcessingException.class)
    public ResponseEntity<ErrorResponse> handleDuplicate(DuplicateProcessingException e, HttpServletRequest request) {
        log.warn("Rejected duplicate submission: {}", e.getMessage());
        return buildResponse(HttpStatus.CONFLICT, "Already Processing", e.getMessage(), request);
    }

    @ExceptionHandler(SummaryNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(SummaryNotFoundException e, HttpServletRequest request) {
        return buildResponse(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), request);
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ErrorResponse> handleIo(IOException e, HttpServletRequest request) {
        log.error("I/O Error: {}", e.getMessage(), e);
        return buildResponse(HttpStatus.BAD_REQUEST, "I/O Error", e.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralError(Exception e, HttpServletRequest request) {
        log.error("Internal Server Error: ", e);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred",
                request);
    }

    private ResponseEntity<ErrorResponse> buildResponse(HttpStatus status, String error, String message,
            HttpServletRequest request) {
        ErrorResponse response = new ErrorResponse(
                LocalDateTime.now(),
                status.value(),
                error,
                message,
                request.getRequestURI());
        return new ResponseEntity<>(response, status);
    }
}
