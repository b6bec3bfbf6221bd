package com.fstner.interfaces.api;

import com.fstner.infrastructure.transducer.exception.DefinitionLoadException;
import com.fstner.infrastructure.transducer.exception.DuplicateStateException;
import com.fstner.infrastructure.transducer.exception.InvalidPatternException;
import com.fstner.infrastructure.transducer.exception.UnknownStateException;
import com.fstner.interfaces.api.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(DuplicateStateException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateState(DuplicateStateException e) {
        log.warn("[GlobalExceptionHandler] Rejected duplicate state '{}'", e.getStateId());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("DUPLICATE_STATE", e.getMessage()));
    }

    @ExceptionHandler(UnknownStateException.class)
    public ResponseEntity<ErrorResponse> handleUnknownState(UnknownStateException e) {
        log.warn("[GlobalExceptionHandler] Rejected reference to unknown state '{}'", e.getStateId());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("UNKNOWN_STATE", e.getMessage()));
    }

    @ExceptionHandler(InvalidPatternException.class)
    public ResponseEntity<ErrorResponse> handleInvalidPattern(InvalidPatternException e) {
        log.warn("[GlobalExceptionHandler] Rejected invalid pattern '{}'", e.getPattern());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_PATTERN", e.getMessage()));
    }

    @ExceptionHandler(DefinitionLoadException.class)
    public ResponseEntity<ErrorResponse> handleDefinitionLoad(DefinitionLoadException e) {
        log.warn("[GlobalExceptionHandler] Definition load failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("DEFINITION_LOAD_ERROR", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_ARGUMENT", e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("MALFORMED_REQUEST", "Request body is missing or malformed"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getDefaultMessage())
                .orElse("Invalid request");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("[GlobalExceptionHandler] Unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "Internal server error"));
    }
}
