package com.chatflow.chatflow_backend.controller;

import com.chatflow.chatflow_backend.exception.ConversationBusyException;
import com.chatflow.chatflow_backend.exception.FlowNotFoundException;
import com.chatflow.chatflow_backend.exception.GraphException;
import com.chatflow.chatflow_backend.exception.PersistenceException;
import com.chatflow.chatflow_backend.exception.VersionConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(FlowNotFoundException.class)
    public ResponseEntity<ApiError> flowNotFound(FlowNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "FLOW_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(GraphException.class)
    public ResponseEntity<ApiError> invalidGraph(GraphException ex) {
        log.warn("Flow definition rejected: {}", ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_FLOW", ex.getMessage());
    }

    @ExceptionHandler({VersionConflictException.class, ConversationBusyException.class})
    public ResponseEntity<ApiError> conflict(RuntimeException ex) {
        return error(HttpStatus.CONFLICT, "CONVERSATION_CONFLICT", ex.getMessage());
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<ApiError> storeUnavailable(PersistenceException ex) {
        log.error("Conversation store unavailable", ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "STORE_UNAVAILABLE", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> invalidRequest(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .findFirst()
                .orElse("invalid request");
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", message);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> badArgument(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMessage());
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ApiError(code, message));
    }

    public record ApiError(String error, String message) {}
}
