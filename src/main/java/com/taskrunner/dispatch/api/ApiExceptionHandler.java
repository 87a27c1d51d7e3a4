package com.taskrunner.dispatch.api;

import com.taskrunner.core.graph.DependencyCycleException;
import com.taskrunner.core.node.NodeLifecycleConflictException;
import com.taskrunner.core.node.NodeLimitExceededException;
import com.taskrunner.core.node.NodeNotFoundException;
import com.taskrunner.core.orchestrator.InvalidTransitionException;
import com.taskrunner.core.orchestrator.TaskNotFoundException;
import com.taskrunner.core.orchestrator.TaskValidationException;
import com.taskrunner.core.security.InvalidCallbackTokenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain exceptions to HTTP statuses. Every error body is {@code {"error": "..."}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({TaskValidationException.class, DependencyCycleException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, Object>> badRequest(Exception e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler({TaskNotFoundException.class, NodeNotFoundException.class})
    public ResponseEntity<Map<String, Object>> notFound(RuntimeException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<Map<String, Object>> invalidTransition(InvalidTransitionException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        if (e.getCurrentStatus() != null) {
            body.put("current_status", e.getCurrentStatus().wireName());
        }
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(NodeLifecycleConflictException.class)
    public ResponseEntity<Map<String, Object>> lifecycleConflict(NodeLifecycleConflictException e) {
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(NodeLimitExceededException.class)
    public ResponseEntity<Map<String, Object>> nodeLimit(NodeLimitExceededException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("limit", e.getLimit());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(body);
    }

    @ExceptionHandler(InvalidCallbackTokenException.class)
    public ResponseEntity<Map<String, Object>> unauthorized(InvalidCallbackTokenException e) {
        log.warn("Rejected credential: {}", e.getMessage());
        return error(HttpStatus.UNAUTHORIZED, e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        return ResponseEntity.status(status).body(body);
    }
}
