package com.sandcastle.dispatch.api;

import com.sandcastle.core.model.CodeExecutionException;
import com.sandcastle.core.model.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps {@link CodeExecutionException} to JSON errors: SYNTAX is the caller's fault (422),
 * RUNTIME means a worker failed without reporting (500).
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(CodeExecutionException.class)
    public ResponseEntity<Map<String, String>> handleExecutionFailure(CodeExecutionException e) {
        HttpStatus status = e.getKind() == ErrorKind.SYNTAX
                ? HttpStatus.UNPROCESSABLE_ENTITY
                : HttpStatus.INTERNAL_SERVER_ERROR;
        if (status.is5xxServerError()) {
            log.error("Execution failed: {}", e.getMessage(), e);
        }
        return ResponseEntity.status(status).body(Map.of(
                "error", e.getMessage(),
                "kind", e.getKind().name()
        ));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
