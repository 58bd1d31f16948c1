package com.netcourier.docqa.controller;

import com.netcourier.docqa.service.error.ErrorKind;
import com.netcourier.docqa.service.error.RagException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(RagException.class)
    public ResponseEntity<Map<String, Object>> handleRagException(RagException exception) {
        if (exception.kind().status().is5xxServerError()) {
            log.warn("Request failed with {}: {}", exception.kind(), exception.getMessage());
        }
        return body(exception.kind(), exception.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(WebExchangeBindException exception) {
        String message = exception.getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        return body(ErrorKind.INVALID_PARAMETERS, message.isEmpty() ? exception.getReason() : message);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInput(ServerWebInputException exception) {
        return body(ErrorKind.INVALID_PARAMETERS, exception.getReason() == null ? "Malformed request" : exception.getReason());
    }

    private static String describe(FieldError error) {
        return error.getField() + " " + error.getDefaultMessage();
    }

    private static ResponseEntity<Map<String, Object>> body(ErrorKind kind, String message) {
        return ResponseEntity.status(kind.status())
                .body(Map.of(
                        "error", kind.name(),
                        "message", message == null ? kind.name() : message
                ));
    }
}
