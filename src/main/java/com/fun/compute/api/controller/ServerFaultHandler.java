package com.fun.compute.api.controller;

import com.fun.compute.api.exception.ComputeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders failures as {@code {"<faultName>": {"code": n, "message": "..."}}}.
 */
@RestControllerAdvice(annotations = RestController.class)
public class ServerFaultHandler {

    private static final Logger log = LoggerFactory.getLogger(ServerFaultHandler.class);

    static final String COMPUTE_FAULT =
            "The server has either erred or is incapable of performing the requested operation.";

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleStatus(ResponseStatusException ex) {
        HttpHeaders headers = new HttpHeaders();
        headers.addAll(ex.getHeaders());
        String message = ex.getReason() != null ? ex.getReason() : reasonPhrase(ex.getStatusCode());
        return fault(ex.getStatusCode(), message, headers);
    }

    // Kinds the classifier leaves unmapped for an operation. The downstream message stays in the log.
    @ExceptionHandler(ComputeException.class)
    public ResponseEntity<Map<String, Object>> handleCompute(ComputeException ex) {
        log.error("Unhandled compute error {}: {}", ex.getKind(), ex.getMessage(), ex);
        return fault(HttpStatus.INTERNAL_SERVER_ERROR, COMPUTE_FAULT, new HttpHeaders());
    }

    static String faultName(HttpStatusCode status) {
        return switch (status.value()) {
            case 400 -> "badRequest";
            case 404 -> "itemNotFound";
            case 409 -> "conflictingRequest";
            case 413 -> "overLimit";
            case 422 -> "unprocessableEntity";
            default -> status.is4xxClientError() ? "badRequest" : "computeFault";
        };
    }

    private ResponseEntity<Map<String, Object>> fault(HttpStatusCode status, String message, HttpHeaders headers) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("code", status.value());
        detail.put("message", message);
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new ResponseEntity<>(Map.of(faultName(status), detail), headers, status);
    }

    private String reasonPhrase(HttpStatusCode status) {
        HttpStatus resolved = HttpStatus.resolve(status.value());
        return resolved != null ? resolved.getReasonPhrase() : String.valueOf(status.value());
    }
}
