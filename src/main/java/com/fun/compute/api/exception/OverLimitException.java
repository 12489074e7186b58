package com.fun.compute.api.exception;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class OverLimitException extends ResponseStatusException {

    public OverLimitException(String reason) {
        super(HttpStatus.PAYLOAD_TOO_LARGE, reason);
    }

    @Override
    public HttpHeaders getHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.RETRY_AFTER, "0");
        return headers;
    }
}
