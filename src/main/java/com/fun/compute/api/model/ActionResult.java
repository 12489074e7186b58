package com.fun.compute.api.model;

import org.springframework.http.HttpStatus;

import java.net.URI;

public record ActionResult(
        HttpStatus status,
        URI location,
        Object body
) {

    public static ActionResult accepted() {
        return new ActionResult(HttpStatus.ACCEPTED, null, null);
    }

    public static ActionResult noContent() {
        return new ActionResult(HttpStatus.NO_CONTENT, null, null);
    }

    public static ActionResult acceptedAt(URI location) {
        return new ActionResult(HttpStatus.ACCEPTED, location, null);
    }

    public static ActionResult acceptedWith(Object body) {
        return new ActionResult(HttpStatus.ACCEPTED, null, body);
    }
}
