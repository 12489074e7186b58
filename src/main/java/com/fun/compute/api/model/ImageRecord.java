package com.fun.compute.api.model;

public record ImageRecord(
        String id,
        String name
) {
}
