package com.fun.compute.api.model;

import java.time.Instant;

public record InstanceActionRecord(
        Instant createdAt,
        String action,
        String error
) {
}
