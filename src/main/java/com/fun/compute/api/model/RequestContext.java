package com.fun.compute.api.model;

public record RequestContext(
        String projectId,
        String userId,
        boolean admin,
        String applicationUrl
) {
}
