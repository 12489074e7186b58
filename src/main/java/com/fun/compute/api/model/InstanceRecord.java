package com.fun.compute.api.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record InstanceRecord(
        String uuid,
        String displayName,
        String projectId,
        String userId,
        String vmState,
        String taskState,
        String flavorId,
        String imageRef,
        String hostId,
        String accessIpV4,
        String accessIpV6,
        Integer progress,
        Map<String, String> metadata,
        List<String> securityGroups,
        Instant createdAt,
        Instant updatedAt
) {
}
