package com.fun.compute.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerDto(
        String id,
        String name,
        String status,
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("user_id") String userId,
        String hostId,
        String accessIPv4,
        String accessIPv6,
        Integer progress,
        Reference image,
        Reference flavor,
        Map<String, String> metadata,
        @JsonProperty("security_groups") List<SecurityGroupRef> securityGroups,
        Instant created,
        Instant updated,
        String adminPass
) {

    public static ServerDto minimal(String id, String name) {
        return new ServerDto(id, name, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null);
    }

    public ServerDto withAdminPass(String password) {
        return new ServerDto(id, name, status, tenantId, userId, hostId, accessIPv4, accessIPv6, progress,
                image, flavor, metadata, securityGroups, created, updated, password);
    }

    public record Reference(String id) {
    }

    public record SecurityGroupRef(String name) {
    }
}
