package com.fun.compute.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record InstanceActionsResponse(List<Entry> actions) {

    public record Entry(
            @JsonProperty("created_at") String createdAt,
            String action,
            String error
    ) {
    }
}
