package com.fun.compute.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Map;
import java.util.Optional;

/**
 * Lifecycle states of the compute service and the public status string each one is shown as.
 */
public enum VmState {
    ACTIVE("active", "ACTIVE", Map.of(
            "rebooting", "REBOOT",
            "rebooting_hard", "HARD_REBOOT",
            "updating_password", "PASSWORD",
            "resize_verify", "VERIFY_RESIZE")),
    BUILDING("building", "BUILD", Map.of()),
    REBUILDING("rebuilding", "REBUILD", Map.of()),
    STOPPED("stopped", "STOPPED", Map.of()),
    MIGRATING("migrating", "MIGRATING", Map.of()),
    RESIZING("resizing", "RESIZE", Map.of()),
    PAUSED("paused", "PAUSED", Map.of()),
    SUSPENDED("suspended", "SUSPENDED", Map.of()),
    RESCUED("rescued", "RESCUE", Map.of()),
    ERROR("error", "ERROR", Map.of()),
    DELETED("deleted", "DELETED", Map.of()),
    SOFT_DELETE("soft-delete", "DELETED", Map.of());

    private final String value;
    private final String status;
    private final Map<String, String> taskStatuses;

    VmState(String value, String status, Map<String, String> taskStatuses) {
        this.value = value;
        this.status = status;
        this.taskStatuses = taskStatuses;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public String status() {
        return status;
    }

    public String statusFor(String taskState) {
        if (taskState == null) {
            return status;
        }
        return taskStatuses.getOrDefault(taskState, status);
    }

    /**
     * Reverse lookup used by the {@code status} list filter. Several states share {@code DELETED};
     * the first declared one wins.
     */
    public static Optional<VmState> fromStatus(String status) {
        if (status == null) {
            return Optional.empty();
        }
        for (VmState state : values()) {
            if (state.status.equalsIgnoreCase(status)) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }

    public static Optional<VmState> fromValue(String value) {
        for (VmState state : values()) {
            if (state.value.equals(value)) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }
}
