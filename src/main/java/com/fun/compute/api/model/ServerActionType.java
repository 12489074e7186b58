package com.fun.compute.api.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Named sub-operations of {@code POST /v1/servers/{id}/action}, keyed by the body's top-level key.
 */
public enum ServerActionType {
    CHANGE_PASSWORD("changePassword", false),
    REBOOT("reboot", false),
    RESIZE("resize", false),
    CONFIRM_RESIZE("confirmResize", false),
    REVERT_RESIZE("revertResize", false),
    REBUILD("rebuild", false),
    CREATE_IMAGE("createImage", false),
    CREATE_BACKUP("createBackup", true);

    private final String key;
    private final boolean adminApiOnly;

    ServerActionType(String key, boolean adminApiOnly) {
        this.key = key;
        this.adminApiOnly = adminApiOnly;
    }

    public String key() {
        return key;
    }

    public boolean adminApiOnly() {
        return adminApiOnly;
    }

    public static Optional<ServerActionType> fromKey(String key) {
        return Arrays.stream(values())
                .filter(type -> type.key.equals(key))
                .findFirst();
    }
}
