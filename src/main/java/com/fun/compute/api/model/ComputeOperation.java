package com.fun.compute.api.model;

public enum ComputeOperation {
    LOOKUP,
    SHOW,
    LIST,
    CREATE,
    UPDATE,
    DELETE,
    REBOOT,
    RESIZE,
    CONFIRM_RESIZE,
    REVERT_RESIZE,
    REBUILD,
    CREATE_IMAGE,
    CREATE_BACKUP,
    CHANGE_PASSWORD,
    DIAGNOSTICS,
    ACTIONS;

    public boolean isServerAction() {
        return switch (this) {
            case REBOOT, RESIZE, CONFIRM_RESIZE, REVERT_RESIZE, REBUILD,
                    CREATE_IMAGE, CREATE_BACKUP, CHANGE_PASSWORD -> true;
            default -> false;
        };
    }
}
