package com.fun.compute.api.exception;

/**
 * Failure kinds the compute service reports. The wire code is what the service puts in the
 * {@code kind} field of its error body.
 */
public enum ComputeErrorKind {
    NOT_FOUND(Family.NOT_FOUND),
    INSTANCE_NOT_FOUND(Family.NOT_FOUND),
    FLAVOR_NOT_FOUND(Family.NOT_FOUND),
    IMAGE_NOT_FOUND(Family.NOT_FOUND),
    KEYPAIR_NOT_FOUND(Family.NOT_FOUND),
    SECURITY_GROUP_NOT_FOUND(Family.NOT_FOUND),
    MIGRATION_NOT_FOUND(Family.NOT_FOUND),

    QUOTA_EXCEEDED(Family.QUOTA),
    ONSET_FILE_LIMIT_EXCEEDED(Family.QUOTA),
    ONSET_FILE_PATH_LIMIT_EXCEEDED(Family.QUOTA),
    ONSET_FILE_CONTENT_LIMIT_EXCEEDED(Family.QUOTA),
    INSTANCE_LIMIT_EXCEEDED(Family.QUOTA),
    METADATA_LIMIT_EXCEEDED(Family.QUOTA),

    INVALID(Family.INVALID),
    INSTANCE_TYPE_MEMORY_TOO_SMALL(Family.INVALID),
    INSTANCE_TYPE_DISK_TOO_SMALL(Family.INVALID),
    CANNOT_RESIZE_TO_SAME_SIZE(Family.INVALID),
    CANNOT_RESIZE_TO_SMALLER_SIZE(Family.INVALID),

    REBUILD_REQUIRES_ACTIVE_INSTANCE(Family.STATE),
    INSTANCE_BUSY(Family.STATE),

    /** Opaque failure raised inside the compute service; carries the remote exception type. */
    REMOTE_ERROR(Family.REMOTE),
    /** HTTP failure from a downstream zone that carries no domain kind, only a status. */
    UPSTREAM_STATUS(Family.REMOTE);

    public enum Family {
        NOT_FOUND,
        QUOTA,
        INVALID,
        STATE,
        REMOTE
    }

    private final Family family;

    ComputeErrorKind(Family family) {
        this.family = family;
    }

    public Family family() {
        return family;
    }

    public boolean isNotFound() {
        return family == Family.NOT_FOUND;
    }
}
