package com.fun.compute.api.exception;

/**
 * Domain failure raised by the compute service. Callers translate it through
 * {@code ComputeErrorClassifier}; kinds the classifier does not map for an operation are
 * rethrown as this exception.
 */
public class ComputeException extends RuntimeException {

    private final ComputeErrorKind kind;
    private final String remoteType;
    private final int upstreamStatus;

    public ComputeException(ComputeErrorKind kind, String message) {
        this(kind, message, null, 0, null);
    }

    public ComputeException(ComputeErrorKind kind, String message, String remoteType, int upstreamStatus, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.remoteType = remoteType;
        this.upstreamStatus = upstreamStatus;
    }

    public static ComputeException remote(String remoteType, String message) {
        return new ComputeException(ComputeErrorKind.REMOTE_ERROR, message, remoteType, 0, null);
    }

    public static ComputeException upstream(int status, String message, Throwable cause) {
        return new ComputeException(ComputeErrorKind.UPSTREAM_STATUS, message, null, status, cause);
    }

    public ComputeErrorKind getKind() {
        return kind;
    }

    public String getRemoteType() {
        return remoteType;
    }

    public int getUpstreamStatus() {
        return upstreamStatus;
    }
}
