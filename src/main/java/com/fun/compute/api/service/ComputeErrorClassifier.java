package com.fun.compute.api.service;

import com.fun.compute.api.exception.ComputeErrorKind;
import com.fun.compute.api.exception.ComputeException;
import com.fun.compute.api.exception.OverLimitException;
import com.fun.compute.api.model.ComputeOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

/**
 * Maps compute service failures to client-facing outcomes, per operation.
 * <p>
 * Callers write {@code throw classifier.classify(operation, ex, instanceId)}. A kind that has no
 * mapping for the operation comes back as the original exception, so it still reaches the caller
 * of this layer unchanged.
 */
@Component
public class ComputeErrorClassifier {

    private static final Logger log = LoggerFactory.getLogger(ComputeErrorClassifier.class);

    static final String NOT_FOUND = "The resource could not be found.";
    static final String MALFORMED =
            "The server could not comply with the request since it is either malformed or otherwise incorrect.";

    public RuntimeException classify(ComputeOperation operation, ComputeException error) {
        return classify(operation, error, null);
    }

    public RuntimeException classify(ComputeOperation operation, ComputeException error, String instanceId) {
        ComputeErrorKind kind = error.getKind();
        if (kind == ComputeErrorKind.UPSTREAM_STATUS && passesUpstreamStatus(operation)) {
            return new ResponseStatusException(upstreamStatus(error), error.getMessage(), error);
        }
        return switch (operation) {
            case LOOKUP, SHOW, UPDATE, DELETE, DIAGNOSTICS, ACTIONS -> kind.isNotFound()
                    ? notFound(NOT_FOUND, error)
                    : error;
            case LIST -> listError(error);
            case CREATE -> createError(error);
            case REBOOT -> {
                log.error("Error in reboot {}", error.getMessage(), error);
                yield new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY,
                        "Unable to process the contained instructions", error);
            }
            case RESIZE -> resizeError(error);
            case CONFIRM_RESIZE, REVERT_RESIZE -> resizeFollowUpError(operation, error);
            case REBUILD -> rebuildError(error, instanceId);
            case CREATE_IMAGE -> switch (kind) {
                case INSTANCE_BUSY -> new ResponseStatusException(HttpStatus.CONFLICT,
                        "Server is currently creating an image. Please wait.", error);
                case METADATA_LIMIT_EXCEEDED -> new OverLimitException("Image metadata limit exceeded");
                default -> error;
            };
            case CREATE_BACKUP -> kind == ComputeErrorKind.METADATA_LIMIT_EXCEEDED
                    ? new OverLimitException("Image metadata limit exceeded")
                    : error;
            case CHANGE_PASSWORD -> error;
        };
    }

    private RuntimeException listError(ComputeException error) {
        if (error.getKind().family() == ComputeErrorKind.Family.INVALID) {
            return badRequest(error.getMessage(), error);
        }
        if (error.getKind().isNotFound()) {
            return notFound(NOT_FOUND, error);
        }
        return error;
    }

    private RuntimeException createError(ComputeException error) {
        RuntimeException quota = fileQuotaError(error);
        if (quota != null) {
            return quota;
        }
        return switch (error.getKind()) {
            case INSTANCE_LIMIT_EXCEEDED -> new OverLimitException("Instance quotas have been exceeded");
            case INSTANCE_TYPE_MEMORY_TOO_SMALL, INSTANCE_TYPE_DISK_TOO_SMALL, SECURITY_GROUP_NOT_FOUND ->
                    badRequest(error.getMessage(), error);
            case IMAGE_NOT_FOUND -> badRequest("Can not find requested image", error);
            case FLAVOR_NOT_FOUND -> badRequest("Invalid flavorRef provided.", error);
            case KEYPAIR_NOT_FOUND -> badRequest("Invalid key_name provided.", error);
            case REMOTE_ERROR -> badRequest(error.getRemoteType() + ": " + error.getMessage(), error);
            default -> error;
        };
    }

    private RuntimeException resizeError(ComputeException error) {
        return switch (error.getKind()) {
            case FLAVOR_NOT_FOUND -> badRequest("Unable to locate requested flavor.", error);
            case CANNOT_RESIZE_TO_SAME_SIZE -> badRequest("Resize requires a change in size.", error);
            case CANNOT_RESIZE_TO_SMALLER_SIZE -> badRequest("Resizing to a smaller size is not supported.", error);
            default -> error;
        };
    }

    private RuntimeException resizeFollowUpError(ComputeOperation operation, ComputeException error) {
        if (error.getKind() == ComputeErrorKind.MIGRATION_NOT_FOUND) {
            return badRequest("Instance has not been resized.", error);
        }
        String step = operation == ComputeOperation.CONFIRM_RESIZE ? "confirm-resize" : "revert-resize";
        log.error("Error in {} {}", step, error.getMessage(), error);
        return badRequest(MALFORMED, error);
    }

    private RuntimeException rebuildError(ComputeException error, String instanceId) {
        RuntimeException quota = fileQuotaError(error);
        if (quota != null) {
            return quota;
        }
        return switch (error.getKind()) {
            case REBUILD_REQUIRES_ACTIVE_INSTANCE -> new ResponseStatusException(HttpStatus.CONFLICT,
                    "Instance " + instanceId + " must be active to rebuild.", error);
            case INSTANCE_NOT_FOUND -> notFound("Instance " + instanceId + " could not be found", error);
            case METADATA_LIMIT_EXCEEDED -> new OverLimitException("Metadata quota exceeded");
            default -> error;
        };
    }

    private RuntimeException fileQuotaError(ComputeException error) {
        return switch (error.getKind()) {
            case ONSET_FILE_LIMIT_EXCEEDED -> new OverLimitException("Personality file limit exceeded");
            case ONSET_FILE_PATH_LIMIT_EXCEEDED -> new OverLimitException("Personality file path too long");
            case ONSET_FILE_CONTENT_LIMIT_EXCEEDED -> new OverLimitException("Personality file content too long");
            default -> null;
        };
    }

    private boolean passesUpstreamStatus(ComputeOperation operation) {
        return operation == ComputeOperation.SHOW
                || operation == ComputeOperation.DELETE
                || operation == ComputeOperation.LOOKUP
                || operation.isServerAction();
    }

    private HttpStatusCode upstreamStatus(ComputeException error) {
        int status = error.getUpstreamStatus();
        return status >= 400 && status <= 599 ? HttpStatusCode.valueOf(status) : HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private ResponseStatusException badRequest(String reason, ComputeException cause) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason, cause);
    }

    private ResponseStatusException notFound(String reason, ComputeException cause) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, reason, cause);
    }
}
