package com.fun.compute.api.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fun.compute.api.config.ComputeProperties;
import com.fun.compute.api.exception.ComputeException;
import com.fun.compute.api.model.ActionResult;
import com.fun.compute.api.model.ComputeOperation;
import com.fun.compute.api.model.ImageRecord;
import com.fun.compute.api.model.InjectedFile;
import com.fun.compute.api.model.InstanceRecord;
import com.fun.compute.api.model.RebootType;
import com.fun.compute.api.model.RebuildCommand;
import com.fun.compute.api.model.RequestContext;
import com.fun.compute.api.model.ServerActionType;
import com.fun.compute.api.model.ServerResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dispatches {@code POST /v1/servers/{id}/action}.
 * <p>
 * Only the first top-level key of the body is looked at: a recognized action runs, anything else
 * is rejected naming that key. Any further keys are ignored, so a body with two actions runs the
 * one that appears first in the document. {@code createBackup} is recognized only while the admin
 * API is enabled.
 */
@Component
public class ServerActionRouter {

    private static final Logger log = LoggerFactory.getLogger(ServerActionRouter.class);

    @FunctionalInterface
    interface ActionHandler {
        ActionResult handle(RequestContext context, String instanceId, JsonNode entity);
    }

    private final ComputeClient computeClient;
    private final ServerService serverService;
    private final ServerRequestNormalizer normalizer;
    private final ServerRequestValidator validator;
    private final ComputeErrorClassifier errorClassifier;
    private final ServerViewBuilder viewBuilder;
    private final PasswordGenerator passwordGenerator;
    private final ComputeProperties computeProperties;
    private final Map<ServerActionType, ActionHandler> handlers = new EnumMap<>(ServerActionType.class);

    public ServerActionRouter(ComputeClient computeClient,
                              ServerService serverService,
                              ServerRequestNormalizer normalizer,
                              ServerRequestValidator validator,
                              ComputeErrorClassifier errorClassifier,
                              ServerViewBuilder viewBuilder,
                              PasswordGenerator passwordGenerator,
                              ComputeProperties computeProperties) {
        this.computeClient = computeClient;
        this.serverService = serverService;
        this.normalizer = normalizer;
        this.validator = validator;
        this.errorClassifier = errorClassifier;
        this.viewBuilder = viewBuilder;
        this.passwordGenerator = passwordGenerator;
        this.computeProperties = computeProperties;

        handlers.put(ServerActionType.CHANGE_PASSWORD, this::changePassword);
        handlers.put(ServerActionType.REBOOT, this::reboot);
        handlers.put(ServerActionType.RESIZE, this::resize);
        handlers.put(ServerActionType.CONFIRM_RESIZE, this::confirmResize);
        handlers.put(ServerActionType.REVERT_RESIZE, this::revertResize);
        handlers.put(ServerActionType.REBUILD, this::rebuild);
        handlers.put(ServerActionType.CREATE_IMAGE, this::createImage);
        handlers.put(ServerActionType.CREATE_BACKUP, this::createBackup);
    }

    public ActionResult route(RequestContext context, String instanceId, String body, MediaType contentType) {
        return dispatch(context, instanceId, normalizer.normalizeAction(body, contentType));
    }

    public ActionResult dispatch(RequestContext context, String instanceId, ObjectNode body) {
        Iterator<String> keys = body.fieldNames();
        if (!keys.hasNext()) {
            throw badRequest("Invalid request body");
        }
        String key = keys.next();
        ServerActionType type = resolve(key)
                .orElseThrow(() -> badRequest("There is no such server action: " + key));
        log.info("Dispatching {} on server {}", key, instanceId);
        return handlers.get(type).handle(context, instanceId, body.get(key));
    }

    public Optional<ServerActionType> resolve(String key) {
        return ServerActionType.fromKey(key)
                .filter(type -> !type.adminApiOnly() || computeProperties.isAllowAdminApi());
    }

    private ActionResult changePassword(RequestContext context, String instanceId, JsonNode entity) {
        if (entity == null || !entity.isObject() || !entity.has("adminPass")) {
            throw badRequest("No adminPass was specified");
        }
        JsonNode password = entity.get("adminPass");
        if (!password.isTextual() || password.asText().isEmpty()) {
            throw badRequest("Invalid adminPass");
        }
        InstanceRecord instance = serverService.findInstance(context, instanceId);
        try {
            computeClient.setAdminPassword(context, instance, password.asText());
        } catch (ComputeException ex) {
            throw errorClassifier.classify(ComputeOperation.CHANGE_PASSWORD, ex, instanceId);
        }
        return ActionResult.accepted();
    }

    private ActionResult reboot(RequestContext context, String instanceId, JsonNode entity) {
        if (entity == null || !entity.isObject() || !entity.has("type")) {
            log.warn("Missing argument 'type' for reboot");
            throw badRequest("Missing argument 'type' for reboot");
        }
        JsonNode typeNode = entity.get("type");
        RebootType type = typeNode.isTextual() ? RebootType.parse(typeNode.asText()).orElse(null) : null;
        if (type == null) {
            log.warn("Argument 'type' for reboot is not HARD or SOFT");
            throw badRequest("Argument 'type' for reboot is not HARD or SOFT");
        }
        InstanceRecord instance = serverService.findInstance(context, instanceId);
        try {
            computeClient.reboot(context, instance, type);
        } catch (ComputeException ex) {
            throw errorClassifier.classify(ComputeOperation.REBOOT, ex, instanceId);
        }
        return ActionResult.accepted();
    }

    private ActionResult resize(RequestContext context, String instanceId, JsonNode entity) {
        if (entity == null || !entity.isObject() || !entity.has("flavorRef")) {
            throw badRequest("Resize requests require 'flavorRef' attribute.");
        }
        String flavorRef = ServerRequestValidator.scalarText(entity.get("flavorRef"));
        String flavorId = StringUtils.hasText(flavorRef) ? validator.flavorIdFromHref(flavorRef) : null;
        if (flavorId == null) {
            throw badRequest("Resize request has invalid 'flavorRef' attribute.");
        }
        InstanceRecord instance = serverService.findInstance(context, instanceId);
        try {
            computeClient.resize(context, instance, flavorId);
        } catch (ComputeException ex) {
            throw errorClassifier.classify(ComputeOperation.RESIZE, ex, instanceId);
        }
        return ActionResult.accepted();
    }

    private ActionResult confirmResize(RequestContext context, String instanceId, JsonNode entity) {
        InstanceRecord instance = serverService.findInstance(context, instanceId);
        try {
            computeClient.confirmResize(context, instance);
        } catch (ComputeException ex) {
            throw errorClassifier.classify(ComputeOperation.CONFIRM_RESIZE, ex, instanceId);
        }
        return ActionResult.noContent();
    }

    private ActionResult revertResize(RequestContext context, String instanceId, JsonNode entity) {
        InstanceRecord instance = serverService.findInstance(context, instanceId);
        try {
            computeClient.revertResize(context, instance);
        } catch (ComputeException ex) {
            throw errorClassifier.classify(ComputeOperation.REVERT_RESIZE, ex, instanceId);
        }
        return ActionResult.accepted();
    }

    private ActionResult rebuild(RequestContext context, String instanceId, JsonNode entity) {
        InstanceRecord instance = serverService.findInstance(context, instanceId);

        String imageRef = entity != null && entity.isObject()
                ? ServerRequestValidator.scalarText(entity.get("imageRef"))
                : null;
        if (imageRef == null) {
            log.debug("Could not parse imageRef from request.");
            throw badRequest("Could not parse imageRef from request.");
        }

        List<InjectedFile> injectedFiles = validator.injectedFiles(entity.get("personality"));
        Map<String, String> metadata = ServerRequestValidator.present(entity.get("metadata"))
                ? validator.metadata(entity.get("metadata"))
                : null;
        String name = ServerRequestValidator.present(entity.get("name"))
                ? validator.validateName(entity.get("name"))
                : null;

        String password;
        JsonNode adminPass = entity.get("adminPass");
        if (ServerRequestValidator.present(adminPass)) {
            if (!adminPass.isTextual() || adminPass.asText().isEmpty()) {
                throw badRequest("Invalid adminPass");
            }
            password = adminPass.asText();
        } else {
            password = passwordGenerator.generate();
        }

        try {
            computeClient.rebuild(context, instance,
                    new RebuildCommand(imageRef, password, name, metadata, injectedFiles));
        } catch (ComputeException ex) {
            throw errorClassifier.classify(ComputeOperation.REBUILD, ex, instanceId);
        }

        InstanceRecord rebuilt = serverService.findInstance(context, instanceId);
        return ActionResult.acceptedWith(new ServerResponse(viewBuilder.detail(rebuilt).withAdminPass(password)));
    }

    private ActionResult createImage(RequestContext context, String instanceId, JsonNode entity) {
        if (!computeProperties.isAllowInstanceSnapshots()) {
            throw badRequest("Instance snapshots are not supported at this time");
        }
        if (entity == null || !entity.isObject()) {
            throw badRequest("Malformed createImage entity");
        }
        String name = ServerRequestValidator.scalarText(entity.get("name"));
        if (name == null) {
            throw badRequest("createImage entity requires name attribute");
        }
        Map<String, String> properties = imageProperties(context, instanceId, entity.get("metadata"),
                ComputeOperation.CREATE_IMAGE);

        InstanceRecord instance = serverService.findInstance(context, instanceId);
        ImageRecord image;
        try {
            image = computeClient.snapshot(context, instance, name, properties);
        } catch (ComputeException ex) {
            throw errorClassifier.classify(ComputeOperation.CREATE_IMAGE, ex, instanceId);
        }
        UriComponentsBuilder location = UriComponentsBuilder.fromUriString(context.applicationUrl());
        if (StringUtils.hasText(context.projectId())) {
            location.pathSegment(context.projectId());
        }
        return ActionResult.acceptedAt(location.pathSegment("images", image.id()).build().toUri());
    }

    private ActionResult createBackup(RequestContext context, String instanceId, JsonNode entity) {
        if (entity == null || !entity.isObject()) {
            throw badRequest("Malformed createBackup entity");
        }
        String name = requiredBackupAttribute(entity, "name");
        String backupType = requiredBackupAttribute(entity, "backup_type");
        if (!ServerRequestValidator.present(entity.get("rotation"))) {
            throw badRequest("createBackup entity requires 'rotation' attribute");
        }
        int rotation = parseRotation(entity.get("rotation"));
        Map<String, String> properties = imageProperties(context, instanceId, entity.get("metadata"),
                ComputeOperation.CREATE_BACKUP);

        InstanceRecord instance = serverService.findInstance(context, instanceId);
        ImageRecord image;
        try {
            image = computeClient.backup(context, instance, name, backupType, rotation, properties);
        } catch (ComputeException ex) {
            throw errorClassifier.classify(ComputeOperation.CREATE_BACKUP, ex, instanceId);
        }
        URI location = UriComponentsBuilder.fromUriString(context.applicationUrl())
                .pathSegment("images", image.id())
                .build()
                .toUri();
        return ActionResult.acceptedAt(location);
    }

    private static String requiredBackupAttribute(JsonNode entity, String attribute) {
        String value = ServerRequestValidator.scalarText(entity.get(attribute));
        if (value == null) {
            throw badRequest("createBackup entity requires '" + attribute + "' attribute");
        }
        return value;
    }

    /**
     * Image properties: a back-reference to the server, overlaid with caller metadata once the
     * compute service has accepted its size.
     */
    private Map<String, String> imageProperties(RequestContext context,
                                                String instanceId,
                                                JsonNode metadataNode,
                                                ComputeOperation operation) {
        Map<String, String> metadata = validator.imageMetadata(metadataNode);
        try {
            computeClient.checkImageMetadataQuota(context, metadata);
        } catch (ComputeException ex) {
            throw errorClassifier.classify(operation, ex, instanceId);
        }
        Map<String, String> properties = new LinkedHashMap<>();
        properties.put("instance_ref", UriComponentsBuilder.fromUriString(context.applicationUrl())
                .pathSegment("servers", instanceId)
                .toUriString());
        properties.putAll(metadata);
        return properties;
    }

    private int parseRotation(JsonNode rotation) {
        if (rotation.isIntegralNumber() && rotation.canConvertToInt()) {
            return rotation.asInt();
        }
        if (rotation.isTextual()) {
            try {
                return Integer.parseInt(rotation.asText().trim());
            } catch (NumberFormatException ex) {
                throw badRequest("createBackup attribute 'rotation' must be an integer");
            }
        }
        throw badRequest("createBackup attribute 'rotation' must be an integer");
    }

    private static ResponseStatusException badRequest(String reason) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason);
    }
}
