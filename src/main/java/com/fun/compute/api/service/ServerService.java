package com.fun.compute.api.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fun.compute.api.config.ComputeProperties;
import com.fun.compute.api.exception.ComputeException;
import com.fun.compute.api.model.ComputeOperation;
import com.fun.compute.api.model.CreateCommand;
import com.fun.compute.api.model.CreateResult;
import com.fun.compute.api.model.InstanceActionRecord;
import com.fun.compute.api.model.InstanceActionsResponse;
import com.fun.compute.api.model.InstanceRecord;
import com.fun.compute.api.model.RequestContext;
import com.fun.compute.api.model.ReservationResponse;
import com.fun.compute.api.model.SearchOptions;
import com.fun.compute.api.model.ServerDto;
import com.fun.compute.api.model.ServerResponse;
import com.fun.compute.api.model.ServersResponse;
import com.fun.compute.api.model.UpdateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * Create, update, delete and query pipeline: normalize, validate, make exactly one state-changing
 * call to the compute service, classify its failure, assemble the response.
 */
@Service
public class ServerService {

    private static final Logger log = LoggerFactory.getLogger(ServerService.class);

    private final ComputeClient computeClient;
    private final ServerRequestNormalizer normalizer;
    private final ServerRequestValidator validator;
    private final ComputeErrorClassifier errorClassifier;
    private final ServerViewBuilder viewBuilder;
    private final ComputeProperties computeProperties;

    public ServerService(ComputeClient computeClient,
                         ServerRequestNormalizer normalizer,
                         ServerRequestValidator validator,
                         ComputeErrorClassifier errorClassifier,
                         ServerViewBuilder viewBuilder,
                         ComputeProperties computeProperties) {
        this.computeClient = computeClient;
        this.normalizer = normalizer;
        this.validator = validator;
        this.errorClassifier = errorClassifier;
        this.viewBuilder = viewBuilder;
        this.computeProperties = computeProperties;
    }

    public ServersResponse listServers(RequestContext context, Map<String, String> query, boolean detail) {
        SearchOptions searchOptions = validator.validateSearchOptions(context, query);
        List<InstanceRecord> instances;
        try {
            instances = computeClient.getAll(context, searchOptions);
        } catch (ComputeException ex) {
            throw errorClassifier.classify(ComputeOperation.LIST, ex);
        }
        return new ServersResponse(instances.stream()
                .map(instance -> detail ? viewBuilder.detail(instance) : viewBuilder.minimal(instance))
                .toList());
    }

    public ServerResponse showServer(RequestContext context, String instanceId) {
        try {
            return new ServerResponse(viewBuilder.detail(computeClient.routingGet(context, instanceId)));
        } catch (ComputeException ex) {
            throw errorClassifier.classify(ComputeOperation.SHOW, ex, instanceId);
        }
    }

    /**
     * @return a {@link ReservationResponse} when the caller asked for the reservation id,
     * otherwise the first created server with its admin password
     */
    public Object createServer(RequestContext context, String body, MediaType contentType) {
        ObjectNode normalized = normalizer.normalizeCreate(body, contentType);
        CreateCommand command = validator.validateCreate(context, normalized);

        CreateResult result;
        try {
            result = computeClient.create(context, command);
        } catch (ComputeException ex) {
            throw errorClassifier.classify(ComputeOperation.CREATE, ex);
        }
        log.info("Create accepted for project {}: {} to {} instance(s), reservation {}",
                context.projectId(), command.minCount(), command.maxCount(), result.reservationId());

        if (command.returnReservationId()) {
            return new ReservationResponse(result.reservationId());
        }
        if (result.instances() == null || result.instances().isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, "compute service returned no instances");
        }
        ServerDto server = viewBuilder.detail(result.instances().get(0));
        return new ServerResponse(server.withAdminPass(command.adminPassword()));
    }

    public ServerResponse updateServer(RequestContext context, String instanceId, String body, MediaType contentType) {
        ObjectNode normalized = normalizer.normalizeUpdate(body, contentType);
        UpdateCommand command = validator.validateUpdate(normalized);
        try {
            computeClient.update(context, instanceId, command);
        } catch (ComputeException ex) {
            throw errorClassifier.classify(ComputeOperation.UPDATE, ex, instanceId);
        }
        return new ServerResponse(viewBuilder.detail(findInstance(context, instanceId)));
    }

    public void deleteServer(RequestContext context, String instanceId) {
        InstanceRecord instance = findInstance(context, instanceId);
        try {
            if (computeProperties.getReclaimInstanceInterval() > 0) {
                computeClient.softDelete(context, instance);
            } else {
                computeClient.delete(context, instance);
            }
        } catch (ComputeException ex) {
            throw errorClassifier.classify(ComputeOperation.DELETE, ex, instanceId);
        }
    }

    public Map<String, Object> getDiagnostics(RequestContext context, String instanceId) {
        InstanceRecord instance = findInstance(context, instanceId);
        try {
            return computeClient.getDiagnostics(context, instance);
        } catch (ComputeException ex) {
            throw errorClassifier.classify(ComputeOperation.DIAGNOSTICS, ex, instanceId);
        }
    }

    public InstanceActionsResponse getActions(RequestContext context, String instanceId) {
        InstanceRecord instance = findInstance(context, instanceId);
        List<InstanceActionRecord> actions;
        try {
            actions = computeClient.getActions(context, instance);
        } catch (ComputeException ex) {
            throw errorClassifier.classify(ComputeOperation.ACTIONS, ex, instanceId);
        }
        return new InstanceActionsResponse(actions.stream()
                .map(action -> new InstanceActionsResponse.Entry(
                        String.valueOf(action.createdAt()),
                        action.action(),
                        action.error()))
                .toList());
    }

    public InstanceRecord findInstance(RequestContext context, String instanceId) {
        try {
            return computeClient.routingGet(context, instanceId);
        } catch (ComputeException ex) {
            throw errorClassifier.classify(ComputeOperation.LOOKUP, ex, instanceId);
        }
    }
}
