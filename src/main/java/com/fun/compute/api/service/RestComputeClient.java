package com.fun.compute.api.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fun.compute.api.config.ComputeProperties;
import com.fun.compute.api.exception.ComputeErrorKind;
import com.fun.compute.api.exception.ComputeException;
import com.fun.compute.api.model.CreateCommand;
import com.fun.compute.api.model.CreateResult;
import com.fun.compute.api.model.ImageRecord;
import com.fun.compute.api.model.InstanceActionRecord;
import com.fun.compute.api.model.InstanceRecord;
import com.fun.compute.api.model.RebootType;
import com.fun.compute.api.model.RebuildCommand;
import com.fun.compute.api.model.RequestContext;
import com.fun.compute.api.model.SearchOptions;
import com.fun.compute.api.model.UpdateCommand;
import com.fun.compute.api.model.VmState;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.server.ResponseStatusException;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * {@link ComputeClient} over the compute service's internal HTTP API.
 * <p>
 * Error bodies of the form {@code {"kind": ..., "type": ..., "message": ...}} become
 * {@link ComputeException}s of that kind; a body with only a remote {@code type} is a remote error,
 * and anything else keeps just its HTTP status.
 */
@Component
public class RestComputeClient implements ComputeClient {

    private static final ParameterizedTypeReference<List<InstanceRecord>> INSTANCE_LIST =
            new ParameterizedTypeReference<>() {
            };
    private static final ParameterizedTypeReference<List<InstanceActionRecord>> ACTION_LIST =
            new ParameterizedTypeReference<>() {
            };
    private static final ParameterizedTypeReference<Map<String, Object>> DIAGNOSTICS =
            new ParameterizedTypeReference<>() {
            };

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String requestedBy;

    public RestComputeClient(RestClient.Builder restClientBuilder,
                             ComputeProperties computeProperties,
                             ObjectMapper objectMapper) {
        this.restClient = restClientBuilder.baseUrl(computeProperties.getBaseUrl()).build();
        this.objectMapper = objectMapper;
        this.requestedBy = computeProperties.getRequestedBy();
    }

    @Override
    public CreateResult create(RequestContext context, CreateCommand command) {
        return required(call(() -> restClient.post()
                .uri("/instances")
                .headers(identity(context))
                .body(command)
                .retrieve()
                .body(CreateResult.class)));
    }

    @Override
    public void update(RequestContext context, String instanceId, UpdateCommand command) {
        Map<String, Object> patch = new HashMap<>();
        if (command.displayName() != null) {
            patch.put("displayName", command.displayName());
        }
        if (command.accessIpV4() != null) {
            patch.put("accessIpV4", command.accessIpV4());
        }
        if (command.accessIpV6() != null) {
            patch.put("accessIpV6", command.accessIpV6());
        }
        if (command.autoDiskConfig() != null) {
            patch.put("autoDiskConfig", command.autoDiskConfig());
        }
        call(() -> restClient.patch()
                .uri("/instances/{id}", instanceId)
                .headers(identity(context))
                .body(patch)
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public void delete(RequestContext context, InstanceRecord instance) {
        call(() -> restClient.delete()
                .uri("/instances/{id}", instance.uuid())
                .headers(identity(context))
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public void softDelete(RequestContext context, InstanceRecord instance) {
        call(() -> restClient.delete()
                .uri("/instances/{id}?soft=true", instance.uuid())
                .headers(identity(context))
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public void reboot(RequestContext context, InstanceRecord instance, RebootType type) {
        submitAction(context, instance, "reboot", Map.of("type", type.name()));
    }

    @Override
    public void resize(RequestContext context, InstanceRecord instance, String flavorId) {
        submitAction(context, instance, "resize", Map.of("flavorId", flavorId));
    }

    @Override
    public void confirmResize(RequestContext context, InstanceRecord instance) {
        submitAction(context, instance, "confirmResize", Map.of());
    }

    @Override
    public void revertResize(RequestContext context, InstanceRecord instance) {
        submitAction(context, instance, "revertResize", Map.of());
    }

    @Override
    public void rebuild(RequestContext context, InstanceRecord instance, RebuildCommand command) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("imageRef", command.imageRef());
        payload.put("adminPassword", command.adminPassword());
        if (command.name() != null) {
            payload.put("name", command.name());
        }
        if (command.metadata() != null) {
            payload.put("metadata", command.metadata());
        }
        payload.put("injectedFiles", command.injectedFiles());
        submitAction(context, instance, "rebuild", payload);
    }

    @Override
    public ImageRecord snapshot(RequestContext context, InstanceRecord instance, String name,
                                Map<String, String> extraProperties) {
        return required(submitAction(context, instance, "snapshot", Map.of(
                "name", name,
                "extraProperties", extraProperties
        ), ImageRecord.class));
    }

    @Override
    public ImageRecord backup(RequestContext context, InstanceRecord instance, String name, String backupType,
                              int rotation, Map<String, String> extraProperties) {
        return required(submitAction(context, instance, "backup", Map.of(
                "name", name,
                "backupType", backupType,
                "rotation", rotation,
                "extraProperties", extraProperties
        ), ImageRecord.class));
    }

    @Override
    public void setAdminPassword(RequestContext context, InstanceRecord instance, String password) {
        submitAction(context, instance, "setAdminPassword", Map.of("password", password));
    }

    @Override
    public void checkImageMetadataQuota(RequestContext context, Map<String, String> metadata) {
        call(() -> restClient.post()
                .uri("/quotas/image-metadata/check")
                .headers(identity(context))
                .body(Map.of("metadata", metadata))
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public List<InstanceRecord> getAll(RequestContext context, SearchOptions searchOptions) {
        List<InstanceRecord> instances = call(() -> restClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path("/instances");
                    searchOptions.filters().forEach((name, value) -> uriBuilder.queryParam(name, queryValue(value)));
                    return uriBuilder.build();
                })
                .headers(identity(context))
                .retrieve()
                .body(INSTANCE_LIST));
        return instances == null ? List.of() : instances;
    }

    @Override
    public InstanceRecord routingGet(RequestContext context, String instanceId) {
        return required(call(() -> restClient.get()
                .uri("/instances/{id}", instanceId)
                .headers(identity(context))
                .retrieve()
                .body(InstanceRecord.class)));
    }

    @Override
    public Map<String, Object> getDiagnostics(RequestContext context, InstanceRecord instance) {
        Map<String, Object> diagnostics = call(() -> restClient.get()
                .uri("/instances/{id}/diagnostics", instance.uuid())
                .headers(identity(context))
                .retrieve()
                .body(DIAGNOSTICS));
        return diagnostics == null ? Map.of() : diagnostics;
    }

    @Override
    public List<InstanceActionRecord> getActions(RequestContext context, InstanceRecord instance) {
        List<InstanceActionRecord> actions = call(() -> restClient.get()
                .uri("/instances/{id}/actions", instance.uuid())
                .headers(identity(context))
                .retrieve()
                .body(ACTION_LIST));
        return actions == null ? List.of() : actions;
    }

    private void submitAction(RequestContext context, InstanceRecord instance, String action, Map<String, Object> payload) {
        submitAction(context, instance, action, payload, Void.class);
    }

    private <T> T submitAction(RequestContext context,
                               InstanceRecord instance,
                               String action,
                               Map<String, Object> payload,
                               Class<T> responseType) {
        ComputeActionRequest request = new ComputeActionRequest(
                UUID.randomUUID(),
                instance.uuid(),
                action,
                requestedBy,
                payload
        );
        return call(() -> restClient.post()
                .uri("/instances/{id}/actions", instance.uuid())
                .headers(identity(context))
                .body(request)
                .retrieve()
                .body(responseType));
    }

    private Consumer<HttpHeaders> identity(RequestContext context) {
        return headers -> {
            if (context.projectId() != null) {
                headers.set("X-Project-Id", context.projectId());
            }
            if (context.userId() != null) {
                headers.set("X-User-Id", context.userId());
            }
            headers.set("X-Is-Admin", String.valueOf(context.admin()));
            headers.set("X-Requested-By", requestedBy);
        };
    }

    private <T> T call(Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientResponseException ex) {
            throw translate(ex);
        } catch (ResourceAccessException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, "compute service unreachable", ex);
        }
    }

    private <T> T required(T body) {
        if (body == null) {
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, "compute service returned empty response");
        }
        return body;
    }

    ComputeException translate(RestClientResponseException ex) {
        String details = ex.getResponseBodyAsString();
        ComputeErrorBody error = parseErrorBody(details);
        if (error != null) {
            Optional<ComputeErrorKind> kind = Arrays.stream(ComputeErrorKind.values())
                    .filter(candidate -> candidate.name().equalsIgnoreCase(error.kind()))
                    .findFirst();
            if (kind.isPresent() && kind.get() != ComputeErrorKind.UPSTREAM_STATUS) {
                return new ComputeException(kind.get(), error.message(), error.type(), ex.getStatusCode().value(), ex);
            }
            if (StringUtils.hasText(error.type())) {
                return ComputeException.remote(error.type(), error.message());
            }
        }
        String message = error != null && StringUtils.hasText(error.message())
                ? error.message()
                : StringUtils.hasText(details) ? details : ex.getStatusText();
        return ComputeException.upstream(ex.getStatusCode().value(), message, ex);
    }

    private ComputeErrorBody parseErrorBody(String details) {
        if (!StringUtils.hasText(details)) {
            return null;
        }
        try {
            return objectMapper.readValue(details, ComputeErrorBody.class);
        } catch (JsonProcessingException ex) {
            return null;
        }
    }

    private Object queryValue(Object value) {
        if (value instanceof VmState state) {
            return state.value();
        }
        return String.valueOf(value);
    }

    public record ComputeActionRequest(
            UUID taskId,
            String instanceId,
            String action,
            String requestedBy,
            Map<String, Object> payload
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ComputeErrorBody(
            String kind,
            String type,
            String message
    ) {
    }
}
