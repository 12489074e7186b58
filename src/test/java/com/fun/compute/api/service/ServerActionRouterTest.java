package com.fun.compute.api.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fun.compute.api.config.ComputeProperties;
import com.fun.compute.api.exception.ComputeErrorKind;
import com.fun.compute.api.exception.ComputeException;
import com.fun.compute.api.exception.OverLimitException;
import com.fun.compute.api.model.ActionResult;
import com.fun.compute.api.model.ImageRecord;
import com.fun.compute.api.model.InstanceRecord;
import com.fun.compute.api.model.RebootType;
import com.fun.compute.api.model.RebuildCommand;
import com.fun.compute.api.model.RequestContext;
import com.fun.compute.api.model.ServerResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.server.ResponseStatusException;

import java.net.URI;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ServerActionRouterTest {

    private static final String SERVER_ID = "0e1f2a3b-0000-4000-8000-000000000001";

    private final RequestContext context = new RequestContext("p1", "u1", false, "http://localhost/v1");
    private final InstanceRecord instance = new InstanceRecord(SERVER_ID, "web-1", "p1", "u1", "active", null,
            "1", "img-1", "host-a", null, null, 0, Map.of(), List.of("default"), null, null);

    private ComputeClient computeClient;
    private ComputeProperties properties;
    private PasswordGenerator passwordGenerator;
    private ServerActionRouter router;

    @BeforeEach
    void setUp() {
        computeClient = mock(ComputeClient.class);
        properties = new ComputeProperties();
        passwordGenerator = mock(PasswordGenerator.class);
        when(passwordGenerator.generate()).thenReturn("generated123");
        when(computeClient.routingGet(context, SERVER_ID)).thenReturn(instance);

        ServerRequestNormalizer normalizer = new ServerRequestNormalizer(new ObjectMapper());
        ServerRequestValidator validator = new ServerRequestValidator(properties, passwordGenerator);
        ComputeErrorClassifier classifier = new ComputeErrorClassifier();
        ServerViewBuilder viewBuilder = new ServerViewBuilder();
        ServerService serverService = new ServerService(computeClient, normalizer, validator, classifier,
                viewBuilder, properties);
        router = new ServerActionRouter(computeClient, serverService, normalizer, validator, classifier,
                viewBuilder, passwordGenerator, properties);
    }

    @Test
    void emptyBodyIsRejected() {
        assertBadRequest(() -> route("{}"), "Invalid request body");
        assertBadRequest(() -> route(""), "Invalid request body");
    }

    @Test
    void unknownActionIsRejectedByName() {
        assertBadRequest(() -> route("{\"migrate\": {}}"), "There is no such server action: migrate");
        verifyNoInteractions(computeClient);
    }

    @Test
    void firstActionInDocumentOrderWins() {
        ActionResult result = route("{\"reboot\": {\"type\": \"SOFT\"}, \"confirmResize\": null}");

        assertThat(result.status()).isEqualTo(HttpStatus.ACCEPTED);
        verify(computeClient).reboot(context, instance, RebootType.SOFT);
        verify(computeClient, never()).confirmResize(any(), any());
    }

    @Test
    void rebootTypeIsCaseInsensitive() {
        ActionResult result = route("{\"reboot\": {\"type\": \"hard\"}}");

        assertThat(result.status()).isEqualTo(HttpStatus.ACCEPTED);
        verify(computeClient).reboot(context, instance, RebootType.HARD);
    }

    @Test
    void rebootTypeIsRequiredAndRestricted() {
        assertBadRequest(() -> route("{\"reboot\": {}}"), "Missing argument 'type' for reboot");
        assertBadRequest(() -> route("{\"reboot\": {\"type\": \"loud\"}}"),
                "Argument 'type' for reboot is not HARD or SOFT");
        verify(computeClient, never()).reboot(any(), any(), any());
    }

    @Test
    void rebootFailureIsUnprocessable() {
        doThrow(ComputeException.remote("InstanceInvalidState", "busy"))
                .when(computeClient).reboot(context, instance, RebootType.SOFT);

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> route("{\"reboot\": {\"type\": \"SOFT\"}}"));

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @Test
    void changePasswordRequiresPassword() {
        assertBadRequest(() -> route("{\"changePassword\": {}}"), "No adminPass was specified");
        assertBadRequest(() -> route("{\"changePassword\": {\"adminPass\": 5}}"), "Invalid adminPass");

        route("{\"changePassword\": {\"adminPass\": \"n3w\"}}");
        verify(computeClient).setAdminPassword(context, instance, "n3w");
    }

    @Test
    void resizeUsesFlavorIdFromHref() {
        route("{\"resize\": {\"flavorRef\": \"http://localhost/v1/flavors/7\"}}");

        verify(computeClient).resize(context, instance, "7");
        assertBadRequest(() -> route("{\"resize\": {}}"), "Resize requests require 'flavorRef' attribute.");
        assertBadRequest(() -> route("{\"resize\": {\"flavorRef\": \"\"}}"),
                "Resize request has invalid 'flavorRef' attribute.");
    }

    @Test
    void resizeToSameFlavorIsBadRequest() {
        doThrow(new ComputeException(ComputeErrorKind.CANNOT_RESIZE_TO_SAME_SIZE, "same"))
                .when(computeClient).resize(context, instance, "1");

        assertBadRequest(() -> route("{\"resize\": {\"flavorRef\": \"1\"}}"), "Resize requires a change in size.");
    }

    @Test
    void confirmResizeIsNoContentAndRevertIsAccepted() {
        assertThat(route("{\"confirmResize\": null}").status()).isEqualTo(HttpStatus.NO_CONTENT);
        assertThat(route("{\"revertResize\": null}").status()).isEqualTo(HttpStatus.ACCEPTED);
    }

    @Test
    void confirmResizeWithoutMigrationIsBadRequest() {
        doThrow(new ComputeException(ComputeErrorKind.MIGRATION_NOT_FOUND, "none"))
                .when(computeClient).confirmResize(context, instance);

        assertBadRequest(() -> route("{\"confirmResize\": null}"), "Instance has not been resized.");
    }

    @Test
    void rebuildReturnsRefreshedViewWithPassword() {
        ActionResult result = route("""
                {"rebuild": {"imageRef": "img-2", "name": " renamed ", "metadata": {"a": "b"}}}
                """);

        ArgumentCaptor<RebuildCommand> command = ArgumentCaptor.forClass(RebuildCommand.class);
        verify(computeClient).rebuild(eq(context), eq(instance), command.capture());
        assertThat(command.getValue().imageRef()).isEqualTo("img-2");
        assertThat(command.getValue().name()).isEqualTo("renamed");
        assertThat(command.getValue().metadata()).containsEntry("a", "b");
        assertThat(command.getValue().adminPassword()).isEqualTo("generated123");

        assertThat(result.status()).isEqualTo(HttpStatus.ACCEPTED);
        ServerResponse body = (ServerResponse) result.body();
        assertThat(body.server().id()).isEqualTo(SERVER_ID);
        assertThat(body.server().adminPass()).isEqualTo("generated123");
    }

    @Test
    void rebuildRequiresImageRef() {
        assertBadRequest(() -> route("{\"rebuild\": {\"name\": \"x\"}}"), "Could not parse imageRef from request.");
        verify(computeClient, never()).rebuild(any(), any(), any());
    }

    @Test
    void rebuildOfInactiveInstanceConflicts() {
        doThrow(new ComputeException(ComputeErrorKind.REBUILD_REQUIRES_ACTIVE_INSTANCE, "not active"))
                .when(computeClient).rebuild(eq(context), eq(instance), any());

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> route("{\"rebuild\": {\"imageRef\": \"img-2\"}}"));

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(ex.getReason()).isEqualTo("Instance " + SERVER_ID + " must be active to rebuild.");
    }

    @Test
    void createImageReturnsProjectScopedLocation() {
        when(computeClient.snapshot(eq(context), eq(instance), eq("snap"), anyMap()))
                .thenReturn(new ImageRecord("img-9", "snap"));

        ActionResult result = route("{\"createImage\": {\"name\": \"snap\", \"metadata\": {\"k\": \"v\"}}}");

        assertThat(result.status()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(result.location()).isEqualTo(URI.create("http://localhost/v1/p1/images/img-9"));
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> properties = ArgumentCaptor.forClass(Map.class);
        verify(computeClient).snapshot(eq(context), eq(instance), eq("snap"), properties.capture());
        assertThat(properties.getValue())
                .containsEntry("instance_ref", "http://localhost/v1/servers/" + SERVER_ID)
                .containsEntry("k", "v");
        verify(computeClient).checkImageMetadataQuota(context, Map.of("k", "v"));
    }

    @Test
    void createImageMetadataOverQuotaIsOverLimit() {
        doThrow(new ComputeException(ComputeErrorKind.METADATA_LIMIT_EXCEEDED, "too many"))
                .when(computeClient).checkImageMetadataQuota(eq(context), anyMap());

        OverLimitException ex = assertThrows(OverLimitException.class,
                () -> route("{\"createImage\": {\"name\": \"snap\"}}"));

        assertThat(ex.getHeaders().getFirst("Retry-After")).isEqualTo("0");
        verify(computeClient, never()).snapshot(any(), any(), anyString(), anyMap());
    }

    @Test
    void createImageIsDisabledWithoutSnapshots() {
        properties.setAllowInstanceSnapshots(false);

        assertBadRequest(() -> route("{\"createImage\": {\"name\": \"snap\"}}"),
                "Instance snapshots are not supported at this time");
    }

    @Test
    void createImageValidatesEntity() {
        assertBadRequest(() -> route("{\"createImage\": \"snap\"}"), "Malformed createImage entity");
        assertBadRequest(() -> route("{\"createImage\": {}}"), "createImage entity requires name attribute");
        assertBadRequest(() -> route("{\"createImage\": {\"name\": \"s\", \"metadata\": [1]}}"), "Invalid metadata");
    }

    @Test
    void createBackupIsUnknownUnlessAdminApiIsEnabled() {
        String body = "{\"createBackup\": {\"name\": \"b\", \"backup_type\": \"daily\", \"rotation\": 3}}";

        assertBadRequest(() -> route(body), "There is no such server action: createBackup");

        properties.setAllowAdminApi(true);
        when(computeClient.backup(eq(context), eq(instance), eq("b"), eq("daily"), eq(3), anyMap()))
                .thenReturn(new ImageRecord("img-7", "b"));

        ActionResult result = route(body);
        assertThat(result.location()).isEqualTo(URI.create("http://localhost/v1/images/img-7"));
    }

    @Test
    void createBackupRotationMustBeInteger() {
        properties.setAllowAdminApi(true);

        assertBadRequest(() -> route("{\"createBackup\": {\"name\": \"b\", \"backup_type\": \"daily\", \"rotation\": \"abc\"}}"),
                "createBackup attribute 'rotation' must be an integer");
        assertBadRequest(() -> route("{\"createBackup\": {\"name\": \"b\", \"rotation\": 1}}"),
                "createBackup entity requires 'backup_type' attribute");
        verify(computeClient, never()).backup(any(), any(), anyString(), anyString(), anyInt(), anyMap());
    }

    @Test
    void createBackupRejectsNonScalarNameAndType() {
        properties.setAllowAdminApi(true);

        assertBadRequest(() -> route("{\"createBackup\": {\"name\": {}, \"backup_type\": \"daily\", \"rotation\": 1}}"),
                "createBackup entity requires 'name' attribute");
        assertBadRequest(() -> route("{\"createBackup\": {\"name\": \"b\", \"backup_type\": [], \"rotation\": 1}}"),
                "createBackup entity requires 'backup_type' attribute");
        verify(computeClient, never()).backup(any(), any(), anyString(), anyString(), anyInt(), anyMap());
    }

    @Test
    void createBackupAcceptsRotationAsString() {
        properties.setAllowAdminApi(true);
        when(computeClient.backup(eq(context), eq(instance), eq("b"), eq("daily"), eq(3), anyMap()))
                .thenReturn(new ImageRecord("img-7", "b"));

        route("{\"createBackup\": {\"name\": \"b\", \"backup_type\": \"daily\", \"rotation\": \"3\"}}");

        verify(computeClient).backup(eq(context), eq(instance), eq("b"), eq("daily"), eq(3), anyMap());
    }

    @Test
    void xmlActionsRouteLikeJson() {
        ActionResult result = router.route(context, SERVER_ID, "<reboot type=\"soft\"/>", MediaType.APPLICATION_XML);

        assertThat(result.status()).isEqualTo(HttpStatus.ACCEPTED);
        verify(computeClient).reboot(context, instance, RebootType.SOFT);
    }

    @Test
    void missingInstanceIsNotFound() {
        when(computeClient.routingGet(context, "missing"))
                .thenThrow(new ComputeException(ComputeErrorKind.INSTANCE_NOT_FOUND, "gone"));

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> router.dispatch(context, "missing", json("{\"confirmResize\": null}")));

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    private ActionResult route(String body) {
        return router.route(context, SERVER_ID, body, MediaType.APPLICATION_JSON);
    }

    private ObjectNode json(String body) {
        try {
            return (ObjectNode) new ObjectMapper().readTree(body);
        } catch (Exception ex) {
            throw new IllegalStateException(ex);
        }
    }

    private void assertBadRequest(org.junit.jupiter.api.function.Executable call, String reason) {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class, call);
        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(ex.getReason()).isEqualTo(reason);
    }
}
