package com.fun.compute.api.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fun.compute.api.config.ComputeProperties;
import com.fun.compute.api.exception.ComputeErrorKind;
import com.fun.compute.api.exception.ComputeException;
import com.fun.compute.api.model.ImageRecord;
import com.fun.compute.api.model.InstanceRecord;
import com.fun.compute.api.model.RebootType;
import com.fun.compute.api.model.RequestContext;
import com.fun.compute.api.model.SearchOptions;
import com.fun.compute.api.model.VmState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestComputeClientTest {

    private static final String BASE_URL = "http://compute.test/internal/v1";
    private static final String SERVER_ID = "0e1f2a3b-0000-4000-8000-000000000001";

    private final RequestContext context = new RequestContext("p1", "u1", true, "http://localhost/v1");
    private final InstanceRecord instance = new InstanceRecord(SERVER_ID, "web-1", "p1", "u1", "active", null,
            "1", "img-1", "host-a", null, null, 0, Map.of(), List.of(), null, null);

    private MockRestServiceServer server;
    private RestComputeClient client;

    @BeforeEach
    void setUp() {
        ComputeProperties properties = new ComputeProperties();
        properties.setBaseUrl(BASE_URL);
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new RestComputeClient(builder, properties, new ObjectMapper());
    }

    @Test
    void routingGetSendsIdentityHeaders() {
        server.expect(requestTo(BASE_URL + "/instances/" + SERVER_ID))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("X-Project-Id", "p1"))
                .andExpect(header("X-User-Id", "u1"))
                .andExpect(header("X-Is-Admin", "true"))
                .andExpect(header("X-Requested-By", "fun-compute-api"))
                .andRespond(withSuccess("""
                        {"uuid": "%s", "displayName": "web-1", "vmState": "active", "flavorId": "1"}
                        """.formatted(SERVER_ID), MediaType.APPLICATION_JSON));

        InstanceRecord record = client.routingGet(context, SERVER_ID);

        assertThat(record.uuid()).isEqualTo(SERVER_ID);
        assertThat(record.vmState()).isEqualTo("active");
        server.verify();
    }

    @Test
    void rebootIsSubmittedAsAction() {
        server.expect(requestTo(BASE_URL + "/instances/" + SERVER_ID + "/actions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.action").value("reboot"))
                .andExpect(jsonPath("$.instanceId").value(SERVER_ID))
                .andExpect(jsonPath("$.payload.type").value("HARD"))
                .andRespond(withStatus(HttpStatus.ACCEPTED));

        client.reboot(context, instance, RebootType.HARD);

        server.verify();
    }

    @Test
    void snapshotReturnsImage() {
        server.expect(requestTo(BASE_URL + "/instances/" + SERVER_ID + "/actions"))
                .andExpect(jsonPath("$.action").value("snapshot"))
                .andExpect(jsonPath("$.payload.name").value("snap"))
                .andExpect(jsonPath("$.payload.extraProperties.k").value("v"))
                .andRespond(withSuccess("{\"id\": \"img-9\", \"name\": \"snap\"}", MediaType.APPLICATION_JSON));

        ImageRecord image = client.snapshot(context, instance, "snap", Map.of("k", "v"));

        assertThat(image.id()).isEqualTo("img-9");
    }

    @Test
    void softDeleteUsesQueryFlag() {
        server.expect(requestTo(BASE_URL + "/instances/" + SERVER_ID + "?soft=true"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withStatus(HttpStatus.NO_CONTENT));

        client.softDelete(context, instance);

        server.verify();
    }

    @Test
    void searchOptionsBecomeQueryParameters() {
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("vm_state", VmState.ACTIVE);
        filters.put("deleted", false);
        server.expect(requestTo(BASE_URL + "/instances?vm_state=active&deleted=false"))
                .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        assertThat(client.getAll(context, new SearchOptions(filters))).isEmpty();
    }

    @Test
    void errorBodyKindIsTranslated() {
        server.expect(requestTo(BASE_URL + "/instances/" + SERVER_ID))
                .andRespond(withStatus(HttpStatus.NOT_FOUND)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"kind\": \"instance_not_found\", \"message\": \"no such instance\"}"));

        ComputeException ex = assertThrows(ComputeException.class, () -> client.routingGet(context, SERVER_ID));

        assertThat(ex.getKind()).isEqualTo(ComputeErrorKind.INSTANCE_NOT_FOUND);
        assertThat(ex.getMessage()).isEqualTo("no such instance");
    }

    @Test
    void errorBodyWithOnlyTypeIsRemote() {
        server.expect(requestTo(BASE_URL + "/quotas/image-metadata/check"))
                .andExpect(jsonPath("$.metadata.k").value("v"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"type\": \"InvalidInput\", \"message\": \"bad zone\"}"));

        ComputeException ex = assertThrows(ComputeException.class,
                () -> client.checkImageMetadataQuota(context, Map.of("k", "v")));

        assertThat(ex.getKind()).isEqualTo(ComputeErrorKind.REMOTE_ERROR);
        assertThat(ex.getRemoteType()).isEqualTo("InvalidInput");
    }

    @Test
    void plainErrorKeepsUpstreamStatus() {
        server.expect(requestTo(BASE_URL + "/instances/" + SERVER_ID))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE).body("maintenance"));

        ComputeException ex = assertThrows(ComputeException.class, () -> client.routingGet(context, SERVER_ID));

        assertThat(ex.getKind()).isEqualTo(ComputeErrorKind.UPSTREAM_STATUS);
        assertThat(ex.getUpstreamStatus()).isEqualTo(503);
        assertThat(ex.getMessage()).isEqualTo("maintenance");
    }

    @Test
    void emptyInstanceResponseIsBadGateway() {
        server.expect(requestTo(BASE_URL + "/instances/" + SERVER_ID))
                .andRespond(withSuccess());

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> client.routingGet(context, SERVER_ID));

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
    }
}
