package com.fun.compute.api.controller;

import com.fun.compute.api.model.ActionResult;
import com.fun.compute.api.model.InstanceActionsResponse;
import com.fun.compute.api.model.RequestContext;
import com.fun.compute.api.model.ServerResponse;
import com.fun.compute.api.model.ServersResponse;
import com.fun.compute.api.service.ServerActionRouter;
import com.fun.compute.api.service.ServerService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping(path = "/v1/servers", produces = MediaType.APPLICATION_JSON_VALUE)
public class ServerController {

    private final ServerService serverService;
    private final ServerActionRouter actionRouter;

    public ServerController(ServerService serverService, ServerActionRouter actionRouter) {
        this.serverService = serverService;
        this.actionRouter = actionRouter;
    }

    @GetMapping
    public ServersResponse index(RequestContext context, @RequestParam Map<String, String> query) {
        return serverService.listServers(context, query, false);
    }

    @GetMapping("/detail")
    public ServersResponse detail(RequestContext context, @RequestParam Map<String, String> query) {
        return serverService.listServers(context, query, true);
    }

    @GetMapping("/{serverId}")
    public ServerResponse show(RequestContext context, @PathVariable String serverId) {
        return serverService.showServer(context, serverId);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Object create(RequestContext context,
                         @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false) String contentType,
                         @RequestBody(required = false) String body) {
        return serverService.createServer(context, body, mediaType(contentType));
    }

    @PutMapping("/{serverId}")
    public ServerResponse update(RequestContext context,
                                 @PathVariable String serverId,
                                 @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false) String contentType,
                                 @RequestBody(required = false) String body) {
        return serverService.updateServer(context, serverId, body, mediaType(contentType));
    }

    @DeleteMapping("/{serverId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(RequestContext context, @PathVariable String serverId) {
        serverService.deleteServer(context, serverId);
    }

    @PostMapping("/{serverId}/action")
    public ResponseEntity<Object> action(RequestContext context,
                                         @PathVariable String serverId,
                                         @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false) String contentType,
                                         @RequestBody(required = false) String body) {
        ActionResult result = actionRouter.route(context, serverId, body, mediaType(contentType));
        ResponseEntity.BodyBuilder response = ResponseEntity.status(result.status());
        if (result.location() != null) {
            response.location(result.location());
        }
        return result.body() == null ? response.build() : response.body(result.body());
    }

    @GetMapping("/{serverId}/diagnostics")
    public Map<String, Object> diagnostics(RequestContext context, @PathVariable String serverId) {
        return serverService.getDiagnostics(context, serverId);
    }

    @GetMapping("/{serverId}/actions")
    public InstanceActionsResponse actions(RequestContext context, @PathVariable String serverId) {
        return serverService.getActions(context, serverId);
    }

    // An unparsable Content-Type is decoded as JSON.
    private MediaType mediaType(String contentType) {
        if (!StringUtils.hasText(contentType)) {
            return null;
        }
        try {
            return MediaType.parseMediaType(contentType);
        } catch (InvalidMediaTypeException ex) {
            return null;
        }
    }
}
