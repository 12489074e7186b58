package com.fun.compute.api.model;

import java.util.List;

public record ServersResponse(List<ServerDto> servers) {
}
