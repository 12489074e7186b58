package com.fun.compute.api.model;

public record ServerResponse(ServerDto server) {
}
