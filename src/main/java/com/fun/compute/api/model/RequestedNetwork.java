package com.fun.compute.api.model;

public record RequestedNetwork(
        String networkId,
        String fixedIp
) {
}
