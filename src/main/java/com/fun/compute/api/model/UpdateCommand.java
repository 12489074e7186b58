package com.fun.compute.api.model;

// A null component leaves the field unchanged.
public record UpdateCommand(
        String displayName,
        String accessIpV4,
        String accessIpV6,
        Boolean autoDiskConfig
) {

    public boolean isEmpty() {
        return displayName == null && accessIpV4 == null && accessIpV6 == null && autoDiskConfig == null;
    }
}
