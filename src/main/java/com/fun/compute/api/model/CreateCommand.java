package com.fun.compute.api.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Create request handed to the compute service, the same for JSON and XML bodies.
 */
public record CreateCommand(
        String name,
        String imageRef,
        String flavorId,
        String adminPassword,
        String keyName,
        Map<String, String> metadata,
        String accessIpV4,
        String accessIpV6,
        List<InjectedFile> injectedFiles,
        Set<String> securityGroupNames,
        List<RequestedNetwork> requestedNetworks,
        String userData,
        String availabilityZone,
        JsonNode configDrive,
        JsonNode blockDeviceMapping,
        String zoneBlob,
        String reservationId,
        boolean returnReservationId,
        int minCount,
        int maxCount,
        Boolean autoDiskConfig
) {

    public CreateCommand {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        injectedFiles = List.copyOf(injectedFiles);
        securityGroupNames = Collections.unmodifiableSet(new LinkedHashSet<>(securityGroupNames));
        requestedNetworks = List.copyOf(requestedNetworks);
    }
}
