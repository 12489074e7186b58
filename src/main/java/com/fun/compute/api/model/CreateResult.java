package com.fun.compute.api.model;

import java.util.List;

public record CreateResult(
        List<InstanceRecord> instances,
        String reservationId
) {
}
