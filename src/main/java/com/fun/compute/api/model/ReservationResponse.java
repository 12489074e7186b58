package com.fun.compute.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ReservationResponse(
        @JsonProperty("reservation_id") String reservationId
) {
}
