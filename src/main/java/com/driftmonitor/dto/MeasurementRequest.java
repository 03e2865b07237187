package com.driftmonitor.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class MeasurementRequest {

    @NotBlank(message = "metricName is required")
    @Size(max = 128, message = "metricName must be at most 128 characters")
    String metricName;

    @NotNull(message = "value is required")
    Double value;

    Instant timestamp;
}
