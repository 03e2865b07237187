package com.driftmonitor.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class BaselineRequest {
    @NotEmpty(message = "samples are required")
    List<@NotNull Double> samples;
}
