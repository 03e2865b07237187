package com.driftmonitor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CheckOutcome {
    DriftResult result;
    Severity severity;
    Recommendation recommendation;
    Alert newAlert;

    public boolean hasNewAlert() {
        return newAlert != null;
    }
}
