package com.driftmonitor.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class Baseline {
    String modelId;
    String metricName;
    List<Double> samples;
    double mean;
    double stdDev;
    double min;
    double max;
    Instant establishedAt;

    public int size() {
        return samples.size();
    }

    public boolean isDegenerate() {
        return stdDev == 0.0 || min == max;
    }

    public double[] sampleArray() {
        return samples.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
