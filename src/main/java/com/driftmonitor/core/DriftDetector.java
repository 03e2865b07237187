package com.driftmonitor.core;

import com.driftmonitor.model.Baseline;
import com.driftmonitor.model.DriftResult;
import com.driftmonitor.model.Measurement;

import java.util.List;

/**
 * Compares a current window against a frozen baseline. Implementations are total: thin or
 * degenerate data yields a flagged result, never an exception.
 */
public interface DriftDetector {

    String name();

    DriftResult detect(Baseline baseline, List<Measurement> current);
}
