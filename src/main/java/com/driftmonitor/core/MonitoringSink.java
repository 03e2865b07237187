package com.driftmonitor.core;

import com.driftmonitor.model.Alert;
import com.driftmonitor.model.DriftResult;

/**
 * Write-only hand-off for results the engine produces. The engine never reads back from it.
 */
public interface MonitoringSink {

    MonitoringSink NOOP = new MonitoringSink() {
        @Override
        public void onDriftResult(DriftResult result) {
        }

        @Override
        public void onAlert(Alert alert) {
        }
    };

    void onDriftResult(DriftResult result);

    void onAlert(Alert alert);
}
