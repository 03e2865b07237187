package com.driftmonitor.model;

/**
 * What an operator should do about a finding. Rendering to prose is left to the presentation layer.
 */
public record Recommendation(Action action, Urgency urgency, String metricName, double degradation) {

    public enum Action {
        CONTINUE_MONITORING,
        PLAN_RETRAINING,
        RETRAIN_WITH_OVERSIGHT,
        RETRAIN_WITH_SAFE_MODE_FALLBACK
    }

    public enum Urgency {
        ROUTINE,
        DAYS,
        HOURS,
        IMMEDIATE
    }
}
