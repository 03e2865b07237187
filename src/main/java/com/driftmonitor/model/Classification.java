package com.driftmonitor.model;

public record Classification(Severity severity, String message, Recommendation recommendation) {}
