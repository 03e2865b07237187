package com.driftmonitor.core;

import com.driftmonitor.model.Severity;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 0-100 health score for one model. Each finding subtracts its severity penalty, halved every
 * {@code halfLife} and dropped entirely once older than {@code window}.
 */
public class HealthScorer {

    public static final int MAX_SCORE = 100;

    private final Duration halfLife;
    private final Duration window;
    private final Deque<Penalty> penalties = new ArrayDeque<>();

    public HealthScorer(Duration halfLife, Duration window) {
        this.halfLife = halfLife;
        this.window = window;
    }

    /** Records one verdict; {@code severity} is null when the check found no drift. */
    public synchronized int record(Severity severity, Instant at) {
        if (severity != null) {
            penalties.addLast(new Penalty(at, severity.getHealthPenalty()));
        }
        return score(at);
    }

    public synchronized int score(Instant now) {
        prune(now);
        double halfLifeMillis = Math.max(1L, halfLife.toMillis());
        double total = 0.0;
        for (Penalty p : penalties) {
            long age = Math.max(0L, Duration.between(p.at(), now).toMillis());
            total += p.points() * Math.pow(0.5, age / halfLifeMillis);
        }
        double score = MAX_SCORE - total;
        return (int) Math.round(Math.max(0.0, Math.min(MAX_SCORE, score)));
    }

    public synchronized int activePenalties(Instant now) {
        prune(now);
        return penalties.size();
    }

    private void prune(Instant now) {
        Instant horizon = now.minus(window);
        penalties.removeIf(p -> !p.at().isAfter(horizon));
    }

    private record Penalty(Instant at, double points) {}
}
