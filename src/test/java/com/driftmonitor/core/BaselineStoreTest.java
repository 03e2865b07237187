package com.driftmonitor.core;

import com.driftmonitor.MutableClock;
import com.driftmonitor.exception.InsufficientDataException;
import com.driftmonitor.model.Baseline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.DoubleStream;

import static org.assertj.core.api.Assertions.*;

class BaselineStoreTest {

    private BaselineStore store;

    @BeforeEach
    void setUp() {
        store = new BaselineStore("model-a", 30, MutableClock.startingAt("2025-06-01T00:00:00Z"));
    }

    private static List<Double> samples(int n, double start, double step) {
        return DoubleStream.iterate(start, v -> v + step).limit(n).boxed().toList();
    }

    @Test
    void establish_computesSummaryStatistics() {
        Baseline baseline = store.establish("accuracy", samples(30, 1.0, 1.0));
        assertThat(baseline.size()).isEqualTo(30);
        assertThat(baseline.getMean()).isCloseTo(15.5, within(1e-9));
        assertThat(baseline.getMin()).isEqualTo(1.0);
        assertThat(baseline.getMax()).isEqualTo(30.0);
        assertThat(baseline.getStdDev()).isCloseTo(Math.sqrt((30.0 * 30.0 - 1.0) / 12.0), within(1e-9));
        assertThat(baseline.isDegenerate()).isFalse();
        assertThat(store.get("accuracy")).contains(baseline);
    }

    @Test
    void establish_tooFewSamples_throwsAndKeepsPriorBaseline() {
        Baseline prior = store.establish("accuracy", samples(30, 0.9, 0.001));
        assertThatThrownBy(() -> store.establish("accuracy", samples(15, 0.5, 0.001)))
            .isInstanceOf(InsufficientDataException.class)
            .hasMessageContaining("15")
            .hasMessageContaining("30");
        assertThat(store.get("accuracy")).contains(prior);
    }

    @Test
    void establish_nonFiniteSamplesDoNotCount() {
        List<Double> values = new ArrayList<>(samples(29, 0.9, 0.001));
        values.add(Double.NaN);
        values.add(null);
        assertThatThrownBy(() -> store.establish("accuracy", values))
            .isInstanceOf(InsufficientDataException.class);
        assertThat(store.get("accuracy")).isEmpty();
    }

    @Test
    void establish_replacesPriorBaselineWholesale() {
        store.establish("accuracy", samples(30, 0.9, 0.001));
        Baseline replacement = store.establish("accuracy", samples(40, 0.5, 0.001));
        assertThat(store.get("accuracy")).contains(replacement);
        assertThat(replacement.size()).isEqualTo(40);
    }

    @Test
    void establish_constantSamples_isDegenerate() {
        Baseline baseline = store.establish("accuracy", samples(30, 0.5, 0.0));
        assertThat(baseline.isDegenerate()).isTrue();
        assertThat(baseline.getStdDev()).isZero();
    }

    @Test
    void establish_constantInexactValue_isDegenerateWithExactMean() {
        Baseline baseline = store.establish("accuracy", Collections.nCopies(30, 0.94));
        assertThat(baseline.isDegenerate()).isTrue();
        assertThat(baseline.getStdDev()).isZero();
        assertThat(baseline.getMean()).isEqualTo(0.94);
    }

    @Test
    void establish_copiesSamples() {
        List<Double> values = new ArrayList<>(samples(30, 1.0, 1.0));
        Baseline baseline = store.establish("accuracy", values);
        values.clear();
        assertThat(baseline.size()).isEqualTo(30);
    }

    @Test
    void reset_removesBaseline() {
        store.establish("accuracy", samples(30, 1.0, 1.0));
        assertThat(store.reset("accuracy")).isTrue();
        assertThat(store.reset("accuracy")).isFalse();
        assertThat(store.get("accuracy")).isEmpty();
        assertThat(store.metricNames()).isEmpty();
    }
}
