package com.driftmonitor.service;

import com.driftmonitor.MutableClock;
import com.driftmonitor.config.MonitoringSettings;
import com.driftmonitor.core.DriftDetector;
import com.driftmonitor.core.KolmogorovSmirnovDetector;
import com.driftmonitor.core.MonitoringContext;
import com.driftmonitor.core.MonitoringSink;
import com.driftmonitor.core.SeverityClassifier;
import com.driftmonitor.core.ThresholdEvaluator;
import com.driftmonitor.exception.AlertNotFoundException;
import com.driftmonitor.exception.InsufficientDataException;
import com.driftmonitor.exception.UnknownModelException;
import com.driftmonitor.model.Alert;
import com.driftmonitor.model.AlertStatus;
import com.driftmonitor.model.Baseline;
import com.driftmonitor.model.CheckOutcome;
import com.driftmonitor.model.DriftResult;
import com.driftmonitor.model.Measurement;
import com.driftmonitor.model.Severity;
import com.driftmonitor.model.ThresholdBreach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MonitoringRegistryTest {

    @Mock MonitoringSink sink;

    private MutableClock clock;
    private MonitoringRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-06-01T00:00:00Z");
        MonitoringSettings settings = MonitoringSettings.defaults();
        registry = new MonitoringRegistry(settings, new KolmogorovSmirnovDetector(settings, clock),
                                          new SeverityClassifier(), sink, clock,
                                          new ThresholdEvaluator(settings.getThresholdWindow(), new SeverityClassifier(), clock));
    }

    private static List<Double> spread(int n, double mean, double halfWidth) {
        return IntStream.range(0, n)
            .mapToObj(i -> mean + halfWidth * (2.0 * i / (n - 1) - 1.0))
            .toList();
    }

    private void ingestAll(String modelId, String metric, List<Double> values) {
        for (double v : values) {
            clock.advance(Duration.ofSeconds(1));
            registry.ingest(modelId, metric, v, null);
        }
    }

    private void degradeAccuracy(String modelId) {
        registry.register(modelId);
        registry.establishBaseline(modelId, "accuracy", spread(30, 0.94, 0.035));
        ingestAll(modelId, "accuracy", spread(20, 0.758, 0.02));
    }

    @Test
    void register_isIdempotent() {
        MonitoringContext first = registry.register("model-a", Duration.ofMinutes(5));
        MonitoringContext second = registry.register("model-a", Duration.ofMinutes(30));

        assertThat(second).isSameAs(first);
        assertThat(second.getCheckInterval()).isEqualTo(Duration.ofMinutes(5));
        assertThat(registry.modelIds()).containsExactly("model-a");
    }

    @Test
    void register_withoutInterval_usesDefault() {
        assertThat(registry.register("model-a").getCheckInterval()).isEqualTo(Duration.ofMinutes(15));
    }

    @Test
    void unknownModel_isRejectedWithoutSideEffects() {
        assertThatThrownBy(() -> registry.ingest("ghost", "accuracy", 0.9, null))
            .isInstanceOf(UnknownModelException.class)
            .hasMessageContaining("ghost");
        assertThatThrownBy(() -> registry.establishBaseline("ghost", "accuracy", spread(30, 0.9, 0.01)))
            .isInstanceOf(UnknownModelException.class);
        assertThatThrownBy(() -> registry.checkDrift("ghost", "accuracy"))
            .isInstanceOf(UnknownModelException.class);
        assertThatThrownBy(() -> registry.getHealthScore("ghost"))
            .isInstanceOf(UnknownModelException.class);

        assertThat(registry.isRegistered("ghost")).isFalse();
        assertThat(registry.modelIds()).isEmpty();
        verifyNoInteractions(sink);
    }

    @Test
    void checkDrift_withoutBaseline_isEmpty() {
        registry.register("model-a");
        ingestAll("model-a", "accuracy", spread(20, 0.9, 0.01));

        assertThat(registry.checkDrift("model-a", "accuracy")).isEmpty();
        verifyNoInteractions(sink);
    }

    @Test
    void establishBaseline_tooFewSamples_propagates() {
        registry.register("model-a");
        assertThatThrownBy(() -> registry.establishBaseline("model-a", "accuracy", spread(15, 0.9, 0.01)))
            .isInstanceOf(InsufficientDataException.class);
        assertThat(registry.getBaseline("model-a", "accuracy")).isEmpty();
    }

    @Test
    void checkDrift_degradedAccuracy_raisesOneAlertAndLowersHealth() {
        degradeAccuracy("model-a");

        CheckOutcome outcome = registry.checkDrift("model-a", "accuracy").orElseThrow();

        assertThat(outcome.getResult().isDrift()).isTrue();
        assertThat(outcome.getSeverity()).isIn(Severity.HIGH, Severity.CRITICAL);
        assertThat(outcome.hasNewAlert()).isTrue();
        assertThat(registry.listAlerts("model-a", AlertStatus.OPEN)).hasSize(1);
        assertThat(registry.getHealthScore("model-a")).isLessThan(100);
        assertThat(registry.getDriftStatus("model-a", "accuracy")).containsExactly(outcome.getResult());
        verify(sink).onDriftResult(outcome.getResult());
        verify(sink).onAlert(outcome.getNewAlert());
    }

    @Test
    void checkDrift_repeatedCriticalVerdicts_keepSingleOpenAlert() {
        degradeAccuracy("model-a");

        CheckOutcome first = registry.checkDrift("model-a", "accuracy").orElseThrow();
        clock.advance(Duration.ofMinutes(15));
        CheckOutcome second = registry.checkDrift("model-a", "accuracy").orElseThrow();

        assertThat(first.hasNewAlert()).isTrue();
        assertThat(second.hasNewAlert()).isFalse();
        List<Alert> open = registry.listAlerts("model-a", AlertStatus.OPEN);
        assertThat(open).singleElement().satisfies(a -> assertThat(a.getOccurrences()).isEqualTo(2));
        verify(sink, times(2)).onDriftResult(any(DriftResult.class));
        verify(sink, times(1)).onAlert(any(Alert.class));
    }

    @Test
    void checkDrift_stableMetric_producesNoAlert() {
        registry.register("model-a");
        registry.establishBaseline("model-a", "accuracy", spread(30, 0.94, 0.035));
        ingestAll("model-a", "accuracy", spread(20, 0.94, 0.035));

        CheckOutcome outcome = registry.checkDrift("model-a", "accuracy").orElseThrow();

        assertThat(outcome.getResult().isDrift()).isFalse();
        assertThat(outcome.getSeverity()).isNull();
        assertThat(outcome.hasNewAlert()).isFalse();
        assertThat(registry.getHealthScore("model-a")).isEqualTo(100);
        verify(sink, never()).onAlert(any());
    }

    @Test
    void checkAllMetrics_coversEveryBaselinedMetric() {
        degradeAccuracy("model-a");
        registry.establishBaseline("model-a", "latency_ms", spread(30, 120.0, 10.0));
        ingestAll("model-a", "latency_ms", spread(20, 200.0, 10.0));
        ingestAll("model-a", "throughput", spread(20, 50.0, 5.0));

        List<CheckOutcome> outcomes = registry.checkAllMetrics("model-a");

        assertThat(outcomes).extracting(o -> o.getResult().getMetricName())
            .containsExactly("accuracy", "latency_ms");
        assertThat(outcomes).allSatisfy(o -> assertThat(o.hasNewAlert()).isTrue());
        assertThat(registry.getDriftStatus("model-a", null)).hasSize(2);
    }

    @Test
    void acknowledgeAndResolve_routeToOwningModel() {
        degradeAccuracy("model-a");
        UUID alertId = registry.checkDrift("model-a", "accuracy").orElseThrow().getNewAlert().getId();

        assertThat(registry.acknowledgeAlert(alertId).getStatus()).isEqualTo(AlertStatus.ACKNOWLEDGED);
        assertThat(registry.resolveAlert(alertId).getStatus()).isEqualTo(AlertStatus.RESOLVED);
        assertThat(registry.listAlerts(null, AlertStatus.RESOLVED)).extracting(Alert::getId).containsExactly(alertId);
        verify(sink, times(3)).onAlert(any(Alert.class));
    }

    @Test
    void resolveAlert_unknownId_throwsNotFound() {
        assertThatThrownBy(() -> registry.resolveAlert(UUID.randomUUID()))
            .isInstanceOf(AlertNotFoundException.class);
    }

    @Test
    void deregister_dropsModelAndItsAlerts() {
        degradeAccuracy("model-a");
        UUID alertId = registry.checkDrift("model-a", "accuracy").orElseThrow().getNewAlert().getId();

        assertThat(registry.deregister("model-a")).isTrue();
        assertThat(registry.deregister("model-a")).isFalse();
        assertThat(registry.isRegistered("model-a")).isFalse();
        assertThatThrownBy(() -> registry.acknowledgeAlert(alertId)).isInstanceOf(AlertNotFoundException.class);
        assertThat(registry.listAlerts(null, null)).isEmpty();
    }

    @Test
    void sinkFailure_doesNotFailTheCheck() {
        degradeAccuracy("model-a");
        doThrow(new IllegalStateException("db down")).when(sink).onDriftResult(any());

        Optional<CheckOutcome> outcome = registry.checkDrift("model-a", "accuracy");

        assertThat(outcome).isPresent();
        assertThat(registry.listAlerts("model-a", null)).hasSize(1);
    }

    @Test
    void dueForCheck_honoursPerModelInterval() {
        registry.register("fast", Duration.ofMinutes(5));
        registry.register("slow", Duration.ofHours(1));
        registry.runScheduledChecks("fast");
        registry.runScheduledChecks("slow");

        clock.advance(Duration.ofMinutes(10));

        assertThat(registry.dueForCheck(clock.instant()))
            .extracting(MonitoringContext::getModelId).containsExactly("fast");
    }

    @Test
    void concurrentModels_areIndependent() throws Exception {
        int models = 8;
        for (int m = 0; m < models; m++) {
            registry.register("model-" + m);
            registry.establishBaseline("model-" + m, "accuracy", spread(30, 0.94, 0.035));
        }
        ExecutorService pool = Executors.newFixedThreadPool(models);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<CheckOutcome>>> workers = new ArrayList<>();
        for (int m = 0; m < models; m++) {
            String modelId = "model-" + m;
            double mean = m % 2 == 0 ? 0.94 : 0.70;
            workers.add(pool.submit(() -> {
                start.await();
                for (int round = 0; round < 4; round++) {
                    for (double v : spread(50, mean, 0.035)) {
                        registry.ingest(modelId, "accuracy", v, null);
                    }
                }
                return registry.checkAllMetrics(modelId);
            }));
        }
        start.countDown();
        for (Future<List<CheckOutcome>> worker : workers) {
            assertThat(worker.get(20, TimeUnit.SECONDS)).hasSize(1);
        }
        pool.shutdown();

        for (int m = 0; m < models; m++) {
            String modelId = "model-" + m;
            assertThat(registry.context(modelId).getBuffer().size("accuracy")).isEqualTo(200);
            assertThat(registry.listAlerts(modelId, null)).hasSize(m % 2 == 0 ? 0 : 1);
        }
    }

    @Test
    void checkDrift_sameMetric_runsOneAtATimeAndScheduledRunSkipsBusyMetric() throws Exception {
        GatedDetector gated = new GatedDetector(new KolmogorovSmirnovDetector(MonitoringSettings.defaults(), clock));
        MonitoringRegistry gatedRegistry = registryWith(gated);
        degradeAccuracy(gatedRegistry, "model-a");
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Optional<CheckOutcome>> first = pool.submit(() -> gatedRegistry.checkDrift("model-a", "accuracy"));
            assertThat(gated.entered.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(gatedRegistry.runScheduledChecks("model-a")).isEmpty();

            Future<Optional<CheckOutcome>> second = pool.submit(() -> gatedRegistry.checkDrift("model-a", "accuracy"));
            assertThatThrownBy(() -> second.get(200, TimeUnit.MILLISECONDS)).isInstanceOf(TimeoutException.class);

            gated.release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS)).isPresent();
            assertThat(second.get(5, TimeUnit.SECONDS)).isPresent();
            assertThat(gated.calls).hasValue(2);
            assertThat(gated.maxInFlight).hasValue(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void deregister_duringCheck_leavesNoOrphanedAlertIndex() throws Exception {
        GatedDetector gated = new GatedDetector(new KolmogorovSmirnovDetector(MonitoringSettings.defaults(), clock));
        MonitoringRegistry gatedRegistry = registryWith(gated);
        degradeAccuracy(gatedRegistry, "model-a");
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<Optional<CheckOutcome>> check = pool.submit(() -> gatedRegistry.checkDrift("model-a", "accuracy"));
            assertThat(gated.entered.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(gatedRegistry.deregister("model-a")).isTrue();
            gated.release.countDown();
            CheckOutcome outcome = check.get(5, TimeUnit.SECONDS).orElseThrow();

            assertThat(outcome.hasNewAlert()).isTrue();
            Map<?, ?> owners = (Map<?, ?>) ReflectionTestUtils.getField(gatedRegistry, "alertOwners");
            assertThat(owners).isEmpty();
            assertThatThrownBy(() -> gatedRegistry.resolveAlert(outcome.getNewAlert().getId()))
                .isInstanceOf(AlertNotFoundException.class);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void checkThresholds_errorRateAboveLimit_raisesHighAlertOnce() {
        registry.register("model-a");
        ingestAll("model-a", "error_rate", List.of(0.07, 0.08, 0.09));

        List<ThresholdBreach> first = registry.checkThresholds("model-a");
        List<ThresholdBreach> second = registry.checkThresholds("model-a");

        assertThat(first).singleElement().satisfies(b -> {
            assertThat(b.getMetricName()).isEqualTo("error_rate");
            assertThat(b.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(b.getObservedMean()).isCloseTo(0.08, within(1e-12));
            assertThat(b.getDeviation()).isCloseTo(0.6, within(1e-9));
            assertThat(b.getNewAlert()).isNotNull();
        });
        assertThat(second).singleElement().satisfies(b -> assertThat(b.getNewAlert()).isNull());
        assertThat(registry.listAlerts("model-a", AlertStatus.OPEN)).singleElement().satisfies(a -> {
            assertThat(a.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(a.getOccurrences()).isEqualTo(2);
            assertThat(a.getDegradation()).isCloseTo(0.6, within(1e-9));
        });
        assertThat(registry.getHealthScore("model-a")).isLessThan(100);
        verify(sink, times(1)).onAlert(any(Alert.class));
    }

    @Test
    void checkThresholds_samplesOlderThanWindow_areIgnored() {
        registry.register("model-a");
        ingestAll("model-a", "latency_ms", List.of(250.0, 300.0));
        clock.advance(Duration.ofMinutes(31));
        ingestAll("model-a", "latency_ms", List.of(80.0, 90.0));

        assertThat(registry.checkThresholds("model-a")).isEmpty();
        assertThat(registry.listAlerts("model-a", null)).isEmpty();
    }

    @Test
    void checkThresholds_existingDriftAlertOnSameMetric_isDeduplicated() {
        registry.register("model-a");
        registry.establishBaseline("model-a", "latency_ms", spread(30, 80.0, 10.0));
        ingestAll("model-a", "latency_ms", spread(20, 200.0, 10.0));
        Alert driftAlert = registry.checkDrift("model-a", "latency_ms").orElseThrow().getNewAlert();

        List<ThresholdBreach> breaches = registry.checkThresholds("model-a");

        assertThat(breaches).singleElement().satisfies(b -> {
            assertThat(b.getSeverity()).isEqualTo(Severity.MEDIUM);
            assertThat(b.getNewAlert()).isNull();
        });
        assertThat(registry.listAlerts("model-a", null)).singleElement().satisfies(a -> {
            assertThat(a.getId()).isEqualTo(driftAlert.getId());
            assertThat(a.getSeverity()).isEqualTo(Severity.CRITICAL);
            assertThat(a.getOccurrences()).isEqualTo(2);
        });
        verify(sink, times(1)).onAlert(any(Alert.class));
    }

    @Test
    void runScheduledChecks_includesThresholdRules() {
        registry.register("model-a");
        ingestAll("model-a", "error_rate", List.of(0.2, 0.3));

        registry.runScheduledChecks("model-a");

        assertThat(registry.listAlerts("model-a", AlertStatus.OPEN))
            .extracting(Alert::getMetricName).containsExactly("error_rate");
    }

    private MonitoringRegistry registryWith(DriftDetector detector) {
        MonitoringSettings settings = MonitoringSettings.defaults();
        return new MonitoringRegistry(settings, detector, new SeverityClassifier(), sink, clock,
                                      new ThresholdEvaluator(settings.getThresholdWindow(), new SeverityClassifier(), clock));
    }

    private void degradeAccuracy(MonitoringRegistry target, String modelId) {
        target.register(modelId);
        target.establishBaseline(modelId, "accuracy", spread(30, 0.94, 0.035));
        for (double v : spread(20, 0.758, 0.02)) {
            clock.advance(Duration.ofSeconds(1));
            target.ingest(modelId, "accuracy", v, null);
        }
    }

    /** Holds every detection until {@code release} opens and records how many overlap. */
    private static final class GatedDetector implements DriftDetector {
        private final DriftDetector delegate;
        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);
        private final AtomicInteger calls = new AtomicInteger();
        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicInteger maxInFlight = new AtomicInteger();

        private GatedDetector(DriftDetector delegate) {
            this.delegate = delegate;
        }

        @Override
        public String name() {
            return delegate.name();
        }

        @Override
        public DriftResult detect(Baseline baseline, List<Measurement> current) {
            calls.incrementAndGet();
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            entered.countDown();
            try {
                if (!release.await(10, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("detector gate never opened");
                }
                return delegate.detect(baseline, current);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(ex);
            } finally {
                inFlight.decrementAndGet();
            }
        }
    }
}
