package com.driftmonitor.service;

import com.driftmonitor.core.MonitoringContext;
import com.driftmonitor.model.CheckOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "monitoring.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MonitoringScheduler {

    private final MonitoringRegistry registry;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${monitoring.scheduler.tick-ms:60000}")
    public void tick() {
        Instant start = clock.instant();
        List<CheckOutcome> outcomes = sweep().collectList().block();
        long alerts = outcomes == null ? 0 : outcomes.stream().filter(CheckOutcome::hasNewAlert).count();
        log.info("Scheduled sweep finished | checks={} | newAlerts={} | tookMs={}",
                 outcomes == null ? 0 : outcomes.size(), alerts,
                 Duration.between(start, clock.instant()).toMillis());
    }

    /**
     * Runs the due models' checks in parallel. Ordering between models is not defined and a
     * failure on one model does not cancel the others.
     */
    public Flux<CheckOutcome> sweep() {
        Instant now = clock.instant();
        return Flux.fromIterable(registry.dueForCheck(now))
            .map(MonitoringContext::getModelId)
            .flatMap(modelId -> Mono.fromCallable(() -> registry.runScheduledChecks(modelId))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapIterable(outcomes -> outcomes)
                .onErrorResume(ex -> {
                    log.error("Scheduled drift check failed | model={} | error={}", modelId, ex.getMessage(), ex);
                    return Flux.empty();
                }));
    }
}
