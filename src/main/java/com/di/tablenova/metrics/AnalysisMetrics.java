package com.di.tablenova.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for provider calls, fallbacks, circuit breakers, quality verdicts and jobs.
 */
@Slf4j
@Component
public class AnalysisMetrics {

    private final MeterRegistry meterRegistry;

    // Provider
    private final Counter providerCallCounter;
    private final Counter providerErrorCounter;
    private final Timer providerCallTimer;
    private final DistributionSummary providerCostSummary;

    // Fault tolerance
    private final Counter circuitOpenedCounter;

    public AnalysisMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.providerCallCounter = Counter.builder("tablenova.provider.calls.total")
                .description("Total number of completion provider calls")
                .tag("status", "success")
                .register(meterRegistry);

        this.providerErrorCounter = Counter.builder("tablenova.provider.calls.total")
                .description("Total number of failed completion provider calls")
                .tag("status", "error")
                .register(meterRegistry);

        this.providerCallTimer = Timer.builder("tablenova.provider.call.duration")
                .description("Latency of completion provider calls")
                .register(meterRegistry);

        this.providerCostSummary = DistributionSummary.builder("tablenova.provider.call.cost")
                .description("USD cost per completion provider call")
                .baseUnit("usd")
                .register(meterRegistry);

        this.circuitOpenedCounter = Counter.builder("tablenova.circuit.opened.total")
                .description("Number of times a circuit breaker opened")
                .register(meterRegistry);
    }

    public void recordProviderCall(Duration latency, double cost) {
        providerCallCounter.increment();
        providerCallTimer.record(latency);
        providerCostSummary.record(cost);
    }

    public void recordProviderError(Duration latency) {
        providerErrorCounter.increment();
        providerCallTimer.record(latency);
    }

    public void recordFallback(String strategy) {
        Counter.builder("tablenova.fallback.total")
                .description("Fallback outcomes by strategy")
                .tag("strategy", strategy)
                .register(meterRegistry)
                .increment();
    }

    public void recordCircuitOpened(String operationName) {
        circuitOpenedCounter.increment();
        log.warn("[METRICS] Circuit opened for operation={}", operationName);
    }

    public void recordQualityVerdict(String verdict) {
        Counter.builder("tablenova.quality.verdicts.total")
                .description("Validated findings by worst verdict")
                .tag("verdict", verdict)
                .register(meterRegistry)
                .increment();
    }

    public void recordJobFinished(String kind, String state) {
        Counter.builder("tablenova.jobs.finished.total")
                .description("Jobs reaching a terminal state")
                .tag("kind", kind)
                .tag("state", state)
                .register(meterRegistry)
                .increment();
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}
