package com.vivek.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer meters for orchestration runs.
 */
@Service
public class VivekMetrics {

    private final MeterRegistry registry;

    public VivekMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPlanningDuration(long ms) {
        Timer.builder("vivek.planning.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordItemDuration(String mode, String status, long ms) {
        Timer.builder("vivek.item.duration")
                .tag("mode", mode)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordJudgment(String mode, boolean passed, double score) {
        Counter.builder("vivek.judgments.total")
                .tag("mode", mode)
                .tag("result", passed ? "passed" : "failed")
                .register(registry)
                .increment();
        DistributionSummary.builder("vivek.judgment.score")
                .tag("mode", mode)
                .register(registry)
                .record(score);
    }

    public void recordIterationDepth(int depth) {
        DistributionSummary.builder("vivek.iteration.depth")
                .register(registry)
                .record(depth);
    }

    public void recordRunResult(String status) {
        Counter.builder("vivek.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * @param operation "generate" or "review"
     */
    public void recordTransportRetry(String operation) {
        Counter.builder("vivek.transport.retries")
                .description("Generator and reviewer calls retried after a transport failure")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void incrementEscalations(String reason) {
        Counter.builder("vivek.escalations.total")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordRetrievalHits(int hits) {
        DistributionSummary.builder("vivek.retrieval.hits")
                .description("History entries included in a generation prompt")
                .register(registry)
                .record(hits);
    }
}
