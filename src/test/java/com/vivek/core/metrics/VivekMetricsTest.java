package com.vivek.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VivekMetricsTest {

    private SimpleMeterRegistry registry;
    private VivekMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new VivekMetrics(registry);
    }

    @Test
    void recordPlanningDuration() {
        metrics.recordPlanningDuration(1500);
        var timer = registry.find("vivek.planning.duration").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("judgments are counted by mode and result")
    void recordJudgment() {
        metrics.recordJudgment("coder", true, 0.9);
        metrics.recordJudgment("coder", false, 0.3);
        metrics.recordJudgment("coder", false, 0.5);

        assertEquals(1.0, registry.find("vivek.judgments.total").tags("mode", "coder", "result", "passed")
                .counter().count());
        assertEquals(2.0, registry.find("vivek.judgments.total").tags("mode", "coder", "result", "failed")
                .counter().count());
        var scores = registry.find("vivek.judgment.score").tag("mode", "coder").summary();
        assertEquals(3, scores.count());
        assertEquals(1.7, scores.totalAmount(), 1e-9);
    }

    @Test
    void recordItemDuration() {
        metrics.recordItemDuration("sdet", "DONE", 200);
        var timer = registry.find("vivek.item.duration").tags("mode", "sdet", "status", "DONE").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    void countersAndSummaries() {
        metrics.recordRunResult("COMPLETED");
        metrics.recordTransportRetry("generate");
        metrics.incrementEscalations("QUALITY_EXHAUSTED");
        metrics.recordIterationDepth(3);
        metrics.recordRetrievalHits(4);

        assertEquals(1.0, registry.find("vivek.runs.total").tag("status", "COMPLETED").counter().count());
        assertEquals(1.0, registry.find("vivek.transport.retries").tag("operation", "generate").counter().count());
        assertEquals(1.0, registry.find("vivek.escalations.total").tag("reason", "QUALITY_EXHAUSTED")
                .counter().count());
        assertEquals(3.0, registry.find("vivek.iteration.depth").summary().totalAmount());
        assertEquals(4.0, registry.find("vivek.retrieval.hits").summary().totalAmount());
    }
}
