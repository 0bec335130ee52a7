package com.vivek.core.iteration;

import com.vivek.core.model.ExecutionMode;
import com.vivek.core.model.QualityPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Quality gate and transport retry settings.
 *
 * <pre>
 * vivek:
 *   quality:
 *     threshold: 0.7
 *     max-iterations: 3
 *     modes:
 *       sdet:
 *         threshold: 0.6
 *     retry:
 *       max-attempts: 3
 *       backoff-ms: 500
 *       max-backoff-ms: 5000
 *       multiplier: 2.0
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "vivek.quality")
public class QualityProperties {

    private double threshold = 0.7;
    private int maxIterations = 3;
    private Map<String, ModeOverride> modes = new LinkedHashMap<>();
    private Retry retry = new Retry();

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public Map<String, ModeOverride> getModes() {
        return modes;
    }

    public void setModes(Map<String, ModeOverride> modes) {
        this.modes = modes;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    /**
     * Global policy with the mode's overrides applied.
     */
    public QualityPolicy policyFor(ExecutionMode mode) {
        ModeOverride override = mode != null ? modes.get(mode.label()) : null;
        if (override == null) {
            return new QualityPolicy(threshold, maxIterations);
        }
        return new QualityPolicy(
                override.getThreshold() != null ? override.getThreshold() : threshold,
                override.getMaxIterations() != null ? override.getMaxIterations() : maxIterations);
    }

    public static class ModeOverride {

        private Double threshold;
        private Integer maxIterations;

        public Double getThreshold() {
            return threshold;
        }

        public void setThreshold(Double threshold) {
            this.threshold = threshold;
        }

        public Integer getMaxIterations() {
            return maxIterations;
        }

        public void setMaxIterations(Integer maxIterations) {
            this.maxIterations = maxIterations;
        }
    }

    public static class Retry {

        /** Total attempts per call, including the first. */
        private int maxAttempts = 3;
        private long backoffMs = 500;
        private long maxBackoffMs = 5000;
        private double multiplier = 2.0;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getBackoffMs() {
            return backoffMs;
        }

        public void setBackoffMs(long backoffMs) {
            this.backoffMs = backoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }
    }
}
