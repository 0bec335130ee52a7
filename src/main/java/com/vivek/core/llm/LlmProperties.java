package com.vivek.core.llm;

import com.vivek.core.model.ExecutionMode;
import com.vivek.core.model.SamplingParams;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "vivek.llm")
public class LlmProperties {

    /** Model name passed to the chat client; empty uses the provider default. */
    private String model = "";
    private Sampling planner = new Sampling(0.1, 4096);
    private Sampling executor = new Sampling(0.1, 4096);

    /** Per-mode overrides of the executor sampling, keyed by mode label ("coder", "sdet"). */
    private Map<String, Sampling> modes = new LinkedHashMap<>();

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public Sampling getPlanner() {
        return planner;
    }

    public void setPlanner(Sampling planner) {
        this.planner = planner;
    }

    public Sampling getExecutor() {
        return executor;
    }

    public void setExecutor(Sampling executor) {
        this.executor = executor;
    }

    public Map<String, Sampling> getModes() {
        return modes;
    }

    public void setModes(Map<String, Sampling> modes) {
        this.modes = modes;
    }

    public boolean hasModel() {
        return model != null && !model.isBlank();
    }

    public SamplingParams plannerSampling() {
        return planner.resolve(SamplingParams.DEFAULT);
    }

    /**
     * Executor sampling for a mode: the mode's override where set, the executor default otherwise.
     */
    public SamplingParams samplingFor(ExecutionMode mode) {
        SamplingParams base = executor.resolve(SamplingParams.DEFAULT);
        Sampling override = mode != null ? modes.get(mode.label()) : null;
        return override != null ? override.resolve(base) : base;
    }

    public static class Sampling {

        private Double temperature;
        private Integer maxTokens;

        public Sampling() {
        }

        public Sampling(Double temperature, Integer maxTokens) {
            this.temperature = temperature;
            this.maxTokens = maxTokens;
        }

        public Double getTemperature() {
            return temperature;
        }

        public void setTemperature(Double temperature) {
            this.temperature = temperature;
        }

        public Integer getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
        }

        SamplingParams resolve(SamplingParams fallback) {
            return new SamplingParams(
                    temperature != null ? temperature : fallback.temperature(),
                    maxTokens != null ? maxTokens : fallback.maxTokens());
        }
    }
}
