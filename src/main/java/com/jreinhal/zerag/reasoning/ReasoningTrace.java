package com.jreinhal.zerag.reasoning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Ordered record of the pipeline steps taken for one question. Returned to the caller and
 * stored on the audit record. Owned by a single request, so not synchronized.
 */
public class ReasoningTrace {

    private final String traceId;
    private final String dataSourceId;
    private final List<ReasoningStep> steps = new ArrayList<>();
    private long totalDurationMs;

    public ReasoningTrace(String dataSourceId) {
        this.traceId = UUID.randomUUID().toString().substring(0, 8);
        this.dataSourceId = dataSourceId;
    }

    public void addStep(ReasoningStep step) {
        this.steps.add(step);
        this.totalDurationMs += step.durationMs();
    }

    public void addStep(ReasoningStep.StepType type, String label, String detail, long durationMs) {
        this.addStep(ReasoningStep.of(type, label, detail, durationMs));
    }

    public void addStep(ReasoningStep.StepType type, String label, String detail, long durationMs, Map<String, Object> data) {
        this.addStep(ReasoningStep.of(type, label, detail, durationMs, data));
    }

    /**
     * Runs the operation and records it as one step. A failure is recorded as an ERROR step
     * and rethrown.
     */
    public <T> T timed(ReasoningStep.StepType type, String label, Supplier<T> operation) {
        long start = System.currentTimeMillis();
        T result;
        try {
            result = operation.get();
        }
        catch (RuntimeException e) {
            this.addStep(ReasoningStep.StepType.ERROR, label + " (failed)", e.getMessage(), System.currentTimeMillis() - start);
            throw e;
        }
        this.addStep(type, label, null, System.currentTimeMillis() - start);
        return result;
    }

    public String getTraceId() {
        return this.traceId;
    }

    public String getDataSourceId() {
        return this.dataSourceId;
    }

    public List<ReasoningStep> getSteps() {
        return Collections.unmodifiableList(this.steps);
    }

    public long getTotalDurationMs() {
        return this.totalDurationMs;
    }

    public boolean hasStep(ReasoningStep.StepType type) {
        return this.steps.stream().anyMatch(s -> s.type() == type);
    }

    public List<Map<String, Object>> getStepsAsMaps() {
        List<Map<String, Object>> stepMaps = new ArrayList<>(this.steps.size());
        for (ReasoningStep step : this.steps) {
            Map<String, Object> stepMap = new LinkedHashMap<>();
            stepMap.put("step", step.type().name().toLowerCase(Locale.ROOT));
            stepMap.put("label", step.label());
            if (step.detail() != null) {
                stepMap.put("detail", step.detail());
            }
            stepMap.put("durationMs", step.durationMs());
            if (!step.data().isEmpty()) {
                stepMap.put("data", step.data());
            }
            stepMaps.add(stepMap);
        }
        return stepMaps;
    }

    public String getSummary() {
        return String.format("Trace[%s]: %d steps, %dms total", this.traceId, this.steps.size(), this.totalDurationMs);
    }
}
