package com.workflow.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

public final class SimpleMetricsRecorder implements MetricsRecorder {
    private final MeterRegistry registry;

    public SimpleMetricsRecorder() {
        this.registry = new SimpleMeterRegistry();
    }

    public SimpleMetricsRecorder(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onPhaseSuccess(String workflow, String phase, long nanos) {
        Timer.builder(metric(workflow, phase, "duration"))
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void onPhaseError(String workflow, String phase, Throwable t) {
        Counter.builder(metric(workflow, phase, "errors"))
                .tag("exception", t.getClass().getSimpleName())
                .register(registry)
                .increment();
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    static String metric(String workflow, String phase, String name) {
        return "wf.workflow." + workflow + ".phase." + phase + "." + name;
    }
}
