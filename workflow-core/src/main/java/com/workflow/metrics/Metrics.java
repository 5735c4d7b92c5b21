package com.workflow.metrics;

import java.util.Objects;

/** Process-wide holder of the {@link MetricsRecorder} used by fit phases. */
public final class Metrics {
    private static volatile MetricsRecorder recorder = new SimpleMetricsRecorder();

    private Metrics() {}

    public static MetricsRecorder recorder() {
        return recorder;
    }

    public static void setRecorder(MetricsRecorder r) {
        recorder = Objects.requireNonNull(r, "recorder");
    }

    /** Installs a fresh in-memory recorder and returns it. */
    public static SimpleMetricsRecorder resetToSimple() {
        SimpleMetricsRecorder fresh = new SimpleMetricsRecorder();
        recorder = fresh;
        return fresh;
    }
}
