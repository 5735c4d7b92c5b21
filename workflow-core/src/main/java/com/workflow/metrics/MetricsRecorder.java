package com.workflow.metrics;

import io.micrometer.core.instrument.MeterRegistry;

/** Receives one event per fit phase ({@code fit_pre}, {@code fit_model}, {@code predict}). */
public interface MetricsRecorder {
    void onPhaseSuccess(String workflow, String phase, long nanos);
    void onPhaseError(String workflow, String phase, Throwable t);
    MeterRegistry registry();
}
