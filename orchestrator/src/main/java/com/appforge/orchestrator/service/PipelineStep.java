package com.appforge.orchestrator.service;

/** The three externally-dependent steps of a task, as counted and timed. */
public enum PipelineStep {
    GENERATE,
    PUBLISH,
    NOTIFY;

    public String metricName() {
        return name().toLowerCase();
    }
}
