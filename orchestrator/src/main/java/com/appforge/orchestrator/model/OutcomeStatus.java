package com.appforge.orchestrator.model;

public enum OutcomeStatus {
    SUCCEEDED,
    FAILED
}
