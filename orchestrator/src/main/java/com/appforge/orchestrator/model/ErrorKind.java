package com.appforge.orchestrator.model;

/** Which step exhausted its retry budget. */
public enum ErrorKind {
    GENERATION_FAILED,
    PUBLISH_FAILED
}
