package com.appforge.orchestrator.model;

/**
 * Hosting activation is asynchronous on GitHub's side, so a fresh
 * deployment normally starts out PENDING.
 */
public enum PagesStatus {
    PENDING,
    LIVE,
    UNKNOWN
}
