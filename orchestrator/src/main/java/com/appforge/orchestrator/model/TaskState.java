package com.appforge.orchestrator.model;

/**
 * Pipeline state of a task.
 *
 * Transitions are strictly forward:
 *   RECEIVED → GENERATING → PUBLISHING → NOTIFYING → DONE
 *
 * A generation failure skips PUBLISHING and goes straight to NOTIFYING so the
 * caller still hears about it.
 */
public enum TaskState {
    RECEIVED,
    GENERATING,
    PUBLISHING,
    NOTIFYING,
    DONE;

    public boolean isTerminal() {
        return this == DONE;
    }
}
