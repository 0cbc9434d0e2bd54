package com.eventradar.domain;

/**
 * Event worker lifecycle. CREATED → RUNNING → STOPPED, or CREATED → STOPPED when stopped before its loop began.
 */
public enum WorkerState {
    CREATED,
    RUNNING,
    STOPPED
}
