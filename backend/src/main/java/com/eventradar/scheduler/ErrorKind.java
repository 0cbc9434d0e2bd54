package com.eventradar.scheduler;

/**
 * How a caller should treat a scheduler failure.
 */
public enum ErrorKind {
    /** Request refused; retrying the same request will fail the same way. */
    REJECTED,
    /** Infrastructure failure; the same request may succeed later. */
    TRANSIENT,
    /** The scheduler cannot operate. */
    FATAL
}
