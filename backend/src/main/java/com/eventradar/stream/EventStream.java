package com.eventradar.stream;

/**
 * Destination streams for job event records: successful/lifecycle records go to READY, failures to RETRY.
 */
public enum EventStream {
    READY,
    RETRY
}
