package com.eventradar.stream;

import java.util.Map;

/**
 * Appends flat key/value event records to the ready or retry stream.
 * Publishing is best-effort: implementations log failures and never throw to the caller.
 */
public interface EventStreamPublisher {

    void publish(EventStream stream, Map<String, Object> record);

    boolean isAvailable();
}
