package com.eventradar.stream;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Used when streams are disabled. Records are only logged at debug level.
 */
@Slf4j
public class NoOpEventStreamPublisher implements EventStreamPublisher {

    @Override
    public void publish(EventStream stream, Map<String, Object> record) {
        log.debug("Stream disabled, dropping record: stream={}, eventType={}", stream, record.get(JobEventRecord.EVENT_TYPE));
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
