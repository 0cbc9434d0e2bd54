package com.eventradar.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes event records to Redis streams (XADD). Values are stringified; collections and maps become JSON.
 * Streams are trimmed to an approximate maximum length after each append.
 */
@Slf4j
public class RedisEventStreamPublisher implements EventStreamPublisher {

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final String readyStream;
    private final String retryStream;
    private final long maxLength;

    public RedisEventStreamPublisher(StringRedisTemplate redis, ObjectMapper objectMapper,
                                     String readyStream, String retryStream, long maxLength) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.readyStream = readyStream;
        this.retryStream = retryStream;
        this.maxLength = maxLength;
    }

    @Override
    public void publish(EventStream stream, Map<String, Object> record) {
        String key = streamKey(stream);
        try {
            RecordId id = redis.opsForStream().add(StreamRecords.string(stringify(record)).withStreamKey(key));
            if (maxLength > 0) {
                redis.opsForStream().trim(key, maxLength, true);
            }
            log.debug("Published {} to {} as {}", record.get(JobEventRecord.EVENT_TYPE), key, id);
        } catch (RuntimeException e) {
            log.warn("Failed to publish to stream {}: eventType={}, jobId={}, error={}",
                    key, record.get(JobEventRecord.EVENT_TYPE), record.get(JobEventRecord.JOB_ID), e.getMessage());
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            var factory = redis.getConnectionFactory();
            if (factory == null) {
                return false;
            }
            try (var connection = factory.getConnection()) {
                return "PONG".equalsIgnoreCase(connection.ping());
            }
        } catch (RuntimeException e) {
            log.debug("Redis stream backend unavailable: {}", e.getMessage());
            return false;
        }
    }

    String streamKey(EventStream stream) {
        return stream == EventStream.READY ? readyStream : retryStream;
    }

    Map<String, String> stringify(Map<String, Object> record) {
        Map<String, String> out = new LinkedHashMap<>();
        record.forEach((k, v) -> {
            if (v != null) {
                out.put(k, stringValue(v));
            }
        });
        return out;
    }

    private String stringValue(Object value) {
        if (value instanceof Collection<?> || value instanceof Map<?, ?>) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return value.toString();
            }
        }
        return value.toString();
    }
}
