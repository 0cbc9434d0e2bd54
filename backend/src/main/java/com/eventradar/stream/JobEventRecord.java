package com.eventradar.stream;

import com.eventradar.domain.ChainLog;
import com.eventradar.domain.JobDefinition;
import com.eventradar.domain.JobEventType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the flat key/value records written to the event streams. Field names are the wire names consumers read.
 */
public final class JobEventRecord {

    public static final String EVENT_TYPE = "event_type";
    public static final String JOB_ID = "job_id";
    public static final String MANAGER_ID = "manager_id";
    public static final String TIMESTAMP = "timestamp";
    public static final String STATUS = "status";
    public static final String ERROR = "error";

    private final Map<String, Object> fields = new LinkedHashMap<>();

    private JobEventRecord(JobEventType type, String managerId) {
        fields.put(EVENT_TYPE, type.wireName());
        fields.put(MANAGER_ID, managerId);
        fields.put(TIMESTAMP, Instant.now().getEpochSecond());
    }

    public static JobEventRecord of(JobEventType type, String managerId) {
        return new JobEventRecord(type, managerId);
    }

    /** Adds job identity and trigger/target fields. */
    public JobEventRecord job(JobDefinition job) {
        fields.put(JOB_ID, job.jobId());
        fields.put("trigger_chain_id", job.triggerChainId());
        fields.put("trigger_contract_address", job.triggerContractAddress());
        fields.put("trigger_event", job.triggerEvent());
        fields.put("target_chain_id", job.targetChainId());
        fields.put("target_contract_address", job.targetContractAddress());
        fields.put("target_function", job.targetFunction());
        fields.put("recurring", job.recurring());
        return this;
    }

    /** Adds the identifying fields of a matched log. */
    public JobEventRecord log(ChainLog log) {
        fields.put("tx_hash", log.transactionHash());
        fields.put("block_number", log.blockNumber());
        fields.put("log_index", log.logIndex());
        return this;
    }

    public JobEventRecord put(String key, Object value) {
        if (value != null) {
            fields.put(key, value);
        }
        return this;
    }

    /** Overwrites the event type, keeping all other fields. */
    public JobEventRecord eventType(JobEventType type) {
        fields.put(EVENT_TYPE, type.wireName());
        return this;
    }

    public Map<String, Object> toMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
