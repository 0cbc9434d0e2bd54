package com.eventradar.domain;

/**
 * Lifecycle and failure record types appended to the ready/retry event streams.
 */
public enum JobEventType {
    SCHEDULER_STARTUP("scheduler_startup"),
    SCHEDULER_SHUTDOWN("scheduler_shutdown"),
    JOB_SCHEDULED("job_scheduled"),
    JOB_SCHEDULE_FAILED("job_schedule_failed"),
    JOB_UNSCHEDULED("job_unscheduled"),
    JOB_UNSCHEDULE_FAILED("job_unschedule_failed"),
    WORKER_STARTED("worker_started"),
    WORKER_STOPPED("worker_stopped"),
    WORKER_ERROR("worker_error"),
    WORKER_LOCK_CONFLICT("worker_lock_conflict"),
    WORKER_LOCK_FAILED("worker_lock_failed"),
    EVENT_DETECTED("event_detected"),
    EVENT_DUPLICATE_DETECTED("event_duplicate_detected"),
    EVENT_COMPLETED("event_completed"),
    EVENT_FAILED("event_failed");

    private final String wireName;

    JobEventType(String wireName) {
        this.wireName = wireName;
    }

    /** Value written to the {@code event_type} field. */
    public String wireName() {
        return wireName;
    }
}
