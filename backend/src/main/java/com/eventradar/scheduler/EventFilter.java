package com.eventradar.scheduler;

import com.eventradar.chain.EventSignatures;
import com.eventradar.domain.JobDefinition;

/**
 * Validated contract address and precomputed event topic of a job.
 */
record EventFilter(String contractAddress, String topic) {

    static EventFilter of(JobDefinition job) {
        if (!EventSignatures.isValidAddress(job.triggerContractAddress())) {
            throw SchedulerException.invalidContractAddress(job.triggerContractAddress());
        }
        if (job.triggerEvent() == null || job.triggerEvent().isBlank()) {
            throw new SchedulerException(SchedulerException.Reason.INVALID_TRIGGER_EVENT,
                    "trigger event signature is required for job " + job.jobId());
        }
        return new EventFilter(
                EventSignatures.normalizeAddress(job.triggerContractAddress()),
                EventSignatures.topicOf(job.triggerEvent()));
    }
}
