package com.eventradar.dispatch;

import com.eventradar.domain.ChainLog;
import com.eventradar.domain.JobDefinition;

/**
 * One detected event handed to the downstream action executor.
 */
public record DispatchRequest(JobDefinition job, ChainLog log, String managerId) {
}
