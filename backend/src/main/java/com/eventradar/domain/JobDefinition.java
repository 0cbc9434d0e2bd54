package com.eventradar.domain;

import java.util.List;

/**
 * Event-triggered job accepted for scheduling. Immutable once accepted.
 * Trigger fields select the watched contract event; target fields describe the downstream action
 * and are only forwarded to the dispatcher.
 */
public record JobDefinition(
        long jobId,
        String triggerChainId,
        String triggerContractAddress,
        String triggerEvent,
        String targetChainId,
        String targetContractAddress,
        String targetFunction,
        boolean recurring,
        long timeFrame,
        String abi,
        int argType,
        List<String> arguments,
        String dynamicArgumentsScriptUrl
) {

    public JobDefinition {
        arguments = arguments != null ? List.copyOf(arguments) : List.of();
    }

    /**
     * Job with trigger and target only; optional dispatch arguments left empty.
     */
    public static JobDefinition of(long jobId,
                                   String triggerChainId,
                                   String triggerContractAddress,
                                   String triggerEvent,
                                   String targetChainId,
                                   String targetContractAddress,
                                   String targetFunction,
                                   boolean recurring) {
        return new JobDefinition(jobId, triggerChainId, triggerContractAddress, triggerEvent,
                targetChainId, targetContractAddress, targetFunction, recurring,
                0L, null, 0, List.of(), null);
    }
}
