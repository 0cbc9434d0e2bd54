package com.eventradar.api.dto;

import com.eventradar.domain.JobDefinition;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * Body of POST /api/v1/jobs. Field names are snake_case on the wire.
 * Address syntax is checked by the scheduler so the rejection is also reported on the retry stream.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScheduleJobRequest(
        @NotNull @PositiveOrZero Long jobId,
        @NotBlank String triggerChainId,
        @NotBlank String triggerContractAddress,
        @NotBlank String triggerEvent,
        String targetChainId,
        String targetContractAddress,
        String targetFunction,
        boolean recurring,
        Long timeFrame,
        String abi,
        Integer argType,
        List<String> arguments,
        String dynamicArgumentsScriptUrl
) {

    public JobDefinition toJobDefinition() {
        return new JobDefinition(
                jobId,
                triggerChainId.trim(),
                triggerContractAddress.trim(),
                triggerEvent.trim(),
                targetChainId,
                targetContractAddress,
                targetFunction,
                recurring,
                timeFrame != null ? timeFrame : 0L,
                abi,
                argType != null ? argType : 0,
                arguments,
                dynamicArgumentsScriptUrl
        );
    }
}
