package com.eventradar.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Success envelope: status, message, optional job ID and payload, timestamp.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse(String status, String message, Long jobId, Object data, Instant timestamp) {

    public static ApiResponse success(String message, Long jobId, Object data) {
        return new ApiResponse("success", message, jobId, data, Instant.now());
    }
}
