package com.eventradar.dispatch;

import com.eventradar.domain.ChainLog;
import com.eventradar.domain.JobDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts the detected event and the job's target action as JSON to the task dispatcher. Any 2xx is success.
 */
@Slf4j
public class WebClientActionDispatcher implements ActionDispatcher {

    private final WebClient webClient;
    private final String url;
    private final Duration timeout;

    public WebClientActionDispatcher(WebClient.Builder builder, String url, Duration timeout) {
        this.webClient = builder.build();
        this.url = url;
        this.timeout = timeout;
    }

    @Override
    public DispatchResult dispatch(DispatchRequest request) {
        if (url == null || url.isBlank()) {
            return DispatchResult.failed("no dispatch url configured");
        }
        try {
            ResponseEntity<Void> response = webClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(toBody(request))
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(timeout)
                    .block();
            if (response != null && response.getStatusCode().is2xxSuccessful()) {
                return DispatchResult.ok();
            }
            return DispatchResult.failed("unexpected response: " + (response != null ? response.getStatusCode() : "none"));
        } catch (RuntimeException e) {
            log.warn("Dispatch failed: jobId={}, txHash={}, error={}",
                    request.job().jobId(), request.log().transactionHash(), e.getMessage());
            return DispatchResult.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    static Map<String, Object> toBody(DispatchRequest request) {
        JobDefinition job = request.job();
        ChainLog event = request.log();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("job_id", job.jobId());
        body.put("manager_id", request.managerId());
        body.put("trigger_chain_id", job.triggerChainId());
        body.put("trigger_contract_address", job.triggerContractAddress());
        body.put("trigger_event", job.triggerEvent());
        body.put("target_chain_id", job.targetChainId());
        body.put("target_contract_address", job.targetContractAddress());
        body.put("target_function", job.targetFunction());
        body.put("recurring", job.recurring());
        body.put("time_frame", job.timeFrame());
        body.put("abi", job.abi());
        body.put("arg_type", job.argType());
        body.put("arguments", job.arguments());
        body.put("dynamic_arguments_script_url", job.dynamicArgumentsScriptUrl());
        body.put("tx_hash", event.transactionHash());
        body.put("block_number", event.blockNumber());
        body.put("log_index", event.logIndex());
        body.put("topics", event.topics());
        body.put("data", event.data());
        return body;
    }
}
