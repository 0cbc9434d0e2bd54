package com.eventradar.api.controller;

import com.eventradar.api.dto.ApiResponse;
import com.eventradar.api.dto.ScheduleJobRequest;
import com.eventradar.domain.JobDefinition;
import com.eventradar.scheduler.EventSchedulerManager;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Job scheduling and scheduler introspection. Scheduler calls may block on RPC or Redis, so they all run on
 * boundedElastic.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class SchedulerController {

    private final EventSchedulerManager manager;

    @PostMapping("/jobs")
    public Mono<ResponseEntity<ApiResponse>> scheduleJob(@RequestBody @Valid ScheduleJobRequest request) {
        JobDefinition job = request.toJobDefinition();
        return Mono.fromCallable(() -> {
                    manager.scheduleJob(job);
                    return ResponseEntity.status(HttpStatus.CREATED)
                            .body(ApiResponse.success("Job scheduled", job.jobId(), null));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/jobs/{jobId}")
    public Mono<ResponseEntity<ApiResponse>> unscheduleJob(@PathVariable long jobId) {
        return Mono.fromCallable(() -> {
                    manager.unscheduleJob(jobId);
                    return ResponseEntity.ok(ApiResponse.success("Job unscheduled", jobId, null));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/jobs/{jobId}/stats")
    public Mono<ResponseEntity<ApiResponse>> getJobStats(@PathVariable long jobId) {
        return Mono.fromCallable(() -> ResponseEntity.ok(
                        ApiResponse.success("Job worker stats", jobId, manager.getJobWorkerStats(jobId))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /** Stats ping the cache and stream backends, which may be a Redis round trip. */
    @GetMapping("/scheduler/stats")
    public Mono<ResponseEntity<ApiResponse>> getSchedulerStats() {
        return Mono.fromCallable(() -> ResponseEntity.ok(ApiResponse.success("Scheduler stats", null, manager.getStats())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/scheduler/stop")
    public Mono<ResponseEntity<ApiResponse>> stopScheduler() {
        return Mono.fromCallable(() -> {
                    manager.stop();
                    return ResponseEntity.ok(ApiResponse.success("Scheduler stopped", null, null));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }
}
