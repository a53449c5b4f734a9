package com.example.dubbing_backend.controller;

import com.example.dubbing_backend.dto.DubbingOptions;
import com.example.dubbing_backend.dto.JobListResponse;
import com.example.dubbing_backend.dto.ProcessVideoRequest;
import com.example.dubbing_backend.dto.ProcessVideoResponse;
import com.example.dubbing_backend.dto.VideoStatusResponse;
import com.example.dubbing_backend.service.DubbingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/v1/video-dubbing")
public class VideoDubbingController {
    private final DubbingService dubbingService;

    public VideoDubbingController(DubbingService dubbingService) {
        this.dubbingService = dubbingService;
    }

    @PostMapping("/process/{sourceId}")
    @ResponseStatus(HttpStatus.ACCEPTED)
    @Operation(summary = "Queue a dubbing job for a source video")
    @ApiResponse(responseCode = "202", description = "Job queued")
    @ApiResponse(responseCode = "400", description = "Invalid options")
    @ApiResponse(responseCode = "404", description = "Source or its video not found")
    @ApiResponse(responseCode = "409", description = "A job for this source is already queued or running")
    public ProcessVideoResponse process(@PathVariable UUID sourceId,
                                        @Valid @RequestBody(required = false) ProcessVideoRequest request) {
        return dubbingService.submit(sourceId, optionsOf(request));
    }

    @GetMapping("/status/{sourceId}")
    @Operation(summary = "Status of the latest job of a source video")
    @ApiResponse(responseCode = "200", description = "Latest job projection")
    @ApiResponse(responseCode = "404", description = "Source not found or never processed")
    public VideoStatusResponse status(@PathVariable UUID sourceId) {
        return dubbingService.getStatus(sourceId);
    }

    @DeleteMapping("/{sourceId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Cancel the active job and delete the dubbed artifacts")
    @ApiResponse(responseCode = "204", description = "Cancelled")
    @ApiResponse(responseCode = "404", description = "Source not found")
    public void cancel(@PathVariable UUID sourceId) {
        dubbingService.cancel(sourceId);
    }

    @PostMapping("/regenerate/{sourceId}")
    @ResponseStatus(HttpStatus.ACCEPTED)
    @Operation(summary = "Cancel whatever exists for the source and queue a fresh job")
    @ApiResponse(responseCode = "202", description = "New job queued")
    @ApiResponse(responseCode = "404", description = "Source not found")
    public ProcessVideoResponse regenerate(@PathVariable UUID sourceId,
                                           @Valid @RequestBody(required = false) ProcessVideoRequest request) {
        return dubbingService.regenerate(sourceId, optionsOf(request));
    }

    @GetMapping("/jobs")
    @Operation(summary = "List jobs, most recently queued first")
    @ApiResponse(responseCode = "200", description = "Page of jobs")
    @ApiResponse(responseCode = "400", description = "Bad pagination or unknown status")
    public JobListResponse list(@RequestParam(required = false) String status,
                                @RequestParam(defaultValue = "20") int limit,
                                @RequestParam(defaultValue = "0") int offset) {
        return dubbingService.listJobs(status, limit, offset);
    }

    @GetMapping("/jobs/{jobId}")
    @Operation(summary = "Single job")
    @ApiResponse(responseCode = "200", description = "Job projection")
    @ApiResponse(responseCode = "404", description = "Job not found")
    public VideoStatusResponse job(@PathVariable UUID jobId) {
        return dubbingService.getJob(jobId);
    }

    @PostMapping("/jobs/{jobId}/retry")
    @ResponseStatus(HttpStatus.ACCEPTED)
    @Operation(summary = "Retry a failed job once")
    @ApiResponse(responseCode = "202", description = "Job re-queued")
    @ApiResponse(responseCode = "404", description = "Job not found")
    @ApiResponse(responseCode = "409", description = "Job is not FAILED")
    public ProcessVideoResponse retry(@PathVariable UUID jobId) {
        return dubbingService.retry(jobId);
    }

    private static DubbingOptions optionsOf(ProcessVideoRequest request) {
        return request == null || request.options() == null ? DubbingOptions.defaults() : request.options();
    }
}
