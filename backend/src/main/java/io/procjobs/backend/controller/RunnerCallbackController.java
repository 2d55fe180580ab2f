package io.procjobs.backend.controller;

import io.procjobs.backend.model.dto.LogEntryRequest;
import io.procjobs.backend.model.dto.ProgressUpdateRequest;
import io.procjobs.backend.model.dto.StatusUpdateRequest;
import io.procjobs.backend.model.entity.InvalidJobFieldException;
import io.procjobs.backend.model.entity.Job;
import io.procjobs.backend.model.entity.JobError;
import io.procjobs.backend.model.entity.JobOutput;
import io.procjobs.backend.model.entity.JobStateConflictException;
import io.procjobs.backend.model.entity.JobStatus;
import io.procjobs.backend.service.JobResponseMapper;
import io.procjobs.backend.service.JobService;
import io.procjobs.backend.service.exception.JobNotFoundException;
import io.procjobs.backend.util.SecurityUtils;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.function.Supplier;

/**
 * Endpoints used by job runners to report progress. Secured by the internal path rule,
 * so every caller here is authenticated.
 */
@Slf4j
@RestController
@RequestMapping("/internal/jobs/{jobId}")
public class RunnerCallbackController {

    private final JobService jobService;
    private final JobResponseMapper responseMapper;

    @Autowired
    public RunnerCallbackController(JobService jobService, JobResponseMapper responseMapper) {
        this.jobService = jobService;
        this.responseMapper = responseMapper;
    }

    @PostMapping("/status")
    public ResponseEntity<?> updateStatus(@PathVariable String jobId,
                                          @Valid @RequestBody StatusUpdateRequest request) {
        return apply(jobId, () -> {
            JobStatus status = JobStatus.resolve(request.getStatus())
                    .orElseThrow(() -> new InvalidJobFieldException("status", request.getStatus()));
            return jobService.applyStatus(jobId, status, request.getMessage(), request.getTimestamp());
        });
    }

    @PostMapping("/progress")
    public ResponseEntity<?> updateProgress(@PathVariable String jobId,
                                            @Valid @RequestBody ProgressUpdateRequest request) {
        return apply(jobId, () -> jobService.applyProgress(jobId, request.getProgress(), request.getMessage()));
    }

    @PostMapping("/logs")
    public ResponseEntity<?> appendLog(@PathVariable String jobId,
                                       @Valid @RequestBody LogEntryRequest request) {
        return apply(jobId, () -> jobService.appendLog(jobId, request.getMessage(),
                request.getLevel(), request.getTimestamp()));
    }

    @PostMapping("/exceptions")
    public ResponseEntity<?> recordException(@PathVariable String jobId, @RequestBody JobError error) {
        return apply(jobId, () -> jobService.recordException(jobId, error));
    }

    @PostMapping("/results")
    public ResponseEntity<?> recordResult(@PathVariable String jobId, @RequestBody JobOutput output) {
        return apply(jobId, () -> jobService.recordResult(jobId, output));
    }

    private ResponseEntity<?> apply(String jobId, Supplier<Job> update) {
        try {
            Job job = update.get();
            return ResponseEntity.ok(responseMapper.toStatusResponse(job));
        } catch (InvalidJobFieldException e) {
            log.warn("Rejected runner update for job {}: {}", SecurityUtils.sanitizeForLogging(jobId), e.getMessage());
            return ApiErrors.invalidField(e);
        } catch (JobStateConflictException e) {
            log.warn("Conflicting runner update for job {}: {}", SecurityUtils.sanitizeForLogging(jobId), e.getMessage());
            return ApiErrors.conflict(e);
        } catch (JobNotFoundException e) {
            return ApiErrors.notFound(e);
        } catch (JobService.JobServiceException e) {
            log.error("Failed to update job {}: {}", SecurityUtils.sanitizeForLogging(jobId), e.getMessage());
            return ApiErrors.internalError("Failed to update job");
        }
    }
}
