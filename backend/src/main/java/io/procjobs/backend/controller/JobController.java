package io.procjobs.backend.controller;

import io.procjobs.backend.model.dto.BatchDismissRequest;
import io.procjobs.backend.model.dto.BatchDismissResponse;
import io.procjobs.backend.model.dto.JobListResponse;
import io.procjobs.backend.model.entity.Job;
import io.procjobs.backend.model.entity.JobStatus;
import io.procjobs.backend.model.query.JobListContext;
import io.procjobs.backend.model.query.JobQuery;
import io.procjobs.backend.model.query.JobQueryResult;
import io.procjobs.backend.model.query.Requester;
import io.procjobs.backend.service.JobMetricsService;
import io.procjobs.backend.service.JobQueryParser;
import io.procjobs.backend.service.JobQueryService;
import io.procjobs.backend.service.JobResponseMapper;
import io.procjobs.backend.service.JobService;
import io.procjobs.backend.service.exception.InvalidJobQueryException;
import io.procjobs.backend.service.exception.JobAccessDeniedException;
import io.procjobs.backend.service.exception.JobNotFoundException;
import io.procjobs.backend.util.RequesterResolver;
import io.procjobs.backend.util.SecurityUtils;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.function.Function;

/**
 * Job listings, job status and job sub-resources, plus dismissal and deletion.
 *
 * Listings exist on the global collection and on process and provider collections;
 * all of them accept the same filter parameters.
 */
@Slf4j
@RestController
public class JobController {

    private final JobService jobService;
    private final JobQueryService jobQueryService;
    private final JobQueryParser jobQueryParser;
    private final JobResponseMapper responseMapper;
    private final RequesterResolver requesterResolver;
    private final JobMetricsService metricsService;

    @Autowired
    public JobController(JobService jobService,
                         JobQueryService jobQueryService,
                         JobQueryParser jobQueryParser,
                         JobResponseMapper responseMapper,
                         RequesterResolver requesterResolver,
                         JobMetricsService metricsService) {
        this.jobService = jobService;
        this.jobQueryService = jobQueryService;
        this.jobQueryParser = jobQueryParser;
        this.responseMapper = responseMapper;
        this.requesterResolver = requesterResolver;
        this.metricsService = metricsService;
    }

    @GetMapping("/jobs")
    public ResponseEntity<?> listJobs(@AuthenticationPrincipal Jwt jwt,
                                      @RequestParam MultiValueMap<String, String> parameters) {
        return list(JobListContext.global(), parameters, jwt);
    }

    @GetMapping("/processes/{processId}/jobs")
    public ResponseEntity<?> listProcessJobs(@AuthenticationPrincipal Jwt jwt,
                                             @PathVariable String processId,
                                             @RequestParam MultiValueMap<String, String> parameters) {
        return list(JobListContext.process(processId), parameters, jwt);
    }

    @GetMapping("/providers/{providerId}/jobs")
    public ResponseEntity<?> listProviderJobs(@AuthenticationPrincipal Jwt jwt,
                                              @PathVariable String providerId,
                                              @RequestParam MultiValueMap<String, String> parameters) {
        return list(JobListContext.provider(providerId), parameters, jwt);
    }

    @GetMapping("/providers/{providerId}/processes/{processId}/jobs")
    public ResponseEntity<?> listProviderProcessJobs(@AuthenticationPrincipal Jwt jwt,
                                                     @PathVariable String providerId,
                                                     @PathVariable String processId,
                                                     @RequestParam MultiValueMap<String, String> parameters) {
        return list(JobListContext.providerProcess(providerId, processId), parameters, jwt);
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<?> getJob(@AuthenticationPrincipal Jwt jwt, @PathVariable String jobId) {
        return withJob(jwt, jobId, null, null, job -> ResponseEntity.ok(responseMapper.toStatusResponse(job)));
    }

    @GetMapping("/processes/{processId}/jobs/{jobId}")
    public ResponseEntity<?> getProcessJob(@AuthenticationPrincipal Jwt jwt,
                                           @PathVariable String processId,
                                           @PathVariable String jobId) {
        return withJob(jwt, jobId, null, processId, job -> ResponseEntity.ok(responseMapper.toStatusResponse(job)));
    }

    @GetMapping("/providers/{providerId}/processes/{processId}/jobs/{jobId}")
    public ResponseEntity<?> getProviderJob(@AuthenticationPrincipal Jwt jwt,
                                            @PathVariable String providerId,
                                            @PathVariable String processId,
                                            @PathVariable String jobId) {
        return withJob(jwt, jobId, providerId, processId, job -> ResponseEntity.ok(responseMapper.toStatusResponse(job)));
    }

    @GetMapping("/jobs/{jobId}/logs")
    public ResponseEntity<?> getJobLogs(@AuthenticationPrincipal Jwt jwt, @PathVariable String jobId) {
        return withJob(jwt, jobId, null, null, job -> ResponseEntity.ok(job.getLogs()));
    }

    @GetMapping("/jobs/{jobId}/exceptions")
    public ResponseEntity<?> getJobExceptions(@AuthenticationPrincipal Jwt jwt, @PathVariable String jobId) {
        return withJob(jwt, jobId, null, null, job -> ResponseEntity.ok(job.getExceptions()));
    }

    @GetMapping({"/jobs/{jobId}/results", "/jobs/{jobId}/outputs"})
    public ResponseEntity<?> getJobResults(@AuthenticationPrincipal Jwt jwt, @PathVariable String jobId) {
        return withJob(jwt, jobId, null, null, job -> {
            if (job.getStatus() != JobStatus.SUCCEEDED) {
                return ApiErrors.notFound("ResultsNotReady",
                        "Job " + job.getId() + " is " + job.getStatus().getValue() + ", results are not available", job.getId());
            }
            return ResponseEntity.ok(job.getResults());
        });
    }

    @GetMapping("/jobs/{jobId}/inputs")
    public ResponseEntity<?> getJobInputs(@AuthenticationPrincipal Jwt jwt, @PathVariable String jobId) {
        return withJob(jwt, jobId, null, null, job -> ResponseEntity.ok(job.getInputs()));
    }

    /**
     * Dismisses a job, or removes it for good with {@code purge=true}.
     */
    @DeleteMapping("/jobs/{jobId}")
    public ResponseEntity<?> dismissJob(@AuthenticationPrincipal Jwt jwt,
                                        @PathVariable String jobId,
                                        @RequestParam(value = "purge", defaultValue = "false") boolean purge) {
        Requester requester = requesterResolver.resolve(jwt);
        try {
            if (purge) {
                jobService.deleteJob(jobId, requester);
                return ResponseEntity.noContent().build();
            }
            Job job = jobService.dismissJob(jobId, requester);
            return ResponseEntity.ok(responseMapper.toStatusResponse(job));
        } catch (JobNotFoundException e) {
            return ApiErrors.notFound(e);
        } catch (JobAccessDeniedException e) {
            log.warn("Denied dismissal of job {} for user {}", SecurityUtils.sanitizeForLogging(jobId), requester.getUserId());
            return ApiErrors.accessDenied(e);
        } catch (JobService.JobServiceException e) {
            log.error("Failed to dismiss job {}: {}", SecurityUtils.sanitizeForLogging(jobId), e.getMessage());
            return ApiErrors.internalError("Failed to dismiss job");
        }
    }

    @DeleteMapping("/jobs")
    public ResponseEntity<?> dismissJobs(@AuthenticationPrincipal Jwt jwt,
                                         @Valid @RequestBody BatchDismissRequest request) {
        Requester requester = requesterResolver.resolve(jwt);
        try {
            List<String> dismissed = jobService.dismissJobs(request.getJobs(), requester);
            return ResponseEntity.ok(BatchDismissResponse.builder()
                    .jobs(dismissed)
                    .message("Successfully dismissed " + dismissed.size() + " jobs.")
                    .build());
        } catch (JobAccessDeniedException e) {
            return ApiErrors.accessDenied(e);
        } catch (JobService.JobServiceException e) {
            log.error("Failed to dismiss jobs for user {}: {}", requester.getUserId(), e.getMessage());
            return ApiErrors.internalError("Failed to dismiss jobs");
        }
    }

    private ResponseEntity<?> list(JobListContext context, MultiValueMap<String, String> parameters, Jwt jwt) {
        Requester requester = requesterResolver.resolve(jwt);
        try {
            JobQuery query = jobQueryParser.parse(parameters, context);
            JobQueryResult result = jobQueryService.findJobs(query, context, requester);
            JobListResponse response = responseMapper.toListResponse(context, query, result);
            return ResponseEntity.ok(response);
        } catch (InvalidJobQueryException e) {
            log.info("Rejected job listing on {}: {} ({}={})", context.getJobsPath(), e.getMessage(),
                    e.getField(), SecurityUtils.sanitizeForLogging(e.getRawValue()));
            metricsService.recordRejectedRequest("invalid_query");
            return ApiErrors.invalidQuery(e);
        } catch (JobNotFoundException e) {
            return ApiErrors.notFound(e);
        } catch (JobAccessDeniedException e) {
            return ApiErrors.accessDenied(e);
        } catch (JobService.JobServiceException e) {
            log.error("Failed to list jobs on {}: {}", context.getJobsPath(), e.getMessage());
            return ApiErrors.internalError("Failed to list jobs");
        }
    }

    /**
     * Loads a visible job, checking that it belongs to the given provider and process when
     * requested through a scoped path, and renders it with {@code renderer}.
     */
    private ResponseEntity<?> withJob(Jwt jwt, String jobId, String providerId, String processId,
                                      Function<Job, ResponseEntity<?>> renderer) {
        Requester requester = requesterResolver.resolve(jwt);
        try {
            Job job = jobService.getJob(jobId, requester);
            if (processId != null && !processId.equals(job.getProcessId())) {
                throw JobNotFoundException.job(jobId);
            }
            if (providerId != null && !providerId.equals(job.getServiceId())) {
                throw JobNotFoundException.job(jobId);
            }
            return renderer.apply(job);
        } catch (JobNotFoundException e) {
            return ApiErrors.notFound(e);
        } catch (JobAccessDeniedException e) {
            log.info("Denied access to job {} for {}", SecurityUtils.sanitizeForLogging(jobId),
                    requester.isAnonymous() ? "anonymous requester" : requester.getUserId());
            return ApiErrors.accessDenied(e);
        } catch (JobService.JobServiceException e) {
            log.error("Failed to load job {}: {}", SecurityUtils.sanitizeForLogging(jobId), e.getMessage());
            return ApiErrors.internalError("Failed to load job");
        }
    }
}
