package io.procjobs.backend.controller;

import io.procjobs.backend.model.dto.ExecutionRequest;
import io.procjobs.backend.model.dto.JobStatusResponse;
import io.procjobs.backend.model.entity.InvalidJobFieldException;
import io.procjobs.backend.model.execution.ExecutionOutcome;
import io.procjobs.backend.model.query.Requester;
import io.procjobs.backend.service.JobExecutionService;
import io.procjobs.backend.service.JobLinkBuilder;
import io.procjobs.backend.service.JobMetricsService;
import io.procjobs.backend.service.JobResponseMapper;
import io.procjobs.backend.service.JobService;
import io.procjobs.backend.service.exception.InvalidPreferenceException;
import io.procjobs.backend.service.exception.JobAccessDeniedException;
import io.procjobs.backend.service.exception.JobNotFoundException;
import io.procjobs.backend.util.RequesterResolver;
import io.procjobs.backend.util.SecurityUtils;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.List;

/**
 * Process execution endpoints. The {@code Prefer} header selects synchronous or asynchronous
 * handling within what the process supports.
 */
@Slf4j
@RestController
public class ExecutionController {

    private static final String PREFER = "Prefer";

    private final JobExecutionService executionService;
    private final JobResponseMapper responseMapper;
    private final JobLinkBuilder linkBuilder;
    private final RequesterResolver requesterResolver;
    private final JobMetricsService metricsService;

    @Autowired
    public ExecutionController(JobExecutionService executionService,
                               JobResponseMapper responseMapper,
                               JobLinkBuilder linkBuilder,
                               RequesterResolver requesterResolver,
                               JobMetricsService metricsService) {
        this.executionService = executionService;
        this.responseMapper = responseMapper;
        this.linkBuilder = linkBuilder;
        this.requesterResolver = requesterResolver;
        this.metricsService = metricsService;
    }

    @PostMapping("/processes/{processId}/execution")
    public ResponseEntity<?> execute(@AuthenticationPrincipal Jwt jwt,
                                     @PathVariable String processId,
                                     @RequestHeader HttpHeaders headers,
                                     @Valid @RequestBody(required = false) ExecutionRequest request) {
        return submit(jwt, null, processId, headers, request);
    }

    @PostMapping("/providers/{providerId}/processes/{processId}/execution")
    public ResponseEntity<?> executeOnProvider(@AuthenticationPrincipal Jwt jwt,
                                               @PathVariable String providerId,
                                               @PathVariable String processId,
                                               @RequestHeader HttpHeaders headers,
                                               @Valid @RequestBody(required = false) ExecutionRequest request) {
        return submit(jwt, providerId, processId, headers, request);
    }

    private ResponseEntity<?> submit(Jwt jwt, String providerId, String processId,
                                     HttpHeaders headers, ExecutionRequest request) {
        Requester requester = requesterResolver.resolve(jwt);
        // raw values, a Prefer list must not be split on its commas before parsing
        List<String> preferHeaders = headers.getOrEmpty(PREFER);
        String acceptLanguage = headers.getFirst(HttpHeaders.ACCEPT_LANGUAGE);

        try {
            ExecutionOutcome outcome = executionService.submit(providerId, processId, request,
                    preferHeaders, requester, acceptLanguage);
            JobStatusResponse body = responseMapper.toStatusResponse(outcome.getJob());

            ResponseEntity.BodyBuilder response = outcome.isCompleted()
                    ? ResponseEntity.ok()
                    : ResponseEntity.status(HttpStatus.CREATED)
                            .location(URI.create(linkBuilder.jobUrl(outcome.getJob().getId())));
            outcome.getDecision().getAppliedPreferenceHeaders()
                    .forEach((name, value) -> response.header(name, value));

            log.info("Job {} submitted for process {} ({}, completed={})", outcome.getJob().getId(),
                    SecurityUtils.sanitizeForLogging(processId),
                    outcome.getDecision().getMode().getValue(), outcome.isCompleted());
            return response.body(body);

        } catch (InvalidPreferenceException e) {
            log.info("Rejected execution of {}: {}", SecurityUtils.sanitizeForLogging(processId), e.getMessage());
            metricsService.recordRejectedRequest("invalid_preference");
            return ApiErrors.invalidPreference(e);
        } catch (InvalidJobFieldException e) {
            metricsService.recordRejectedRequest("invalid_field");
            return ApiErrors.invalidField(e);
        } catch (JobNotFoundException e) {
            return ApiErrors.notFound(e);
        } catch (JobAccessDeniedException e) {
            return ApiErrors.accessDenied(e);
        } catch (JobService.JobServiceException e) {
            log.error("Failed to submit execution of {}: {}", SecurityUtils.sanitizeForLogging(processId),
                    e.getMessage(), e);
            return ApiErrors.internalError("Failed to submit the execution");
        }
    }
}
