package io.procjobs.backend.service;

import io.procjobs.backend.model.dto.ExecutionRequest;
import io.procjobs.backend.model.dto.JobCreateRequest;
import io.procjobs.backend.model.entity.Access;
import io.procjobs.backend.model.entity.InvalidJobFieldException;
import io.procjobs.backend.model.entity.Job;
import io.procjobs.backend.model.entity.JobStatus;
import io.procjobs.backend.model.execution.ExecutionModeDecision;
import io.procjobs.backend.model.execution.ExecutionOutcome;
import io.procjobs.backend.model.execution.ProcessDescription;
import io.procjobs.backend.model.query.Requester;
import io.procjobs.backend.service.exception.JobAccessDeniedException;
import io.procjobs.backend.service.exception.JobNotFoundException;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collection;

/**
 * Submits process executions: negotiates the execution mode, registers the job, hands it
 * to the runner and, for synchronous handling, waits a bounded time for it to finish.
 */
@Slf4j
@Service
public class JobExecutionService {

    private final ProcessCatalog processCatalog;
    private final ExecutionModeNegotiator negotiator;
    private final JobService jobService;
    private final JobDispatcher jobDispatcher;
    private final JobMetricsService metricsService;
    private final long pollIntervalMs;

    @Autowired
    public JobExecutionService(ProcessCatalog processCatalog,
                               ExecutionModeNegotiator negotiator,
                               JobService jobService,
                               JobDispatcher jobDispatcher,
                               JobMetricsService metricsService,
                               @Value("${app.execution.poll-interval-ms:500}") long pollIntervalMs) {
        this.processCatalog = processCatalog;
        this.negotiator = negotiator;
        this.jobService = jobService;
        this.jobDispatcher = jobDispatcher;
        this.metricsService = metricsService;
        this.pollIntervalMs = pollIntervalMs;
    }

    /**
     * Submits an execution of a process.
     *
     * @param providerId provider hosting the process, null for local processes
     * @param preferHeaders values of the {@code Prefer} headers
     * @throws io.procjobs.backend.service.exception.InvalidPreferenceException if a preference is malformed;
     *         no job is created in that case
     * @throws JobNotFoundException if the process is unknown
     */
    public ExecutionOutcome submit(String providerId, String processId, ExecutionRequest request,
                                   Collection<String> preferHeaders, Requester requester, String acceptLanguage) {
        ProcessDescription process = processCatalog.findProcess(providerId, processId)
                .orElseThrow(() -> JobNotFoundException.process(processId));
        if (process.getVisibility() == Access.PRIVATE && !requester.isAdmin()) {
            throw JobAccessDeniedException.process(processId, !requester.isAnonymous());
        }

        ExecutionModeDecision decision = negotiator.negotiate(process.getJobControlOptions(), preferHeaders);

        ExecutionRequest body = request != null ? request : new ExecutionRequest();
        Job job = jobService.createJob(JobCreateRequest.builder()
                .taskReference(jobDispatcher.newTaskReference())
                .processId(process.getId())
                .serviceId(process.getProviderId())
                .workflow(process.isWorkflow())
                .inputs(body.getInputs())
                .userId(requester.getUserId())
                .access(resolveAccess(body.getAccess(), requester))
                .executeAsync(!decision.isSync())
                .tags(body.getTags())
                .notificationContact(body.getNotificationEmail())
                .acceptLanguage(acceptLanguage)
                .build());

        try {
            jobDispatcher.dispatch(job);
        } catch (JobDispatcher.JobDispatchException e) {
            jobService.applyStatus(job.getId(), JobStatus.FAILED,
                    "Job could not be handed to a runner.", null);
            throw new JobService.JobServiceException("Failed to dispatch job " + job.getId(), e);
        }

        if (!decision.isSync()) {
            return new ExecutionOutcome(job, decision, false);
        }
        return awaitCompletion(job, decision);
    }

    /**
     * Polls the job until it finishes or the negotiated wait elapses.
     * An interrupt of the request thread ends the wait early.
     */
    ExecutionOutcome awaitCompletion(Job job, ExecutionModeDecision decision) {
        long started = System.nanoTime();
        long deadline = started + Duration.ofSeconds(decision.getWaitSeconds()).toNanos();
        Job current = job;
        while (!current.isFinished()) {
            long remainingMs = Duration.ofNanos(deadline - System.nanoTime()).toMillis();
            if (remainingMs <= 0) {
                break;
            }
            try {
                Thread.sleep(Math.min(pollIntervalMs, remainingMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Synchronous wait for job {} interrupted", job.getId());
                break;
            }
            current = jobService.findJob(job.getId());
        }

        boolean completed = current.isFinished();
        metricsService.recordSyncWait(Duration.ofNanos(System.nanoTime() - started), completed);
        if (!completed) {
            log.info("Job {} still {} after {}s, returning it as pending",
                    job.getId(), current.getStatus().getValue(), decision.getWaitSeconds());
        }
        return new ExecutionOutcome(current, decision, completed);
    }

    /**
     * Jobs of anonymous requesters default to public, otherwise nobody but admins could follow them.
     */
    private static Access resolveAccess(String requested, Requester requester) {
        if (requested == null || requested.isBlank()) {
            return requester.getUserId() == null ? Access.PUBLIC : Access.PRIVATE;
        }
        return Access.resolve(requested).orElseThrow(() -> new InvalidJobFieldException("access", requested));
    }
}
