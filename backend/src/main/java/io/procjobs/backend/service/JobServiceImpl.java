package io.procjobs.backend.service;

import io.procjobs.backend.model.dto.JobCreateRequest;
import io.procjobs.backend.model.entity.Access;
import io.procjobs.backend.model.entity.InvalidJobFieldException;
import io.procjobs.backend.model.entity.Job;
import io.procjobs.backend.model.entity.JobError;
import io.procjobs.backend.model.entity.JobOutput;
import io.procjobs.backend.model.entity.JobStatus;
import io.procjobs.backend.model.execution.ExecutionMode;
import io.procjobs.backend.model.query.Requester;
import io.procjobs.backend.repository.JobStore;
import io.procjobs.backend.service.exception.JobAccessDeniedException;
import io.procjobs.backend.service.exception.JobNotFoundException;
import io.procjobs.backend.util.JobLogFormatter;
import io.procjobs.backend.util.SecurityUtils;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Job lifecycle on top of a {@link JobStore}.
 */
@Slf4j
@Service
public class JobServiceImpl implements JobService {

    static final String DISMISSED_MESSAGE = "Job dismissed.";

    private static final String LEVEL_INFO = "INFO";
    private static final String LEVEL_WARNING = "WARNING";
    private static final String LEVEL_ERROR = "ERROR";

    private final JobStore jobStore;
    private final JobDispatcher jobDispatcher;
    private final NotificationContactEncoder notificationContactEncoder;
    private final JobMetricsService metricsService;
    private final Clock clock;

    @Autowired
    public JobServiceImpl(JobStore jobStore,
                          JobDispatcher jobDispatcher,
                          NotificationContactEncoder notificationContactEncoder,
                          JobMetricsService metricsService,
                          Clock clock) {
        this.jobStore = jobStore;
        this.jobDispatcher = jobDispatcher;
        this.notificationContactEncoder = notificationContactEncoder;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    @Override
    public Job createJob(JobCreateRequest request) {
        Objects.requireNonNull(request, "request");
        Instant created = request.getCreated() != null ? request.getCreated() : clock.instant();

        Job job = new Job(UUID.randomUUID().toString(), request.getTaskReference(), request.getProcessId(), created);
        job.setServiceId(request.getServiceId());
        job.setWorkflow(request.isWorkflow());
        job.setInputs(request.getInputs());
        job.setUserId(request.getUserId());
        if (request.getAccess() != null) {
            job.setAccess(request.getAccess());
        }
        job.setExecuteAsync(request.isExecuteAsync());
        job.setNotificationContact(notificationContactEncoder.encode(request.getNotificationContact()));
        job.setAcceptLanguage(request.getAcceptLanguage());
        job.setContextCorrelationId(request.getContextCorrelationId());

        if (request.getTags() != null) {
            for (String tag : request.getTags()) {
                if (Access.isAccessValue(tag)) {
                    throw new InvalidJobFieldException("tags", tag);
                }
            }
            job.addTags(request.getTags());
        }
        job.addTags(List.of(
                request.isWorkflow() ? "workflow" : "application",
                request.isExecuteAsync() ? ExecutionMode.ASYNC.getValue() : ExecutionMode.SYNC.getValue()));

        job.setMessage("Job task submitted for execution.");
        job.appendLog(JobLogFormatter.formatLine(job, job.getMessage(), LEVEL_INFO, created));

        persist(job, "create");
        metricsService.recordJobCreated(request.isExecuteAsync() ? ExecutionMode.ASYNC : ExecutionMode.SYNC);
        log.info("Created job {} for process {} (task {}, user {})", job.getId(),
                SecurityUtils.sanitizeForLogging(job.getProcessId()), job.getTaskReference(), job.getUserId());
        return job;
    }

    @Override
    public Job getJob(String jobId, Requester requester) {
        Job job = findJob(jobId);
        checkVisible(job, requester);
        return job;
    }

    @Override
    public Job findJob(String jobId) {
        try {
            return jobStore.findById(jobId).orElseThrow(() -> JobNotFoundException.job(jobId));
        } catch (JobStore.JobStoreException e) {
            log.error("Failed to load job {}: {}", SecurityUtils.sanitizeForLogging(jobId), e.getMessage());
            throw new JobServiceException("Failed to load job " + jobId, e);
        }
    }

    @Override
    public Job applyStatus(String jobId, JobStatus status, String message, Instant timestamp) {
        return update(jobId, "status", job -> {
            Instant at = timestamp != null ? timestamp : clock.instant();
            JobStatus previous = job.getStatus();
            if (!job.updateStatus(status, at)) {
                if (job.isFinished() || message == null || message.equals(job.getMessage())) {
                    log.debug("Job {} already {}, status update ignored", job.getId(), status.getValue());
                    return false;
                }
                job.setMessage(message);
                job.appendLog(JobLogFormatter.formatLine(job, message, LEVEL_INFO, at));
                return true;
            }
            if (message != null) {
                job.setMessage(message);
            }
            String line = message != null ? message : "Job " + status.getValue() + ".";
            job.appendLog(JobLogFormatter.formatLine(job, line, status == JobStatus.FAILED ? LEVEL_ERROR : LEVEL_INFO, at));
            metricsService.recordStatusChange(status);
            log.info("Job {} moved from {} to {}", job.getId(), previous.getValue(), status.getValue());
            return true;
        });
    }

    @Override
    public Job applyProgress(String jobId, double progress, String message) {
        return update(jobId, "progress", job -> {
            boolean changed = job.updateProgress(progress);
            if (message != null && !message.equals(job.getMessage())) {
                job.setMessage(message);
                changed = true;
            }
            if (changed) {
                job.appendLog(JobLogFormatter.formatLine(job, job.getMessage(), LEVEL_INFO, clock.instant()));
            }
            return changed;
        });
    }

    @Override
    public Job appendLog(String jobId, String message, String level, Instant timestamp) {
        return update(jobId, "log", job -> job.appendLog(JobLogFormatter.formatLine(
                job, message, level, timestamp != null ? timestamp : clock.instant())));
    }

    @Override
    public Job recordException(String jobId, JobError error) {
        if (error == null) {
            throw new InvalidJobFieldException("exceptions", null);
        }
        return update(jobId, "exception", job -> {
            job.addException(error);
            String line = error.getText() + " - code=" + error.getCode() + " - locator=" + error.getLocator();
            job.appendLog(JobLogFormatter.formatLine(job, line, LEVEL_ERROR, clock.instant()));
            return true;
        });
    }

    @Override
    public Job recordResult(String jobId, JobOutput output) {
        if (output == null) {
            throw new InvalidJobFieldException("results", null);
        }
        return update(jobId, "result", job -> {
            job.addResult(output);
            return true;
        });
    }

    @Override
    public Job dismissJob(String jobId, Requester requester) {
        Job job = findJob(jobId);
        checkModifiable(job, requester);
        return dismiss(job);
    }

    @Override
    public List<String> dismissJobs(Collection<String> jobIds, Requester requester) {
        List<Job> found = new ArrayList<>();
        for (String jobId : jobIds) {
            try {
                Job job = findJob(jobId);
                checkModifiable(job, requester);
                found.add(job);
            } catch (JobNotFoundException e) {
                log.debug("Skipping unknown job {} in batch dismiss", SecurityUtils.sanitizeForLogging(jobId));
            }
        }

        List<String> dismissed = new ArrayList<>(found.size());
        for (Job job : found) {
            dismiss(job);
            dismissed.add(job.getId());
        }
        log.info("Batch dismiss requested for {} jobs, {} dismissed", jobIds.size(), dismissed.size());
        return dismissed;
    }

    @Override
    public boolean deleteJob(String jobId, Requester requester) {
        Job job = findJob(jobId);
        checkModifiable(job, requester);
        if (!job.isFinished()) {
            signal("cancel", job, () -> jobDispatcher.cancel(job));
        }
        boolean removed;
        try {
            removed = jobStore.delete(jobId);
        } catch (JobStore.JobStoreException e) {
            log.error("Failed to delete job {}: {}", jobId, e.getMessage());
            throw new JobServiceException("Failed to delete job " + jobId, e);
        }
        if (!removed) {
            throw JobNotFoundException.job(jobId);
        }
        log.info("Deleted job {}", jobId);
        return true;
    }

    private Job dismiss(Job job) {
        if (job.getStatus() == JobStatus.DISMISSED) {
            log.debug("Job {} already dismissed", job.getId());
            return job;
        }
        Instant now = clock.instant();
        boolean changed = false;
        if (!job.isFinished()) {
            signal("cancel", job, () -> jobDispatcher.cancel(job));
            job.updateStatus(JobStatus.DISMISSED, now);
            job.setMessage(DISMISSED_MESSAGE);
            job.appendLog(JobLogFormatter.formatLine(job, DISMISSED_MESSAGE, LEVEL_WARNING, now));
            metricsService.recordDismissed();
            changed = true;
        }
        List<JobOutput> artifacts = job.clearArtifactResults();
        if (!artifacts.isEmpty()) {
            signal("purge", job, () -> jobDispatcher.purgeArtifacts(job, artifacts));
            changed = true;
        }
        if (changed) {
            persist(job, "dismiss");
            log.info("Dismissed job {} ({} artifacts released)", job.getId(), artifacts.size());
        }
        return job;
    }

    private Job update(String jobId, String operation, Predicate<Job> mutation) {
        Job job = findJob(jobId);
        if (mutation.test(job)) {
            persist(job, operation);
        }
        return job;
    }

    private void persist(Job job, String operation) {
        try {
            jobStore.save(job);
        } catch (JobStore.JobStoreException e) {
            log.error("Failed to store job {} after {}: {}", job.getId(), operation, e.getMessage());
            throw new JobServiceException("Failed to store job " + job.getId(), e);
        }
    }

    private void signal(String action, Job job, Runnable signal) {
        try {
            signal.run();
        } catch (JobDispatcher.JobDispatchException e) {
            log.warn("Could not send {} signal for job {}: {}", action, job.getId(), e.getMessage());
        }
    }

    private static void checkVisible(Job job, Requester requester) {
        if (job.getAccess() == Access.PUBLIC || requester.isAdmin() || requester.owns(job.getUserId())) {
            return;
        }
        throw JobAccessDeniedException.job(job.getId(), !requester.isAnonymous());
    }

    /**
     * Only the owner or an admin may dismiss or delete a job; jobs submitted without an owner
     * can only be modified by admins.
     */
    private static void checkModifiable(Job job, Requester requester) {
        checkVisible(job, requester);
        if (requester.isAdmin() || requester.owns(job.getUserId())) {
            return;
        }
        throw JobAccessDeniedException.job(job.getId(), !requester.isAnonymous());
    }
}
