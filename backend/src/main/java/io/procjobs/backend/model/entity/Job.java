package io.procjobs.backend.model.entity;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One invocation of a process and its evolving state.
 *
 * All mutations go through validating methods; an invalid assignment throws
 * {@link InvalidJobFieldException} and leaves the current value untouched.
 * Persisted through field access so that derived values (category, duration) are never stored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonAutoDetect(
        fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
public class Job {

    private String id;
    private String taskReference;
    private String processId;
    private String serviceId;
    private boolean workflow;

    private JobStatus status = JobStatus.ACCEPTED;
    private double progress;
    private String message;

    private Instant created;
    private Instant started;
    private Instant finished;

    private String userId;
    private Access access = Access.PRIVATE;

    private List<String> logs = new ArrayList<>();
    private List<JobError> exceptions = new ArrayList<>();
    private List<JobOutput> results = new ArrayList<>();
    private LinkedHashSet<String> tags = new LinkedHashSet<>();
    private Map<String, Object> inputs = new LinkedHashMap<>();

    private String notificationContact;
    private String acceptLanguage;
    private boolean executeAsync;
    private String contextCorrelationId;

    // for Jackson
    protected Job() {
    }

    public Job(String id, String taskReference, String processId, Instant created) {
        if (id == null || id.isBlank()) {
            throw new InvalidJobFieldException("id", id);
        }
        if (taskReference == null || taskReference.isBlank()) {
            throw new InvalidJobFieldException("taskReference", taskReference);
        }
        if (processId == null || processId.isBlank()) {
            throw new InvalidJobFieldException("processId", processId);
        }
        this.id = id;
        this.taskReference = taskReference.trim();
        this.processId = processId;
        this.created = created != null ? created : Instant.now();
    }

    /**
     * Moves the job to {@code newStatus}.
     * Entering running records {@code started} if missing, entering a terminal status records
     * {@code finished} once.
     *
     * @param newStatus target status
     * @param at timestamp of the change, current time when null
     * @return false when the job already had this status
     * @throws JobStateConflictException when the job is terminal and {@code newStatus} differs
     */
    public boolean updateStatus(JobStatus newStatus, Instant at) {
        if (newStatus == null) {
            throw new InvalidJobFieldException("status", null);
        }
        if (newStatus == status) {
            return false;
        }
        if (!status.canTransitionTo(newStatus)) {
            throw new JobStateConflictException(id, status, newStatus);
        }
        Instant timestamp = at != null ? at : Instant.now();
        if (newStatus == JobStatus.RUNNING && started == null) {
            started = timestamp;
        }
        if (newStatus.isTerminal() && finished == null) {
            finished = timestamp;
        }
        status = newStatus;
        return true;
    }

    /**
     * @return false when the value is unchanged
     */
    public boolean updateProgress(double value) {
        if (Double.isNaN(value) || value < 0 || value > 100) {
            throw new InvalidJobFieldException("progress", value);
        }
        if (Double.compare(progress, value) == 0) {
            return false;
        }
        progress = value;
        return true;
    }

    /**
     * Appends a formatted log line unless it repeats the last one.
     *
     * @return true when the line was appended
     */
    public boolean appendLog(String line) {
        if (line == null) {
            return false;
        }
        if (!logs.isEmpty() && logs.get(logs.size() - 1).equals(line)) {
            return false;
        }
        logs.add(line);
        return true;
    }

    public void addException(JobError error) {
        exceptions.add(Objects.requireNonNull(error, "error"));
    }

    public void addResult(JobOutput output) {
        results.add(Objects.requireNonNull(output, "output"));
    }

    /**
     * Drops recorded results that point at stored artifacts.
     *
     * @return the removed descriptors, to be purged by the caller
     */
    public List<JobOutput> clearArtifactResults() {
        List<JobOutput> removed = new ArrayList<>();
        results.removeIf(output -> {
            if (output.isArtifact()) {
                removed.add(output);
                return true;
            }
            return false;
        });
        return removed;
    }

    public void addTags(Collection<String> values) {
        if (values == null) {
            return;
        }
        for (String tag : values) {
            if (tag == null || tag.isBlank()) {
                throw new InvalidJobFieldException("tags", tag);
            }
            tags.add(tag.trim());
        }
    }

    public StatusCategory getStatusCategory() {
        return status.getCategory();
    }

    public boolean isFinished() {
        return status.isTerminal();
    }

    /**
     * Elapsed run time, measured up to {@code now} while the job has not finished.
     */
    public Duration getDuration(Instant now) {
        if (started == null) {
            return Duration.ZERO;
        }
        Instant end = finished != null ? finished : now;
        Duration duration = Duration.between(started, end);
        return duration.isNegative() ? Duration.ZERO : duration;
    }

    public Duration getDuration() {
        return getDuration(Instant.now());
    }

    public String getId() {
        return id;
    }

    public String getTaskReference() {
        return taskReference;
    }

    public String getProcessId() {
        return processId;
    }

    public String getServiceId() {
        return serviceId;
    }

    public void setServiceId(String serviceId) {
        this.serviceId = serviceId == null || serviceId.isBlank() ? null : serviceId;
    }

    public boolean isWorkflow() {
        return workflow;
    }

    public void setWorkflow(boolean workflow) {
        this.workflow = workflow;
    }

    public JobStatus getStatus() {
        return status;
    }

    public double getProgress() {
        return progress;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public Instant getCreated() {
        return created;
    }

    public Instant getStarted() {
        return started;
    }

    public Instant getFinished() {
        return finished;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public Access getAccess() {
        return access;
    }

    public void setAccess(Access access) {
        if (access == null) {
            throw new InvalidJobFieldException("access", null);
        }
        this.access = access;
    }

    public void setAccess(String access) {
        setAccess(Access.resolve(access).orElseThrow(() -> new InvalidJobFieldException("access", access)));
    }

    public List<String> getLogs() {
        return Collections.unmodifiableList(logs);
    }

    public List<JobError> getExceptions() {
        return Collections.unmodifiableList(exceptions);
    }

    public List<JobOutput> getResults() {
        return Collections.unmodifiableList(results);
    }

    public Set<String> getTags() {
        return Collections.unmodifiableSet(tags);
    }

    public Map<String, Object> getInputs() {
        return Collections.unmodifiableMap(inputs);
    }

    public void setInputs(Map<String, Object> inputs) {
        this.inputs = inputs != null ? new LinkedHashMap<>(inputs) : new LinkedHashMap<>();
    }

    public String getNotificationContact() {
        return notificationContact;
    }

    public void setNotificationContact(String notificationContact) {
        this.notificationContact = notificationContact;
    }

    public String getAcceptLanguage() {
        return acceptLanguage;
    }

    public void setAcceptLanguage(String acceptLanguage) {
        this.acceptLanguage = acceptLanguage;
    }

    public boolean isExecuteAsync() {
        return executeAsync;
    }

    public void setExecuteAsync(boolean executeAsync) {
        this.executeAsync = executeAsync;
    }

    public String getContextCorrelationId() {
        return contextCorrelationId;
    }

    public void setContextCorrelationId(String contextCorrelationId) {
        this.contextCorrelationId = contextCorrelationId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Job)) {
            return false;
        }
        return Objects.equals(id, ((Job) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "Job{id=" + id + ", process=" + processId + ", service=" + serviceId
                + ", status=" + status.getValue() + ", progress=" + progress + "}";
    }
}
