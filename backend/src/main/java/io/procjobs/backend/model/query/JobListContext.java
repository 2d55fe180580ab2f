package io.procjobs.backend.model.query;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Collection a listing was requested on: the global {@code /jobs}, a process's jobs
 * or a provider's jobs (optionally narrowed to one of its processes).
 */
@Value
public class JobListContext {

    private static final JobListContext GLOBAL = new JobListContext(null, null);

    String providerId;
    String processId;

    public static JobListContext global() {
        return GLOBAL;
    }

    public static JobListContext process(String processId) {
        return new JobListContext(null, processId);
    }

    public static JobListContext provider(String providerId) {
        return new JobListContext(providerId, null);
    }

    public static JobListContext providerProcess(String providerId, String processId) {
        return new JobListContext(providerId, processId);
    }

    public boolean isScoped() {
        return providerId != null || processId != null;
    }

    /**
     * Unencoded path segments of the parent resource, empty for the global collection.
     */
    public List<String> getParentSegments() {
        List<String> segments = new ArrayList<>(4);
        if (providerId != null) {
            segments.add("providers");
            segments.add(providerId);
        }
        if (processId != null) {
            segments.add("processes");
            segments.add(processId);
        }
        return segments;
    }

    /**
     * Unencoded segments of the job collection this context designates.
     */
    public List<String> getJobsSegments() {
        List<String> segments = getParentSegments();
        segments.add("jobs");
        return segments;
    }

    /**
     * Path of the job collection, for log messages.
     */
    public String getJobsPath() {
        return "/" + String.join("/", getJobsSegments());
    }
}
