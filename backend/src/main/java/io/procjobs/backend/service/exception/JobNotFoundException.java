package io.procjobs.backend.service.exception;

/**
 * Unknown job, process or provider reference.
 */
public class JobNotFoundException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;

    public JobNotFoundException(String resourceType, String resourceId) {
        super(capitalize(resourceType) + " " + resourceId + " could not be found");
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public static JobNotFoundException job(String jobId) {
        return new JobNotFoundException("job", jobId);
    }

    public static JobNotFoundException process(String processId) {
        return new JobNotFoundException("process", processId);
    }

    public static JobNotFoundException provider(String providerId) {
        return new JobNotFoundException("provider", providerId);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }

    private static String capitalize(String value) {
        return value.isEmpty() ? value : Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
