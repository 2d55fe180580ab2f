package io.procjobs.backend.service.exception;

/**
 * A private job or process exists but the requester may not see or modify it.
 * {@code authenticated} tells unauthorized (anonymous caller) apart from forbidden.
 */
public class JobAccessDeniedException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;
    private final boolean authenticated;

    public JobAccessDeniedException(String resourceType, String resourceId, boolean authenticated) {
        super(authenticated
                ? "Access to " + resourceType + " " + resourceId + " is forbidden"
                : "Authentication is required to access " + resourceType + " " + resourceId);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
        this.authenticated = authenticated;
    }

    public static JobAccessDeniedException job(String jobId, boolean authenticated) {
        return new JobAccessDeniedException("job", jobId, authenticated);
    }

    public static JobAccessDeniedException process(String processId, boolean authenticated) {
        return new JobAccessDeniedException("process", processId, authenticated);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }

    public boolean isAuthenticated() {
        return authenticated;
    }
}
