package io.procjobs.backend.service;

import io.procjobs.backend.model.execution.ProcessDescription;

import java.util.Optional;

/**
 * Lookup of deployed processes and registered providers.
 */
public interface ProcessCatalog {

    /**
     * @param providerId remote provider, null for local processes
     * @param processId process identifier
     */
    Optional<ProcessDescription> findProcess(String providerId, String processId);

    boolean hasProvider(String providerId);
}
