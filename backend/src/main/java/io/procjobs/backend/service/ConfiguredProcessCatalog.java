package io.procjobs.backend.service;

import io.procjobs.backend.config.ProcessCatalogProperties;
import io.procjobs.backend.model.entity.Access;
import io.procjobs.backend.model.execution.ExecutionControlOption;
import io.procjobs.backend.model.execution.ProcessDescription;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process catalog built from {@code app.catalog.*} properties at startup.
 */
@Slf4j
@Service
public class ConfiguredProcessCatalog implements ProcessCatalog {

    private final Map<String, ProcessDescription> processes = new ConcurrentHashMap<>();
    private final Set<String> providers = ConcurrentHashMap.newKeySet();

    @Autowired
    public ConfiguredProcessCatalog(ProcessCatalogProperties properties) {
        providers.addAll(properties.getProviders());
        for (ProcessCatalogProperties.ProcessEntry entry : properties.getProcesses()) {
            register(toDescription(entry));
        }
        log.info("Process catalog loaded with {} processes and {} providers", processes.size(), providers.size());
    }

    public void register(ProcessDescription description) {
        Objects.requireNonNull(description.getId(), "process id");
        if (description.getProviderId() != null) {
            providers.add(description.getProviderId());
        }
        processes.put(key(description.getProviderId(), description.getId()), description);
    }

    @Override
    public Optional<ProcessDescription> findProcess(String providerId, String processId) {
        return Optional.ofNullable(processes.get(key(providerId, processId)));
    }

    @Override
    public boolean hasProvider(String providerId) {
        return providerId != null && providers.contains(providerId);
    }

    private static ProcessDescription toDescription(ProcessCatalogProperties.ProcessEntry entry) {
        Set<ExecutionControlOption> options = null;
        if (entry.getJobControlOptions() != null) {
            options = EnumSet.noneOf(ExecutionControlOption.class);
            for (String option : entry.getJobControlOptions()) {
                options.add(ExecutionControlOption.fromValue(option));
            }
        }
        String provider = entry.getProvider() == null || entry.getProvider().isBlank() ? null : entry.getProvider();
        return ProcessDescription.builder()
                .id(entry.getId())
                .providerId(provider)
                .title(entry.getTitle())
                .workflow(entry.isWorkflow())
                .jobControlOptions(options)
                .visibility(Access.fromValue(entry.getVisibility()))
                .executionUnit(entry.getExecutionUnit())
                .build();
    }

    private static String key(String providerId, String processId) {
        return (providerId == null ? "" : providerId) + "/" + processId;
    }
}
