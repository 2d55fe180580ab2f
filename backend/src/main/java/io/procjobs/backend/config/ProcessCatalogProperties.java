package io.procjobs.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Processes and providers known to this instance.
 *
 * <pre>
 * app.catalog.providers[0]=hummingbird
 * app.catalog.processes[0].id=ndvi
 * app.catalog.processes[0].job-control-options=async-execute,sync-execute
 * app.catalog.processes[0].visibility=public
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "app.catalog")
@Data
public class ProcessCatalogProperties {

    private List<String> providers = new ArrayList<>();

    private List<ProcessEntry> processes = new ArrayList<>();

    @Data
    public static class ProcessEntry {

        private String id;

        /**
         * Provider hosting the process, empty for local processes.
         */
        private String provider;

        private String title;

        private boolean workflow = false;

        /**
         * Declared job control options; leave unset to accept both execution modes.
         */
        private List<String> jobControlOptions;

        private String visibility = "public";

        private String executionUnit;
    }
}
