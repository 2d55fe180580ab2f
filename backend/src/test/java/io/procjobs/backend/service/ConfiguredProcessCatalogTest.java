package io.procjobs.backend.service;

import io.procjobs.backend.config.ProcessCatalogProperties;
import io.procjobs.backend.model.entity.Access;
import io.procjobs.backend.model.entity.InvalidJobFieldException;
import io.procjobs.backend.model.execution.ExecutionControlOption;
import io.procjobs.backend.model.execution.ProcessDescription;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfiguredProcessCatalogTest {

    @Test
    void findProcess_ShouldSeparateLocalAndProviderProcesses() {
        // Given
        ProcessCatalogProperties properties = new ProcessCatalogProperties();
        properties.getProcesses().add(entry("ndvi", null, List.of("async-execute"), "public"));
        properties.getProcesses().add(entry("subset", "hummingbird", null, "private"));

        // When
        ConfiguredProcessCatalog catalog = new ConfiguredProcessCatalog(properties);

        // Then
        ProcessDescription ndvi = catalog.findProcess(null, "ndvi").orElseThrow();
        assertThat(ndvi.getJobControlOptions()).containsExactly(ExecutionControlOption.ASYNC_EXECUTE);
        assertThat(ndvi.getVisibility()).isEqualTo(Access.PUBLIC);

        ProcessDescription subset = catalog.findProcess("hummingbird", "subset").orElseThrow();
        assertThat(subset.getJobControlOptions()).isNull();
        assertThat(subset.getVisibility()).isEqualTo(Access.PRIVATE);

        assertThat(catalog.findProcess(null, "subset")).isEmpty();
        assertThat(catalog.hasProvider("hummingbird")).isTrue();
        assertThat(catalog.hasProvider("crim")).isFalse();
        assertThat(catalog.hasProvider(null)).isFalse();
    }

    @Test
    void constructor_InvalidVisibility_ShouldFail() {
        ProcessCatalogProperties properties = new ProcessCatalogProperties();
        properties.getProcesses().add(entry("ndvi", null, null, "secret"));

        assertThatThrownBy(() -> new ConfiguredProcessCatalog(properties))
                .isInstanceOf(InvalidJobFieldException.class);
    }

    private static ProcessCatalogProperties.ProcessEntry entry(String id, String provider,
                                                               List<String> options, String visibility) {
        ProcessCatalogProperties.ProcessEntry entry = new ProcessCatalogProperties.ProcessEntry();
        entry.setId(id);
        entry.setProvider(provider);
        entry.setJobControlOptions(options);
        entry.setVisibility(visibility);
        return entry;
    }
}
