package io.procjobs.backend.health;

import io.procjobs.backend.repository.JobStore;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobStoreHealthIndicatorTest {

    @Mock
    private JobStore jobStore;

    private JobStoreHealthIndicator healthIndicator;

    @BeforeEach
    void setUp() {
        healthIndicator = new JobStoreHealthIndicator(jobStore);
    }

    @Test
    void health_WhenStoreAnswersQuickly_ShouldReturnUpStatus() {
        // Arrange
        when(jobStore.count()).thenReturn(42L);

        // Act
        Health result = healthIndicator.health();

        // Assert
        assertEquals(Status.UP, result.getStatus());
        assertEquals(42L, result.getDetails().get("jobs"));
        assertTrue(result.getDetails().containsKey("response_time_ms"));
        assertTrue(result.getDetails().containsKey("store"));
    }

    @Test
    void health_WhenStoreAnswersSlowly_ShouldReturnWarningStatus() {
        // Arrange
        when(jobStore.count()).thenAnswer(invocation -> {
            Thread.sleep(200);
            return 1L;
        });

        // Act
        Health result = healthIndicator.health();

        // Assert
        assertEquals(new Status("WARNING"), result.getStatus());
    }

    @Test
    void health_WhenStoreFails_ShouldReturnDownStatus() {
        // Arrange
        when(jobStore.count()).thenThrow(new JobStore.JobStoreException("Failed to count jobs"));

        // Act
        Health result = healthIndicator.health();

        // Assert
        assertEquals(Status.DOWN, result.getStatus());
        assertEquals("Failed to count jobs", result.getDetails().get("error"));
    }
}
