package io.procjobs.backend.controller;

import io.procjobs.backend.config.JobConfig;
import io.procjobs.backend.config.SecurityConfig;
import io.procjobs.backend.model.entity.Job;
import io.procjobs.backend.model.entity.JobStatus;
import io.procjobs.backend.model.execution.ExecutionModeDecision;
import io.procjobs.backend.model.execution.ExecutionOutcome;
import io.procjobs.backend.model.query.Requester;
import io.procjobs.backend.service.JobExecutionService;
import io.procjobs.backend.service.JobLinkBuilder;
import io.procjobs.backend.service.JobMetricsService;
import io.procjobs.backend.service.JobResponseMapper;
import io.procjobs.backend.service.exception.InvalidPreferenceException;
import io.procjobs.backend.service.exception.JobNotFoundException;
import io.procjobs.backend.util.RequesterResolver;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.hasItem;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Test class for ExecutionController
 * Tests status codes and headers produced for each execution outcome
 */
@WebMvcTest(ExecutionController.class)
@Import({SecurityConfig.class, JobConfig.class, RequesterResolver.class, JobResponseMapper.class, JobLinkBuilder.class})
class ExecutionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private JobExecutionService executionService;

    @MockBean
    private JobMetricsService metricsService;

    @Test
    void execute_AsyncDecision_ShouldReturnCreatedWithLocation() throws Exception {
        // Given
        Job job = new Job("job-1", "task-1", "ndvi", Instant.now());
        when(executionService.submit(isNull(), eq("ndvi"), any(), any(), any(), any()))
                .thenReturn(new ExecutionOutcome(job, ExecutionModeDecision.asyncApplied(), false));

        // When & Then
        mockMvc.perform(post("/processes/ndvi/execution")
                        .header("Prefer", "respond-async")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"inputs\": {\"band\": \"B04\"}}"))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", "http://localhost:8080/jobs/job-1"))
                .andExpect(header().string("Preference-Applied", "respond-async"))
                .andExpect(jsonPath("$.jobID").value("job-1"))
                .andExpect(jsonPath("$.processID").value("ndvi"))
                .andExpect(jsonPath("$.type").value("process"))
                .andExpect(jsonPath("$.status").value("accepted"))
                .andExpect(jsonPath("$.links[*].rel", hasItem("logs")));
    }

    @Test
    void execute_CompletedSyncWait_ShouldReturnOkWithResultsLink() throws Exception {
        // Given
        Job job = new Job("job-2", "task-2", "ndvi", Instant.now());
        job.updateStatus(JobStatus.RUNNING, null);
        job.updateStatus(JobStatus.SUCCEEDED, null);
        when(executionService.submit(any(), any(), any(), any(), any(), any()))
                .thenReturn(new ExecutionOutcome(job, ExecutionModeDecision.syncApplied(5), true));

        // When & Then
        mockMvc.perform(post("/processes/ndvi/execution").header("Prefer", "wait=5"))
                .andExpect(status().isOk())
                .andExpect(header().string("Preference-Applied", "wait=5"))
                .andExpect(header().doesNotExist("Location"))
                .andExpect(jsonPath("$.status").value("succeeded"))
                .andExpect(jsonPath("$.links[*].rel", hasItem("results")));
    }

    @Test
    void execute_UnfinishedSyncWaitWithoutPreference_ShouldOmitPreferenceApplied() throws Exception {
        Job job = new Job("job-3", "task-3", "ndvi", Instant.now());
        when(executionService.submit(any(), any(), any(), any(), any(), any()))
                .thenReturn(new ExecutionOutcome(job, ExecutionModeDecision.sync(10), false));

        mockMvc.perform(post("/processes/ndvi/execution"))
                .andExpect(status().isCreated())
                .andExpect(header().doesNotExist("Preference-Applied"));
    }

    @Test
    void execute_PreferHeader_ShouldBeForwardedUnsplit() throws Exception {
        Job job = new Job("job-4", "task-4", "subset", Instant.now());
        when(executionService.submit(any(), any(), any(), any(), any(), any()))
                .thenReturn(new ExecutionOutcome(job, ExecutionModeDecision.async(), false));

        mockMvc.perform(post("/providers/hummingbird/processes/subset/execution")
                        .header("Prefer", "respond-async, wait=5")
                        .header("Accept-Language", "de-CH")
                        .with(jwt().jwt(j -> j.subject("alice"))))
                .andExpect(status().isCreated());

        verify(executionService).submit(eq("hummingbird"), eq("subset"), isNull(),
                eq(List.of("respond-async, wait=5")), eq(Requester.user("alice")), eq("de-CH"));
    }

    @Test
    void execute_MalformedPreference_ShouldReturnBadRequest() throws Exception {
        when(executionService.submit(any(), any(), any(), any(), any(), any()))
                .thenThrow(new InvalidPreferenceException("Invalid 'wait' preference, got multiple values", "wait=1,2,3"));

        mockMvc.perform(post("/processes/ndvi/execution").header("Prefer", "wait=1,2,3"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("InvalidParameterValue"))
                .andExpect(jsonPath("$.field").value("Prefer"))
                .andExpect(jsonPath("$.value").value("wait=1,2,3"));

        verify(metricsService).recordRejectedRequest("invalid_preference");
    }

    @Test
    void execute_UnknownProcess_ShouldReturnNotFound() throws Exception {
        when(executionService.submit(any(), any(), any(), any(), any(), any()))
                .thenThrow(JobNotFoundException.process("missing"));

        mockMvc.perform(post("/processes/missing/execution"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.type").value("NoSuchProcess"))
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    void execute_InvalidNotificationEmail_ShouldBeRejectedByValidation() throws Exception {
        mockMvc.perform(post("/processes/ndvi/execution")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"notificationEmail\": \"not-an-email\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(executionService);
    }
}
