package com.gocomet.tripsafety.admin.controller;

import com.gocomet.tripsafety.admission.model.BreakerMetrics;
import com.gocomet.tripsafety.admission.model.CircuitState;
import com.gocomet.tripsafety.admission.service.CircuitBreakerService;
import com.gocomet.tripsafety.admission.service.RateLimiterService;
import com.gocomet.tripsafety.common.exception.InvalidStateTransitionException;
import com.gocomet.tripsafety.notification.model.ChannelType;
import com.gocomet.tripsafety.notification.model.JobStatus;
import com.gocomet.tripsafety.notification.service.NotificationQueueService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(OperationsController.class)
class OperationsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CircuitBreakerService circuitBreakerService;

    @MockBean
    private NotificationQueueService queueService;

    @MockBean
    private RateLimiterService rateLimiterService;

    @BeforeEach
    void setUp() {
        Map<JobStatus, Long> depth = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            depth.put(status, 0L);
        }
        depth.put(JobStatus.RETRYING, 3L);
        when(queueService.depth()).thenReturn(depth);
        when(queueService.failedByChannel()).thenReturn(Map.of(ChannelType.SMS, 2L));
    }

    @Test
    void health_allCircuitsClosed_isUp() throws Exception {
        when(circuitBreakerService.snapshot(OperationsController.DEPENDENCIES)).thenReturn(states(CircuitState.CLOSED));

        mockMvc.perform(get("/v1/admin/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.queueDepth.RETRYING").value(3))
                .andExpect(jsonPath("$.failedByChannel.SMS").value(2));
    }

    @Test
    void health_openCircuit_isDegraded() throws Exception {
        Map<String, CircuitState> states = states(CircuitState.CLOSED);
        states.put("sms", CircuitState.OPEN);
        when(circuitBreakerService.snapshot(OperationsController.DEPENDENCIES)).thenReturn(states);

        mockMvc.perform(get("/v1/admin/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"))
                .andExpect(jsonPath("$.circuitBreakers.sms").value("OPEN"));
    }

    @Test
    void requeue_jobNotFailed_returns409() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(queueService.requeue(jobId))
                .thenThrow(new InvalidStateTransitionException("NotificationJob", "COMPLETED", "QUEUED"));

        mockMvc.perform(post("/v1/admin/notifications/{jobId}/requeue", jobId))
                .andExpect(status().isConflict());
    }

    @Test
    void resetCircuitBreaker_knownDependency_returnsClosedCircuit() throws Exception {
        when(circuitBreakerService.reset("sms")).thenReturn(new BreakerMetrics("sms", CircuitState.CLOSED, 0,
                null, 0, 0, 0, 0, null, null));

        mockMvc.perform(post("/v1/admin/circuit-breakers/{dependency}/reset", "sms")
                        .header("X-Actor-Id", "op-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dependency").value("sms"))
                .andExpect(jsonPath("$.state").value("CLOSED"))
                .andExpect(jsonPath("$.consecutiveFailures").value(0));
        verify(circuitBreakerService).reset("sms");
    }

    @Test
    void resetCircuitBreaker_unknownDependency_returns404() throws Exception {
        mockMvc.perform(post("/v1/admin/circuit-breakers/{dependency}/reset", "fax"))
                .andExpect(status().isNotFound());
        verify(circuitBreakerService, never()).reset(anyString());
    }

    @Test
    void circuitBreakers_listsMetricsPerDependency() throws Exception {
        when(circuitBreakerService.metrics(OperationsController.DEPENDENCIES)).thenReturn(List.of(
                new BreakerMetrics("sms", CircuitState.OPEN, 5, null, 12, 7, 5, 3, null, "carrier unavailable")));

        mockMvc.perform(get("/v1/admin/circuit-breakers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].state").value("OPEN"))
                .andExpect(jsonPath("$[0].rejectedCalls").value(3))
                .andExpect(jsonPath("$[0].lastError").value("carrier unavailable"));
    }

    private static Map<String, CircuitState> states(CircuitState state) {
        Map<String, CircuitState> states = new LinkedHashMap<>();
        for (String dependency : OperationsController.DEPENDENCIES) {
            states.put(dependency, state);
        }
        return states;
    }
}
