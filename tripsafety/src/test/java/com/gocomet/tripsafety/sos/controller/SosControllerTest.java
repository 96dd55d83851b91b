package com.gocomet.tripsafety.sos.controller;

import com.gocomet.tripsafety.admission.model.EndpointClass;
import com.gocomet.tripsafety.admission.model.RateLimitDecision;
import com.gocomet.tripsafety.admission.service.RateLimiterService;
import com.gocomet.tripsafety.common.exception.InvalidStateTransitionException;
import com.gocomet.tripsafety.common.exception.RateLimitExceededException;
import com.gocomet.tripsafety.common.exception.ResourceNotFoundException;
import com.gocomet.tripsafety.common.exception.SosPersistenceException;
import com.gocomet.tripsafety.sos.dto.SosTriggerRequest;
import com.gocomet.tripsafety.sos.dto.SosTriggerResponse;
import com.gocomet.tripsafety.sos.model.SosState;
import com.gocomet.tripsafety.sos.service.SosAlertService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SosController.class)
class SosControllerTest {

    private static final String TRIGGER_BODY =
            "{\"tripId\":\"%s\",\"triggeredBy\":\"rider-1\",\"role\":\"PASSENGER\",\"lat\":12.97,\"lng\":77.59}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SosAlertService sosAlertService;

    @MockBean
    private RateLimiterService rateLimiterService;

    private final UUID tripId = UUID.randomUUID();
    private final UUID alertId = UUID.randomUUID();

    @BeforeEach
    void allowByDefault() {
        when(rateLimiterService.check(anyString(), any())).thenReturn(RateLimitDecision.allow(300, 299));
    }

    @Test
    void trigger_newAlert_returns201() throws Exception {
        when(sosAlertService.triggerSos(any(SosTriggerRequest.class))).thenReturn(response(false));

        mockMvc.perform(post("/v1/sos")
                        .header("X-Actor-Id", "rider-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(String.format(TRIGGER_BODY, tripId)))
                .andExpect(status().isCreated())
                .andExpect(header().string("X-RateLimit-Limit", "300"))
                .andExpect(jsonPath("$.alertId").value(alertId.toString()))
                .andExpect(jsonPath("$.state").value("NOTIFYING"))
                .andExpect(jsonPath("$.duplicate").value(false));

        verify(rateLimiterService).check("rider-1", EndpointClass.CRITICAL);
    }

    @Test
    void trigger_openAlertExists_returns200() throws Exception {
        when(sosAlertService.triggerSos(any(SosTriggerRequest.class))).thenReturn(response(true));

        mockMvc.perform(post("/v1/sos")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(String.format(TRIGGER_BODY, tripId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.duplicate").value(true));
    }

    @Test
    void trigger_overQuota_returns429WithRetryAfter() throws Exception {
        when(rateLimiterService.check(anyString(), eq(EndpointClass.CRITICAL)))
                .thenThrow(new RateLimitExceededException(EndpointClass.CRITICAL, 42));

        mockMvc.perform(post("/v1/sos")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(String.format(TRIGGER_BODY, tripId)))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "42"))
                .andExpect(jsonPath("$.retryAfter").value(42))
                .andExpect(jsonPath("$.endpointClass").value("CRITICAL"));

        verifyNoInteractions(sosAlertService);
    }

    @Test
    void trigger_missingLocation_returns400() throws Exception {
        mockMvc.perform(post("/v1/sos")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tripId\":\"" + tripId + "\",\"triggeredBy\":\"rider-1\",\"role\":\"PASSENGER\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    void trigger_cacheUnreachable_returns503WithFallback() throws Exception {
        when(sosAlertService.triggerSos(any(SosTriggerRequest.class)))
                .thenThrow(new RedisConnectionFailureException("Unable to connect to Redis"));

        mockMvc.perform(post("/v1/sos")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(String.format(TRIGGER_BODY, tripId)))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("DEPENDENCY_UNAVAILABLE"))
                .andExpect(jsonPath("$.fallback").value("CALL_EMERGENCY_SERVICES"));
    }

    @Test
    void acknowledge_cacheUnreachable_returns503WithoutFallback() throws Exception {
        when(sosAlertService.acknowledgeAlert(eq(alertId), any()))
                .thenThrow(new RedisConnectionFailureException("Unable to connect to Redis"));

        mockMvc.perform(post("/v1/sos/{alertId}/acknowledge", alertId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"operatorId\":\"op-1\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.fallback").doesNotExist());
    }

    @Test
    void trigger_storeDown_returns503WithFallback() throws Exception {
        when(sosAlertService.triggerSos(any(SosTriggerRequest.class)))
                .thenThrow(new SosPersistenceException(tripId, 4, new IllegalStateException("db down")));

        mockMvc.perform(post("/v1/sos")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(String.format(TRIGGER_BODY, tripId)))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.fallback").value("CALL_EMERGENCY_SERVICES"));
    }

    @Test
    void acknowledge_resolvedAlert_returns409() throws Exception {
        when(sosAlertService.acknowledgeAlert(alertId, "op-1"))
                .thenThrow(new InvalidStateTransitionException("SosAlert", "RESOLVED", "ACKNOWLEDGED"));

        mockMvc.perform(post("/v1/sos/{alertId}/acknowledge", alertId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"operatorId\":\"op-1\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void getAlert_unknown_returns404() throws Exception {
        when(sosAlertService.getAlert(alertId)).thenThrow(new ResourceNotFoundException("SosAlert", "id", alertId));

        mockMvc.perform(get("/v1/sos/{alertId}", alertId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    private SosTriggerResponse response(boolean duplicate) {
        return SosTriggerResponse.builder()
                .alertId(alertId)
                .tripId(tripId)
                .state(SosState.NOTIFYING)
                .triggeredAt(Instant.parse("2026-01-01T10:00:00Z"))
                .duplicate(duplicate)
                .build();
    }
}
