package com.tubedigest.feed.api;

import com.tubedigest.feed.model.CycleRunRequest;
import com.tubedigest.feed.model.CycleRunSummary;
import com.tubedigest.feed.service.ActiveCycleRunException;
import com.tubedigest.feed.service.CycleStatusService;
import com.tubedigest.feed.service.FeedOrchestratorService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CycleControllerTest {

    @Test
    void runWithoutQuotaUsesConfiguredDefault() {
        FeedOrchestratorService orchestrator = mock(FeedOrchestratorService.class);
        CycleRunSummary summary = new CycleRunSummary(
            1L, Instant.now(), Instant.now(), "COMPLETED", 5, 5, 0, 0, 0, 0, 0, false, List.of(), List.of(), Map.of()
        );
        when(orchestrator.runCycle(any())).thenReturn(summary);
        CycleController controller = new CycleController(orchestrator, mock(CycleStatusService.class));

        assertSame(summary, controller.run(null));

        ArgumentCaptor<CycleRunRequest> captor = ArgumentCaptor.forClass(CycleRunRequest.class);
        verify(orchestrator).runCycle(captor.capture());
        assertNull(captor.getValue().quota());
        assertEquals("api", captor.getValue().normalizedTrigger());
    }

    @Test
    void negativeQuotaNeverStartsCycle() {
        FeedOrchestratorService orchestrator = mock(FeedOrchestratorService.class);
        CycleController controller = new CycleController(orchestrator, mock(CycleStatusService.class));

        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> controller.run(-3));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        verify(orchestrator, never()).runCycle(any());
    }

    @Test
    void activeCycleMapsToConflict() {
        ResponseEntity<Map<String, String>> response =
            new FeedExceptionHandler().handleActiveRun(new ActiveCycleRunException("A cycle is already running"));

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals("active_cycle_run", response.getBody().get("error"));
    }
}
