package com.tubedigest.feed.service;

import com.tubedigest.config.DigestProperties;
import com.tubedigest.feed.model.CycleRunRequest;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CycleSchedulerServiceTest {

    @Test
    void tickSkipsWhileCycleIsRunning() {
        FeedOrchestratorService orchestrator = mock(FeedOrchestratorService.class);
        when(orchestrator.isRunning()).thenReturn(true);
        CycleSchedulerService scheduler = new CycleSchedulerService(orchestrator, new DigestProperties());

        scheduler.tick();

        verify(orchestrator, never()).runCycle(any());
    }

    @Test
    void tickRunsCycleWithSchedulerTrigger() {
        FeedOrchestratorService orchestrator = mock(FeedOrchestratorService.class);
        CycleSchedulerService scheduler = new CycleSchedulerService(orchestrator, new DigestProperties());

        scheduler.tick();

        ArgumentCaptor<CycleRunRequest> captor = ArgumentCaptor.forClass(CycleRunRequest.class);
        verify(orchestrator).runCycle(captor.capture());
        assertEquals("scheduler", captor.getValue().normalizedTrigger());
    }

    @Test
    void failedTickKeepsScheduleAlive() {
        FeedOrchestratorService orchestrator = mock(FeedOrchestratorService.class);
        when(orchestrator.runCycle(any())).thenThrow(new CyclePersistenceException(3L, "db down", null));
        CycleSchedulerService scheduler = new CycleSchedulerService(orchestrator, new DigestProperties());

        scheduler.tick();

        verify(orchestrator).runCycle(any());
    }

    @Test
    void schedulerStartsOnlyWhenEnabled() {
        FeedOrchestratorService orchestrator = mock(FeedOrchestratorService.class);
        DigestProperties properties = new DigestProperties();
        properties.getScheduler().setInitialDelaySeconds(3600);
        CycleSchedulerService scheduler = new CycleSchedulerService(orchestrator, properties);

        scheduler.startIfEnabled();
        assertFalse(scheduler.isScheduled());

        properties.getScheduler().setEnabled(true);
        scheduler.startIfEnabled();
        assertTrue(scheduler.isScheduled());

        scheduler.stop();
        assertFalse(scheduler.isScheduled());
        verify(orchestrator).requestCancel();
    }
}
