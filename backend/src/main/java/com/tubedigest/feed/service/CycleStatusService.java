package com.tubedigest.feed.service;

import com.tubedigest.feed.model.CycleRunMeta;
import com.tubedigest.feed.model.CycleStatusResponse;
import com.tubedigest.feed.persistence.FeedJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class CycleStatusService {
    private static final Logger log = LoggerFactory.getLogger(CycleStatusService.class);
    private static final int RECENT_RUN_LIMIT = 10;

    private final FeedJdbcRepository repository;
    private final FeedOrchestratorService orchestratorService;
    private final RateGovernor rateGovernor;

    public CycleStatusService(
        FeedJdbcRepository repository,
        FeedOrchestratorService orchestratorService,
        RateGovernor rateGovernor
    ) {
        this.repository = repository;
        this.orchestratorService = orchestratorService;
        this.rateGovernor = rateGovernor;
    }

    public CycleStatusResponse getStatus() {
        boolean dbConnected;
        Map<String, Long> counts = Map.of();
        List<CycleRunMeta> recentRuns = List.of();
        try {
            dbConnected = repository.isDbReachable();
            counts = repository.tableCounts();
            recentRuns = repository.findRecentCycleRuns(RECENT_RUN_LIMIT);
        } catch (Exception e) {
            log.warn("Failed to load cycle status from the database", e);
            dbConnected = false;
        }
        return new CycleStatusResponse(
            dbConnected,
            orchestratorService.currentState(),
            orchestratorService.isRunning(),
            counts,
            rateGovernor.snapshot(),
            recentRuns
        );
    }
}
