package com.tubedigest.feed.model;

import java.util.List;
import java.util.Map;

public record CycleStatusResponse(
    boolean dbConnected,
    CycleState state,
    boolean running,
    Map<String, Long> counts,
    List<StageBackoffState> governor,
    List<CycleRunMeta> recentRuns
) {}
