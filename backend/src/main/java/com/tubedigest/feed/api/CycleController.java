package com.tubedigest.feed.api;

import com.tubedigest.feed.model.CycleRunRequest;
import com.tubedigest.feed.model.CycleRunSummary;
import com.tubedigest.feed.model.CycleStatusResponse;
import com.tubedigest.feed.service.CycleStatusService;
import com.tubedigest.feed.service.FeedOrchestratorService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/cycle")
public class CycleController {
    private final FeedOrchestratorService orchestratorService;
    private final CycleStatusService statusService;

    public CycleController(FeedOrchestratorService orchestratorService, CycleStatusService statusService) {
        this.orchestratorService = orchestratorService;
        this.statusService = statusService;
    }

    @PostMapping("/run")
    public CycleRunSummary run(@RequestParam(name = "quota", required = false) Integer quota) {
        if (quota != null && quota < 0) {
            throw new ResponseStatusException(BAD_REQUEST, "quota must be >= 0");
        }
        return orchestratorService.runCycle(new CycleRunRequest(quota, "api"));
    }

    @PostMapping("/cancel")
    public Map<String, Object> cancel() {
        boolean requested = orchestratorService.requestCancel();
        return Map.of("cancelRequested", requested, "state", orchestratorService.currentState().name());
    }

    @GetMapping("/status")
    public CycleStatusResponse status() {
        return statusService.getStatus();
    }
}
