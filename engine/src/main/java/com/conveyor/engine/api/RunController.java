package com.conveyor.engine.api;

import com.conveyor.engine.api.dto.RunResponse;
import com.conveyor.engine.api.dto.StageResponse;
import com.conveyor.engine.api.dto.StartRunRequest;
import com.conveyor.engine.model.RunRecord;
import com.conveyor.engine.model.StageRecord;
import com.conveyor.engine.service.RunService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for pipeline runs.
 *
 * POST /runs               - queue a run with a parameter map
 * GET  /runs/{id}          - poll the state of a run
 * GET  /runs/{id}/stages   - every stage result, in execution order
 * GET  /runs/{id}/report   - final report once the run has finished
 */
@RestController
@RequestMapping("/runs")
@ConditionalOnProperty(prefix = "conveyor.cli", name = "enabled", havingValue = "false", matchIfMissing = true)
public class RunController {

    private final RunService runService;

    public RunController(RunService runService) {
        this.runService = runService;
    }

    /**
     * Queue a run. Execution is asynchronous; poll GET /runs/{id}.
     *
     * Example:
     *   curl -X POST http://localhost:8080/runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"parameters":{"BRANCH_NAME":"main","PROJECT_VERSION":"1.4.0"}}'
     */
    @PostMapping
    public ResponseEntity<RunResponse> start(@RequestBody(required = false) StartRunRequest req) {
        Map<String, String> parameters = req == null ? Map.of() : req.parameters();
        RunRecord run = runService.submit(parameters);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(RunResponse.from(run));
    }

    @GetMapping("/{id}")
    public RunResponse getRun(@PathVariable UUID id) {
        return RunResponse.from(find(id));
    }

    @GetMapping("/{id}/stages")
    public List<StageResponse> getStages(@PathVariable UUID id) {
        find(id);
        return runService.getStages(id).stream()
                .map(StageResponse::from)
                .toList();
    }

    /**
     * HTTP 200 - the run has finished; body lists every stage's terminal status
     * HTTP 202 - still queued or running
     * HTTP 404 - unknown run id
     */
    @GetMapping("/{id}/report")
    public ResponseEntity<Map<String, Object>> getReport(@PathVariable UUID id) {
        RunRecord run = find(id);
        if (!run.getState().isTerminal()) {
            return ResponseEntity.accepted()
                    .body(Map.of("status", "pending", "state", run.getState().name()));
        }

        List<Map<String, Object>> stages = runService.getStages(id).stream()
                .map(RunController::stageSummary)
                .toList();

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("runId",      run.getId().toString());
        report.put("pipeline",   run.getPipelineName());
        report.put("state",      run.getState().name());
        report.put("createdAt",  String.valueOf(run.getCreatedAt()));
        report.put("finishedAt", String.valueOf(run.getFinishedAt()));
        if (run.getErrorMessage() != null) {
            report.put("error", run.getErrorMessage());
        }
        report.put("stages", stages);
        return ResponseEntity.ok(report);
    }

    private RunRecord find(UUID id) {
        return runService.findById(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + id));
    }

    private static Map<String, Object> stageSummary(StageRecord s) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("stageId",    s.getStageId());
        summary.put("status",     s.getStatus().name());
        summary.put("durationMs", s.getDurationMs());
        summary.put("attempts",   s.getAttempts());
        if (s.getMessage() != null) {
            summary.put("message", s.getMessage());
        }
        return summary;
    }
}
