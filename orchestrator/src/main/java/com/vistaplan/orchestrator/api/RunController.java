package com.vistaplan.orchestrator.api;

import com.vistaplan.orchestrator.api.dto.PromotionLogResponse;
import com.vistaplan.orchestrator.api.dto.RunResponse;
import com.vistaplan.orchestrator.api.dto.StartRunRequest;
import com.vistaplan.orchestrator.api.dto.TransitionRequest;
import com.vistaplan.orchestrator.api.dto.VerdictResponse;
import com.vistaplan.orchestrator.model.Phase;
import com.vistaplan.orchestrator.model.PipelineRun;
import com.vistaplan.orchestrator.model.QualityTier;
import com.vistaplan.orchestrator.phase.PhaseStateMachine;
import com.vistaplan.orchestrator.phase.StepOutputCodec;
import com.vistaplan.orchestrator.service.PipelineService;
import com.vistaplan.orchestrator.service.StartRunCommand;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for runs.
 *
 * POST /runs                     start a run for an owner
 * GET  /runs/{id}                current phase, step and outputs
 * GET  /runs?ownerId=            an owner's runs, newest first
 * POST /runs/{id}/transition     request-transition
 * POST /runs/{id}/pause|resume   stop / restart dispatching new work
 * GET  /runs/{id}/verdicts       verdict history
 * GET  /runs/{id}/promotion-log  rule changes and human decisions in this run
 * GET  /runs/phases              the legal transition table
 */
@RestController
@RequestMapping("/runs")
public class RunController {

    private final PipelineService pipeline;
    private final StepOutputCodec outputCodec;

    public RunController(PipelineService pipeline, StepOutputCodec outputCodec) {
        this.pipeline    = pipeline;
        this.outputCodec = outputCodec;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"ownerId":"user-42","qualityTier":"2K","userRequest":"Scandinavian, light oak floors"}'
     */
    @PostMapping
    public ResponseEntity<RunResponse> start(@RequestBody StartRunRequest req) {
        QualityTier tier = req.qualityTier() == null ? null : QualityTier.fromLabel(req.qualityTier())
                .orElseThrow(() -> new IllegalArgumentException("Unknown quality tier: " + req.qualityTier()));
        PipelineRun run = pipeline.startRun(new StartRunCommand(
                req.ownerId(), tier, req.userRequest(), req.styleConstraints()));
        return ResponseEntity.status(HttpStatus.CREATED).body(view(run));
    }

    @GetMapping("/{id}")
    public RunResponse get(@PathVariable UUID id) {
        return view(pipeline.getRun(id));
    }

    @GetMapping
    public List<RunResponse> list(@RequestParam String ownerId) {
        return pipeline.runsForOwner(ownerId).stream().map(this::view).toList();
    }

    /**
     * Returns 404 for an unknown run, 400 for an unknown phase name, 422 for an
     * illegal transition and 409 when the expected phase is stale.
     */
    @PostMapping("/{id}/transition")
    public RunResponse transition(@PathVariable UUID id, @RequestBody TransitionRequest req) {
        return view(pipeline.requestTransition(id, req.expectedPhase(), req.targetPhase()));
    }

    @PostMapping("/{id}/pause")
    public RunResponse pause(@PathVariable UUID id) {
        pipeline.pause(id);
        return view(pipeline.getRun(id));
    }

    @PostMapping("/{id}/resume")
    public RunResponse resume(@PathVariable UUID id) {
        pipeline.resume(id);
        return view(pipeline.getRun(id));
    }

    @GetMapping("/{id}/verdicts")
    public List<VerdictResponse> verdicts(@PathVariable UUID id) {
        return pipeline.verdictsForRun(id).stream().map(VerdictResponse::from).toList();
    }

    @GetMapping("/{id}/promotion-log")
    public List<PromotionLogResponse> promotionLog(@PathVariable UUID id) {
        return pipeline.promotionLogForRun(id).stream().map(PromotionLogResponse::from).toList();
    }

    @GetMapping("/phases")
    public Map<String, String> phases() {
        Map<String, String> table = new LinkedHashMap<>();
        for (Map.Entry<Phase, Phase> e : PhaseStateMachine.table().entrySet()) {
            table.put(e.getKey().wireName(), e.getValue().wireName());
        }
        return table;
    }

    private RunResponse view(PipelineRun run) {
        return RunResponse.from(run, outputCodec.read(run.getStepOutputs()));
    }
}
