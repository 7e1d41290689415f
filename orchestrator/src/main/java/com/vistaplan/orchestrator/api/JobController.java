package com.vistaplan.orchestrator.api;

import com.vistaplan.orchestrator.api.dto.AcquireRequest;
import com.vistaplan.orchestrator.api.dto.AcquireResponse;
import com.vistaplan.orchestrator.api.dto.DecisionRequest;
import com.vistaplan.orchestrator.api.dto.JobRequest;
import com.vistaplan.orchestrator.api.dto.JobResponse;
import com.vistaplan.orchestrator.api.dto.RetryDecisionResponse;
import com.vistaplan.orchestrator.api.dto.SubmitVerdictRequest;
import com.vistaplan.orchestrator.api.dto.VerdictResponse;
import com.vistaplan.orchestrator.ledger.AcquireResult;
import com.vistaplan.orchestrator.ledger.JobRequestResult;
import com.vistaplan.orchestrator.service.PipelineService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for jobs.
 *
 * POST /runs/{id}/jobs           request-job: queue work for the dispatcher
 * POST /runs/{id}/jobs/acquire   lock a unit for an external worker
 * GET  /runs/{id}/jobs           all jobs of a run
 * GET  /jobs/{id}                poll one job
 * GET  /jobs/{id}/verdicts       the job's attempts, oldest first
 * POST /jobs/{id}/verdict        submit-verdict from the lock holder
 * POST /jobs/{id}/decision       human decision on a BLOCKED job
 */
@RestController
public class JobController {

    private final PipelineService pipeline;

    public JobController(PipelineService pipeline) {
        this.pipeline = pipeline;
    }

    /** 201 when a job was created, 200 when an existing one was returned. */
    @PostMapping("/runs/{runId}/jobs")
    public ResponseEntity<JobResponse> request(@PathVariable UUID runId, @RequestBody JobRequest req) {
        JobRequestResult result = pipeline.requestJob(runId, req.step(), req.service(),
                req.idempotencyKey(), req.inputArtifactIds());
        return ResponseEntity.status(result.created() ? HttpStatus.CREATED : HttpStatus.OK)
                .body(JobResponse.from(result.job()));
    }

    /** Contention is answered with 200 and the outcome, never with an error status. */
    @PostMapping("/runs/{runId}/jobs/acquire")
    public AcquireResponse acquire(@PathVariable UUID runId, @RequestBody AcquireRequest req) {
        AcquireResult result = pipeline.acquireJob(runId, req.step(), req.service(),
                req.idempotencyKey(), req.holder());
        return AcquireResponse.from(result);
    }

    @GetMapping("/runs/{runId}/jobs")
    public List<JobResponse> forRun(@PathVariable UUID runId) {
        return pipeline.jobsForRun(runId).stream().map(JobResponse::from).toList();
    }

    @GetMapping("/jobs/{id}")
    public JobResponse get(@PathVariable UUID id) {
        return JobResponse.from(pipeline.getJob(id));
    }

    @GetMapping("/jobs/{id}/verdicts")
    public List<VerdictResponse> verdicts(@PathVariable UUID id) {
        return pipeline.verdictsForJob(id).stream().map(VerdictResponse::from).toList();
    }

    /** 409 LOCK_LOST when the holder's lock was reclaimed in the meantime. */
    @PostMapping("/jobs/{id}/verdict")
    public RetryDecisionResponse submitVerdict(@PathVariable UUID id, @RequestBody SubmitVerdictRequest req) {
        return RetryDecisionResponse.from(pipeline.submitVerdict(id, req.toAttempt()));
    }

    @PostMapping("/jobs/{id}/decision")
    public JobResponse decide(@PathVariable UUID id, @RequestBody DecisionRequest req) {
        if (req.decision() == null) {
            throw new IllegalArgumentException("decision is required (APPROVE or REJECT_AND_STOP)");
        }
        return JobResponse.from(pipeline.recordDecision(id, req.decision(), req.actor(), req.reason()));
    }
}
