package com.vistaplan.orchestrator.ledger;

import com.vistaplan.orchestrator.model.JobStatus;
import com.vistaplan.orchestrator.model.PipelineJob;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Job ledger and lock manager.
 *
 * Two guards live here and are deliberately separate:
 * <ul>
 *   <li>the idempotency key stops the same logical job from being created twice
 *       (a double-clicked "generate" button);</li>
 *   <li>the RUNNING lock stops two workers from executing one job at once.</li>
 * </ul>
 * Contention is reported through {@link AcquireResult}, never thrown.
 *
 * <pre>
 *   vistaplan.jobs.acquire{outcome="acquired|reclaimed|already_running|duplicate|exhausted"}
 * </pre>
 */
@Service
public class JobLedger {

    private static final Logger log = LoggerFactory.getLogger(JobLedger.class);

    private final JobLockStore  store;
    private final MeterRegistry meterRegistry;

    public JobLedger(JobLockStore store, MeterRegistry meterRegistry) {
        this.store         = store;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Take the lock for (run, step, service), creating the job row if needed.
     */
    public AcquireResult acquireJob(UUID runId, int step, String service,
                                    String idempotencyKey, String holder) {
        AcquireResult result;
        try {
            result = store.acquire(runId, step, service, idempotencyKey, holder);
        } catch (DataIntegrityViolationException e) {
            // Another caller inserted the RUNNING row (or used the key) between our read and our insert.
            log.info("Lost insert race for run={} step={} service={}: {}",
                    runId, step, service, e.getMostSpecificCause().getMessage());
            result = store.describeContention(runId, step, service);
        }
        count(result);
        return result;
    }

    /** Lock a specific job that is already in the ledger. */
    public AcquireResult acquireExisting(UUID jobId, String holder) {
        AcquireResult result = store.acquireById(jobId, holder);
        count(result);
        return result;
    }

    /** Dispatcher entry point: lock the oldest job that is ready to run. */
    public Optional<LockToken> claimNext(String holder) {
        Optional<LockToken> token = store.claimNext(holder);
        token.ifPresent(t -> meterRegistry.counter("vistaplan.jobs.acquire", "outcome", "acquired").increment());
        return token;
    }

    public JobRequestResult requestJob(UUID runId, int step, String service,
                                       String idempotencyKey, String payloadRef) {
        try {
            return store.request(runId, step, service, idempotencyKey, payloadRef);
        } catch (DataIntegrityViolationException e) {
            // Same key inserted concurrently: the other request won, hand back its row.
            log.info("Concurrent request for key '{}' detected", idempotencyKey);
            return store.request(runId, step, service, idempotencyKey, payloadRef);
        }
    }

    /**
     * Let go of a job. Must be called on every exit path of an attempt.
     *
     * @throws LockLostException if {@code token} no longer holds the job
     */
    public PipelineJob releaseJob(LockToken token, JobRelease release) {
        return store.release(token, release);
    }

    /** Heartbeat: push the lock expiry out by one TTL. */
    public LockToken extendLock(LockToken token) {
        return store.extend(token);
    }

    /** Move a BLOCKED job to COMPLETED or FAILED on a human's say-so. */
    public PipelineJob resolveBlocked(UUID jobId, JobStatus outcome, String note) {
        return store.resolveBlocked(jobId, outcome, note);
    }

    public int recoverExpiredLocks() {
        int recovered = store.recoverExpired();
        if (recovered > 0) {
            log.warn("Recovered {} job(s) with expired locks", recovered);
        }
        return recovered;
    }

    private void count(AcquireResult result) {
        meterRegistry.counter("vistaplan.jobs.acquire",
                "outcome", result.outcome().name().toLowerCase(Locale.ROOT)).increment();
    }
}
