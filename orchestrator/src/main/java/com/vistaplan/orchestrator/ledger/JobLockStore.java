package com.vistaplan.orchestrator.ledger;

import com.vistaplan.orchestrator.config.PipelineProperties;
import com.vistaplan.orchestrator.model.JobStatus;
import com.vistaplan.orchestrator.model.PipelineJob;
import com.vistaplan.orchestrator.repository.PipelineJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Transactional bookkeeping behind {@link JobLedger}.
 *
 * Each public method is one short transaction. Nothing here calls out to a
 * collaborator, so row locks are held only for the duration of the bookkeeping.
 * The race between two concurrent first inserts is settled by the partial
 * unique index on RUNNING rows; JobLedger turns that violation into
 * ALREADY_RUNNING.
 */
@Component
class JobLockStore {

    private static final Logger log = LoggerFactory.getLogger(JobLockStore.class);

    private final PipelineJobRepository jobRepo;
    private final PipelineProperties    props;
    private final Clock                 clock;

    JobLockStore(PipelineJobRepository jobRepo, PipelineProperties props, Clock clock) {
        this.jobRepo = jobRepo;
        this.props   = props;
        this.clock   = clock;
    }

    // ------------------------------------------------------------------
    // Request (create PENDING)
    // ------------------------------------------------------------------

    /**
     * Record that work is wanted, without locking it. Returns the existing job
     * when the idempotency key was seen before or the unit already has an open job.
     */
    @Transactional
    public JobRequestResult request(UUID runId, int step, String service,
                                    String idempotencyKey, String payloadRef) {
        if (idempotencyKey != null) {
            Optional<PipelineJob> byKey = jobRepo.findByIdempotencyKey(idempotencyKey);
            if (byKey.isPresent()) {
                return new JobRequestResult(byKey.get(), false);
            }
        }
        Optional<PipelineJob> open = jobRepo.lockOpenJob(runId, step, service);
        if (open.isPresent()) {
            return new JobRequestResult(open.get(), false);
        }
        PipelineJob job = new PipelineJob(runId, step, service, idempotencyKey, props.maxAttemptsPerJob());
        job.setPayloadRef(payloadRef);
        job = jobRepo.saveAndFlush(job);
        log.info("Job {} requested (run={}, step={}, service={})", job.getId(), runId, step, service);
        return new JobRequestResult(job, true);
    }

    // ------------------------------------------------------------------
    // Acquire
    // ------------------------------------------------------------------

    @Transactional
    public AcquireResult acquire(UUID runId, int step, String service,
                                 String idempotencyKey, String holder) {
        Instant now = clock.instant();

        if (idempotencyKey != null) {
            Optional<PipelineJob> byKey = jobRepo.findByIdempotencyKey(idempotencyKey);
            if (byKey.isPresent()) {
                PipelineJob existing = byKey.get();
                boolean sameUnit = existing.getRunId().equals(runId)
                        && existing.getStep() == step
                        && existing.getServiceName().equals(service);
                if (existing.getStatus().isTerminal() || !sameUnit) {
                    log.info("Idempotency key '{}' already used by job {} ({}), not creating another",
                            idempotencyKey, existing.getId(), existing.getStatus());
                    return AcquireResult.duplicate(existing.getId());
                }
            }
        }

        Optional<PipelineJob> open = jobRepo.lockOpenJob(runId, step, service);
        if (open.isPresent()) {
            return takeOver(open.get(), holder, now);
        }

        PipelineJob job = new PipelineJob(runId, step, service, idempotencyKey, props.maxAttemptsPerJob());
        lock(job, holder, now);
        job.setStartedAt(now);
        job = jobRepo.saveAndFlush(job);   // flush now so the unique index fires inside this call
        log.info("Job {} created and locked by '{}' (run={}, step={}, service={})",
                job.getId(), holder, runId, step, service);
        return AcquireResult.acquired(tokenFor(job, false));
    }

    /** Lock a specific PENDING job, as picked by the dispatcher. */
    @Transactional
    public AcquireResult acquireById(UUID jobId, String holder) {
        PipelineJob job = jobRepo.lockById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (job.getStatus().isTerminal()) {
            return AcquireResult.duplicate(job.getId());
        }
        return takeOver(job, holder, clock.instant());
    }

    /** Claim the oldest dispatchable PENDING job, skipping rows other dispatchers hold. */
    @Transactional
    public Optional<LockToken> claimNext(String holder) {
        Instant now = clock.instant();
        return jobRepo.claimNextDispatchable(now).map(job -> {
            lock(job, holder, now);
            jobRepo.save(job);
            log.info("Dispatcher '{}' claimed job {} (run={}, step={}, service={}, attempt={})",
                    holder, job.getId(), job.getRunId(), job.getStep(), job.getServiceName(), job.getAttempts());
            return tokenFor(job, false);
        });
    }

    /** Called after a unique-index violation: report who won the insert race. */
    @Transactional(readOnly = true)
    public AcquireResult describeContention(UUID runId, int step, String service) {
        UUID winner = jobRepo.findByRunIdAndStepOrderByCreatedAtAsc(runId, step).stream()
                .filter(j -> j.getServiceName().equals(service) && j.getStatus() == JobStatus.RUNNING)
                .map(PipelineJob::getId)
                .reduce((first, second) -> second)
                .orElse(null);
        return AcquireResult.alreadyRunning(winner);
    }

    private AcquireResult takeOver(PipelineJob job, String holder, Instant now) {
        if (job.hasLiveLock(now)) {
            log.debug("Job {} is running under '{}' until {}", job.getId(), job.getLockHolder(), job.getLockExpiresAt());
            return AcquireResult.alreadyRunning(job.getId());
        }

        boolean reclaim = job.getStatus() == JobStatus.RUNNING;
        if (reclaim && job.attemptsExhausted()) {
            job.setStatus(JobStatus.FAILED);
            job.setLastError("Lock held by '%s' expired on the final attempt (%d/%d)"
                    .formatted(job.getLockHolder(), job.getAttempts(), job.getMaxAttempts()));
            job.clearLock();
            job.setCompletedAt(now);
            jobRepo.save(job);
            log.error("Job {} FAILED: expired lock on final attempt", job.getId());
            return AcquireResult.exhausted(job.getId());
        }

        if (reclaim) {
            log.warn("Reclaiming job {} from '{}' (lock expired at {})",
                    job.getId(), job.getLockHolder(), job.getLockExpiresAt());
        }
        lock(job, holder, now);
        if (job.getStartedAt() == null) job.setStartedAt(now);
        jobRepo.save(job);
        return AcquireResult.acquired(tokenFor(job, reclaim));
    }

    // ------------------------------------------------------------------
    // Release / extend
    // ------------------------------------------------------------------

    @Transactional
    public PipelineJob release(LockToken token, JobRelease release) {
        Instant now = clock.instant();
        PipelineJob job = requireHeld(token, now);

        job.setStatus(release.status());
        job.clearLock();
        if (release.resultRef() != null)  job.setResultRef(release.resultRef());
        if (release.error() != null)      job.setLastError(release.error());
        if (release.errorTrace() != null) job.setLastErrorTrace(release.errorTrace());
        job.setCorrectiveInstructions(release.correctiveInstructions());
        job.setNotBefore(release.notBefore());

        if (release.status().isTerminal()) {
            job.setCompletedAt(now);
            if (job.getStartedAt() != null) {
                job.setProcessingTimeMs(Duration.between(job.getStartedAt(), now).toMillis());
            }
        }
        log.info("Job {} released by '{}' as {} (attempt {}/{})",
                job.getId(), token.holder(), release.status(), job.getAttempts(), job.getMaxAttempts());
        return jobRepo.save(job);
    }

    @Transactional
    public LockToken extend(LockToken token) {
        Instant now = clock.instant();
        PipelineJob job = requireHeld(token, now);
        job.setLockExpiresAt(now.plus(props.lockTtl()));
        jobRepo.save(job);
        return token.withExpiry(job.getLockExpiresAt());
    }

    private PipelineJob requireHeld(LockToken token, Instant now) {
        PipelineJob job = jobRepo.lockById(token.jobId())
                .orElseThrow(() -> new JobNotFoundException(token.jobId()));
        // An expired lock that nobody reclaimed yet still belongs to its holder.
        if (job.getStatus() != JobStatus.RUNNING || !Objects.equals(job.getLockHolder(), token.holder())) {
            throw new LockLostException(job.getId(), token.holder(), job.getLockHolder());
        }
        return job;
    }

    /**
     * Settle a BLOCKED job by human decision. Blocked jobs hold no lock, so the
     * row lock taken here is the only guard.
     *
     * @throws IllegalJobStateException if the job is not BLOCKED
     */
    @Transactional
    public PipelineJob resolveBlocked(UUID jobId, JobStatus outcome, String note) {
        if (!outcome.isTerminal() || outcome == JobStatus.BLOCKED) {
            throw new IllegalArgumentException("Not a decision outcome: " + outcome);
        }
        PipelineJob job = jobRepo.lockById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (job.getStatus() != JobStatus.BLOCKED) {
            throw new IllegalJobStateException(jobId, job.getStatus(), "only BLOCKED jobs take a human decision");
        }
        Instant now = clock.instant();
        job.setStatus(outcome);
        job.setCompletedAt(now);
        if (note != null) job.setLastError(note);
        log.info("Job {} resolved by human decision: {}", jobId, outcome);
        return jobRepo.save(job);
    }

    // ------------------------------------------------------------------
    // Crash recovery
    // ------------------------------------------------------------------

    /**
     * Return RUNNING jobs whose holder stopped renewing to PENDING, or FAILED
     * once their attempt budget is spent.
     *
     * @return number of jobs recovered
     */
    @Transactional
    public int recoverExpired() {
        Instant now = clock.instant();
        List<PipelineJob> expired = jobRepo.findByStatusAndLockExpiresAtBefore(JobStatus.RUNNING, now);
        int recovered = 0;
        for (PipelineJob candidate : expired) {
            PipelineJob job = jobRepo.lockById(candidate.getId()).orElse(null);
            if (job == null || job.hasLiveLock(now) || job.getStatus() != JobStatus.RUNNING) continue;

            String deadHolder = job.getLockHolder();
            job.clearLock();
            if (job.attemptsExhausted()) {
                job.setStatus(JobStatus.FAILED);
                job.setCompletedAt(now);
                job.setLastError("Holder '%s' stopped renewing its lock on the final attempt".formatted(deadHolder));
                log.error("Job {} FAILED: lock of '{}' expired after {} attempts", job.getId(), deadHolder, job.getAttempts());
            } else {
                job.setStatus(JobStatus.PENDING);
                job.setLastError("Holder '%s' stopped renewing its lock".formatted(deadHolder));
                log.warn("Job {} returned to PENDING: lock of '{}' expired (attempt {}/{})",
                        job.getId(), deadHolder, job.getAttempts(), job.getMaxAttempts());
            }
            jobRepo.save(job);
            recovered++;
        }
        return recovered;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void lock(PipelineJob job, String holder, Instant now) {
        job.setStatus(JobStatus.RUNNING);
        job.setLockHolder(holder);
        job.setLockExpiresAt(now.plus(props.lockTtl()));
        job.setNotBefore(null);
        job.incrementAttempts();
    }

    private static LockToken tokenFor(PipelineJob job, boolean reclaimed) {
        return new LockToken(job.getId(), job.getRunId(), job.getStep(), job.getServiceName(),
                job.getLockHolder(), job.getAttempts(), job.getLockExpiresAt(), reclaimed);
    }
}
