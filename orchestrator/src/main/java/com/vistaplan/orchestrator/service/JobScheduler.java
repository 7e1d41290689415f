package com.vistaplan.orchestrator.service;

import com.vistaplan.orchestrator.config.PipelineProperties;
import com.vistaplan.orchestrator.ledger.JobLedger;
import com.vistaplan.orchestrator.ledger.LockToken;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;

/**
 * Background dispatcher.
 *
 * Every 2 seconds it claims PENDING jobs whose back-off has elapsed (one per
 * free worker) and runs them on a fixed pool. The database is the queue:
 * claiming uses SKIP LOCKED, so several instances can dispatch side by side.
 *
 * Once a minute it also returns jobs whose holder stopped renewing its lock.
 */
@Component
public class JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final ExecutorService workers;
    private final Semaphore       freeWorkers;

    private final JobLedger     ledger;
    private final AttemptRunner runner;

    public JobScheduler(JobLedger ledger, AttemptRunner runner, PipelineProperties props) {
        this.ledger      = ledger;
        this.runner      = runner;
        this.workers     = Executors.newFixedThreadPool(props.workerCount());
        this.freeWorkers = new Semaphore(props.workerCount());
    }

    @Scheduled(fixedDelay = 2000)
    public void tick() {
        while (freeWorkers.tryAcquire()) {
            String holder = "worker-" + UUID.randomUUID().toString().substring(0, 8);
            Optional<LockToken> claimed;
            try {
                claimed = ledger.claimNext(holder);
            } catch (RuntimeException e) {
                freeWorkers.release();
                throw e;
            }
            if (claimed.isEmpty()) {
                freeWorkers.release();
                return;
            }
            LockToken token = claimed.get();
            workers.submit(() -> {
                try {
                    runner.run(token);
                } catch (Exception e) {
                    log.error("Unhandled error running job {} (attempt {}): {}",
                            token.jobId(), token.attempt(), e.getMessage(), e);
                } finally {
                    freeWorkers.release();
                }
            });
        }
    }

    @Scheduled(fixedDelay = 60_000, initialDelay = 30_000)
    public void recoverExpiredLocks() {
        ledger.recoverExpiredLocks();
    }

    @PreDestroy
    void shutdown() {
        workers.shutdown();
    }
}
