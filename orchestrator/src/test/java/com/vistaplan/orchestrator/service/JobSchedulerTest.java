package com.vistaplan.orchestrator.service;

import com.vistaplan.orchestrator.config.PipelineProperties;
import com.vistaplan.orchestrator.ledger.JobLedger;
import com.vistaplan.orchestrator.ledger.LockToken;
import com.vistaplan.orchestrator.model.JobStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobSchedulerTest {

    @Mock JobLedger     ledger;
    @Mock AttemptRunner runner;

    private JobScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new JobScheduler(ledger, runner,
                new PipelineProperties(null, 0, 0, null, null, 2));
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void tick_runsClaimedJobAndStopsWhenQueueIsEmpty() {
        LockToken token = new LockToken(UUID.randomUUID(), UUID.randomUUID(), 1, "top_down",
                "worker-x", 1, Instant.now().plusSeconds(300), false);
        when(ledger.claimNext(anyString())).thenReturn(Optional.of(token), Optional.empty());
        when(runner.run(token)).thenReturn(Optional.of(JobStatus.COMPLETED));

        scheduler.tick();

        verify(runner, timeout(2000)).run(token);
        verify(ledger, times(2)).claimNext(anyString());
    }

    @Test
    void tick_claimFailure_propagatesAndFreesTheWorker() {
        when(ledger.claimNext(anyString()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"))
                .thenReturn(Optional.empty());

        assertThatThrownBy(() -> scheduler.tick()).isInstanceOf(DataAccessResourceFailureException.class);
        scheduler.tick();

        verify(ledger, times(2)).claimNext(anyString());
        verifyNoInteractions(runner);
    }

    @Test
    void recoverExpiredLocks_delegatesToLedger() {
        scheduler.recoverExpiredLocks();

        verify(ledger).recoverExpiredLocks();
    }
}
