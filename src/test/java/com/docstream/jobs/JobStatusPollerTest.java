package com.docstream.jobs;

import com.docstream.jobs.JobStatusPoller.Outcome;
import com.docstream.jobs.JobStatusPoller.PollResult;
import com.docstream.shared.dto.JobStatusResponse;
import com.docstream.shared.model.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobStatusPollerTest {

    @Mock
    private JobQueryService jobQueryService;

    private RecordingPoller poller;

    @BeforeEach
    void setUp() {
        poller = new RecordingPoller(jobQueryService);
    }

    private static Optional<JobStatusResponse> snapshot(UUID jobId, JobStatus status) {
        JobStatusResponse response = new JobStatusResponse();
        response.setJobId(jobId);
        response.setStatus(status);
        return Optional.of(response);
    }

    @Test
    void returnsTerminalSnapshotOnceReached() {
        UUID jobId = UUID.randomUUID();
        when(jobQueryService.findStatus(jobId)).thenReturn(
                snapshot(jobId, JobStatus.PENDING), snapshot(jobId, JobStatus.PROCESSING), snapshot(jobId, JobStatus.DONE));

        PollResult result = poller.pollUntilTerminal(jobId, 25, 10);

        assertThat(result.getOutcome()).isEqualTo(Outcome.TERMINAL);
        assertThat(result.getSnapshot().getStatus()).isEqualTo(JobStatus.DONE);
        assertThat(result.getAttempts()).isEqualTo(3);
        assertThat(poller.sleeps).containsExactly(25L, 25L);
    }

    @Test
    void timesOutWithLastSnapshot() {
        UUID jobId = UUID.randomUUID();
        when(jobQueryService.findStatus(jobId)).thenReturn(snapshot(jobId, JobStatus.PROCESSING));

        PollResult result = poller.pollUntilTerminal(jobId, 10, 4);

        assertThat(result.getOutcome()).isEqualTo(Outcome.TIMED_OUT);
        assertThat(result.getSnapshot().getStatus()).isEqualTo(JobStatus.PROCESSING);
        verify(jobQueryService, times(4)).findStatus(jobId);
        assertThat(poller.sleeps).hasSize(3);
    }

    @Test
    void unknownJobIsReportedNotFound() {
        UUID jobId = UUID.randomUUID();
        when(jobQueryService.findStatus(jobId)).thenReturn(Optional.empty());

        PollResult result = poller.pollUntilTerminal(jobId, 10, 5);

        assertThat(result.getOutcome()).isEqualTo(Outcome.NOT_FOUND);
        assertThat(result.getSnapshot()).isNull();
        assertThat(poller.sleeps).isEmpty();
    }

    @Test
    void pollsSeveralJobsRoundRobinAndKeepsOrder() {
        UUID fast = UUID.randomUUID();
        UUID slow = UUID.randomUUID();
        when(jobQueryService.findStatus(fast)).thenReturn(snapshot(fast, JobStatus.ERROR));
        when(jobQueryService.findStatus(slow)).thenReturn(
                snapshot(slow, JobStatus.PENDING), snapshot(slow, JobStatus.DONE));

        Map<UUID, PollResult> results = poller.pollAllUntilTerminal(List.of(slow, fast), 10, 5);

        assertThat(results.keySet()).containsExactly(slow, fast);
        assertThat(results.get(fast).getSnapshot().getStatus()).isEqualTo(JobStatus.ERROR);
        assertThat(results.get(slow).getSnapshot().getStatus()).isEqualTo(JobStatus.DONE);
        verify(jobQueryService, times(1)).findStatus(fast);
    }

    @Test
    void rejectsNonPositiveAttemptCeiling() {
        assertThatThrownBy(() -> poller.pollUntilTerminal(UUID.randomUUID(), 10, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static class RecordingPoller extends JobStatusPoller {
        private final List<Long> sleeps = new ArrayList<>();

        RecordingPoller(JobQueryService jobQueryService) {
            super(jobQueryService);
        }

        @Override
        protected boolean sleep(long millis) {
            sleeps.add(millis);
            return true;
        }
    }
}
