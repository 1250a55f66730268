package com.docstream.jobs;

import com.docstream.shared.dto.JobResultResponse;
import com.docstream.shared.dto.JobStatusResponse;
import com.docstream.shared.error.JobFailedException;
import com.docstream.shared.error.JobNotFoundException;
import com.docstream.shared.error.JobNotReadyException;
import com.docstream.shared.model.DocumentJob;
import com.docstream.shared.model.JobStatus;
import com.docstream.shared.model.PageMarkdown;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobQueryServiceTest {

    @Mock
    private JobStateStore jobStateStore;

    private JobQueryService jobQueryService;
    private UUID jobId;

    @BeforeEach
    void setUp() {
        jobQueryService = new JobQueryService(jobStateStore);
        jobId = UUID.randomUUID();
    }

    @Test
    void statusReturnsSnapshot() {
        DocumentJob job = new DocumentJob(jobId, "gemini");
        job.setFilename("report.pdf");
        when(jobStateStore.find(jobId)).thenReturn(Optional.of(job));

        JobStatusResponse status = jobQueryService.status(jobId.toString());

        assertThat(status.getJobId()).isEqualTo(jobId);
        assertThat(status.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(status.getParser()).isEqualTo("gemini");
        assertThat(status.getFilename()).isEqualTo("report.pdf");
        assertThat(status.isTerminal()).isFalse();
    }

    @Test
    void compactHexIdIsAccepted() {
        when(jobStateStore.find(jobId)).thenReturn(Optional.of(new DocumentJob(jobId, "simple")));

        JobStatusResponse status = jobQueryService.status(jobId.toString().replace("-", ""));

        assertThat(status.getJobId()).isEqualTo(jobId);
    }

    @Test
    void malformedIdIsNotFoundWithoutStoreAccess() {
        assertThatThrownBy(() -> jobQueryService.status("not-a-job"))
                .isInstanceOf(JobNotFoundException.class)
                .hasMessage("Job not found: not-a-job");
        assertThatThrownBy(() -> jobQueryService.status("1-2-3-4-5"))
                .isInstanceOf(JobNotFoundException.class);
        verifyNoInteractions(jobStateStore);
    }

    @Test
    void unknownOrExpiredJobIsNotFound() {
        when(jobStateStore.find(jobId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> jobQueryService.status(jobId.toString()))
                .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void resultOfDoneJobHasPagesInOrder() {
        DocumentJob job = new DocumentJob(jobId, "simple");
        job.markProcessing("worker-1", 1, Instant.now());
        job.complete(List.of(new PageMarkdown(1, "# Page 1"), new PageMarkdown(2, "# Page 2")), "## Summary",
                Instant.now(), Duration.ofHours(1));
        when(jobStateStore.find(jobId)).thenReturn(Optional.of(job));

        JobResultResponse result = jobQueryService.result(jobId.toString());

        assertThat(result.getPageCount()).isEqualTo(2);
        assertThat(result.getSummaryMd()).isEqualTo("## Summary");
        assertThat(result.getPerPageMarkdown()).extracting(PageMarkdown::getPageNumber).containsExactly(1, 2);
    }

    @Test
    void resultOfRunningJobIsNotReady() {
        DocumentJob job = new DocumentJob(jobId, "simple");
        job.markProcessing("worker-1", 1, Instant.now());
        when(jobStateStore.find(jobId)).thenReturn(Optional.of(job));

        assertThatThrownBy(() -> jobQueryService.result(jobId.toString()))
                .isInstanceOf(JobNotReadyException.class)
                .hasMessageContaining("still processing");
    }

    @Test
    void resultOfFailedJobCarriesStoredMessage() {
        DocumentJob job = new DocumentJob(jobId, "placeholder");
        job.fail("Parser 'placeholder' is not implemented. Use 'simple' or 'gemini' instead.",
                Instant.now(), Duration.ofHours(1));
        when(jobStateStore.find(jobId)).thenReturn(Optional.of(job));

        assertThatThrownBy(() -> jobQueryService.result(jobId.toString()))
                .isInstanceOf(JobFailedException.class)
                .hasMessage("Parser 'placeholder' is not implemented. Use 'simple' or 'gemini' instead.");
    }
}
