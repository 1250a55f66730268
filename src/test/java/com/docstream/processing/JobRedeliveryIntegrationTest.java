package com.docstream.processing;

import com.docstream.TestPdfFactory;
import com.docstream.ingestion.IngestionGateway;
import com.docstream.ingestion.SourceFile;
import com.docstream.jobs.ClaimDecision;
import com.docstream.jobs.JobStateStore;
import com.docstream.observability.JobMetrics;
import com.docstream.queue.ClaimedEntry;
import com.docstream.queue.JobStreamQueue;
import com.docstream.shared.model.DocumentJob;
import com.docstream.shared.model.JobStatus;
import com.docstream.shared.model.PageMarkdown;
import com.docstream.shared.repository.ConsumerGroupRepository;
import com.docstream.shared.repository.PendingEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.NoSuchBeanDefinitionException;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.postgresql.PostgreSQLContainer;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Crash recovery with workers disabled: claims are driven by hand so a consumer can "die" mid-job.
 * The visibility timeout is 2s in the test profile.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers
class JobRedeliveryIntegrationTest {

    private static final Duration CLAIM_TIMEOUT = Duration.ofSeconds(2);
    private static final long PAST_VISIBILITY_TIMEOUT_MS = 2500;

    @Container
    @SuppressWarnings("resource")
    static final PostgreSQLContainer postgres = new PostgreSQLContainer("postgres:15-alpine")
            .withDatabaseName("docstream_test")
            .withUsername("postgres")
            .withPassword("postgres");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private IngestionGateway ingestionGateway;

    @Autowired
    private JobStreamQueue jobStreamQueue;

    @Autowired
    private JobStateStore jobStateStore;

    @Autowired
    private JobProcessor jobProcessor;

    @Autowired
    private PendingEntryRepository pendingEntryRepository;

    @Autowired
    private ConsumerGroupRepository consumerGroupRepository;

    @Autowired
    private JobMetrics jobMetrics;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private PendingEntryReaper reaper;

    @BeforeEach
    void setUp() {
        reaper = new PendingEntryReaper(pendingEntryRepository, consumerGroupRepository, jobStateStore, jobMetrics,
                transactionManager, jobStreamQueue.getStreamName(), jobStreamQueue.getGroupName(), 2, 3, 50);
    }

    private void reap() {
        reaper.reapStaleClaims();
    }

    private UUID submit(String filename, String... pages) throws Exception {
        return ingestionGateway.submit(new SourceFile(filename, TestPdfFactory.pdfWithPages(pages)), "simple");
    }

    @Test
    void crashedConsumersEntryIsRedeliveredAndFinishedByAnother() throws Exception {
        UUID jobId = submit("crash.pdf", "Page one", "Page two");

        ClaimedEntry crashed = jobStreamQueue.claimNext("crashed-consumer", CLAIM_TIMEOUT).orElseThrow();
        assertThat(crashed.getJobUuid()).isEqualTo(jobId);
        assertThat(jobStateStore.beginProcessing(jobId, "crashed-consumer", crashed.getDeliveryAttempt()))
                .isEqualTo(ClaimDecision.PROCEED);

        // Nothing else can take the entry while the claim is fresh.
        assertThat(jobStreamQueue.claimNext("healthy-consumer", Duration.ofMillis(200))).isEmpty();

        Thread.sleep(PAST_VISIBILITY_TIMEOUT_MS);
        reap();

        ClaimedEntry redelivered = jobStreamQueue.claimNext("healthy-consumer", CLAIM_TIMEOUT).orElseThrow();
        assertThat(redelivered.getJobUuid()).isEqualTo(jobId);
        assertThat(redelivered.getDeliveryAttempt()).isEqualTo(2);

        jobProcessor.process(redelivered);

        DocumentJob job = jobStateStore.find(jobId).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.DONE);
        assertThat(job.getPageCount()).isEqualTo(2);

        // The crashed consumer wakes up late: its writes and its acknowledgment are fenced off.
        assertThat(jobStateStore.finalizeDone(jobId, "crashed-consumer", 1,
                List.of(new PageMarkdown(1, "stale")), "stale")).isFalse();
        assertThat(jobStreamQueue.acknowledge(crashed)).isFalse();
        assertThat(jobStateStore.find(jobId).orElseThrow().getSummaryMd()).isNotEqualTo("stale");
        assertThat(jobStreamQueue.metrics().getPendingCount()).isZero();
    }

    @Test
    void entryThatKeepsFailingIsForceFinalizedAfterMaxAttempts() throws Exception {
        UUID jobId = submit("poison.pdf", "Never finishes");

        for (int attempt = 1; attempt <= 3; attempt++) {
            ClaimedEntry claimed = jobStreamQueue.claimNext("flaky-consumer-" + attempt, CLAIM_TIMEOUT).orElseThrow();
            assertThat(claimed.getJobUuid()).isEqualTo(jobId);
            assertThat(claimed.getDeliveryAttempt()).isEqualTo(attempt);
            jobStateStore.beginProcessing(jobId, claimed.getConsumerId(), claimed.getDeliveryAttempt());

            Thread.sleep(PAST_VISIBILITY_TIMEOUT_MS);
            reap();
        }

        DocumentJob job = jobStateStore.find(jobId).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.ERROR);
        assertThat(job.getErrorMessage()).contains("3 delivery attempts");
        assertThat(jobStreamQueue.metrics().getPendingCount()).isZero();
        assertThat(jobStreamQueue.claimNext("late-consumer", Duration.ofMillis(200))).isEmpty();
    }

    @Test
    void workerBeansAreAbsentWhenWorkerDisabled(ApplicationContext context) {
        assertThatThrownBy(() -> context.getBean(StreamWorkerPool.class))
                .isInstanceOf(NoSuchBeanDefinitionException.class);
        assertThatThrownBy(() -> context.getBean(PendingEntryReaper.class))
                .isInstanceOf(NoSuchBeanDefinitionException.class);
    }
}
