package com.docstream.queue;

import com.docstream.jobs.ClaimDecision;
import com.docstream.jobs.JobStateStore;
import com.docstream.shared.model.DocumentJob;
import com.docstream.shared.model.JobStatus;
import com.docstream.shared.model.PageMarkdown;
import com.docstream.shared.model.PendingEntry;
import com.docstream.shared.repository.ConsumerGroupRepository;
import com.docstream.shared.repository.PendingEntryRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.postgresql.PostgreSQLContainer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Several consumers racing on the same group against a real Postgres. Every claim commits in its own
 * transaction, so row locks and SKIP LOCKED behave as they do in production.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers
class ConcurrentClaimIntegrationTest {

    private static final String GROUP = "race_group";
    private static final int CONSUMERS = 6;
    private static final int ENTRIES = 60;

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
    private ConsumerGroupClaimService claimService;

    @Autowired
    private JobStateStore jobStateStore;

    @Autowired
    private PendingEntryRepository pendingEntryRepository;

    @Autowired
    private ConsumerGroupRepository consumerGroupRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private ExecutorService executor;
    private String stream;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(CONSUMERS);
        stream = "race_" + UUID.randomUUID();
        claimService.ensureStreamGroup(stream, GROUP);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void racingConsumersClaimEveryEntryExactlyOnce() throws Exception {
        for (int i = 0; i < ENTRIES; i++) {
            claimService.append(stream, UUID.randomUUID(), "simple", "local://race/" + i);
        }

        Map<Long, String> owners = new ConcurrentHashMap<>();
        List<Long> doubleClaims = new CopyOnWriteArrayList<>();
        drainConcurrently(owners, doubleClaims, 1);

        assertThat(doubleClaims).isEmpty();
        assertThat(owners).hasSize(ENTRIES);
        assertThat(owners.keySet()).containsExactlyInAnyOrderElementsOf(positions(1, ENTRIES));
        QueueMetrics metrics = claimService.snapshot(stream, GROUP);
        assertThat(metrics.getPendingCount()).isEqualTo(ENTRIES);
        assertThat(metrics.getGroupCursor()).isEqualTo(ENTRIES);
        assertThat(metrics.getPendingByConsumer().values().stream().mapToLong(Long::longValue).sum())
                .isEqualTo(ENTRIES);
    }

    @Test
    void racingConsumersReclaimEachReleasedEntryExactlyOnce() throws Exception {
        for (int i = 0; i < ENTRIES; i++) {
            claimService.append(stream, UUID.randomUUID(), "simple", "local://race/" + i);
        }
        while (claimService.claimNext(stream, GROUP, "first-owner").isPresent()) {
            // drain
        }
        Long groupId = consumerGroupRepository.findIdByName(stream, GROUP).orElseThrow();
        new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
            for (PendingEntry claim : pendingEntryRepository.findAll()) {
                if (groupId.equals(claim.getGroupId())) {
                    claim.release();
                }
            }
        });

        Map<Long, String> owners = new ConcurrentHashMap<>();
        List<Long> doubleClaims = new CopyOnWriteArrayList<>();
        drainConcurrently(owners, doubleClaims, 2);

        assertThat(doubleClaims).isEmpty();
        assertThat(owners.keySet()).containsExactlyInAnyOrderElementsOf(positions(1, ENTRIES));
        assertThat(claimService.snapshot(stream, GROUP).getPendingByConsumer()).doesNotContainKey("first-owner");
    }

    @Test
    void racingDeliveriesOfOneJobLandExactlyOneTerminalWrite() throws Exception {
        for (int round = 0; round < 20; round++) {
            UUID jobId = UUID.randomUUID();
            jobStateStore.createPending(jobId, "simple", "race.pdf", "local://race/" + jobId, 100);

            CountDownLatch start = new CountDownLatch(1);
            Future<Boolean> first = executor.submit(deliver(start, jobId, "consumer-a", 1));
            Future<Boolean> second = executor.submit(deliver(start, jobId, "consumer-b", 2));
            start.countDown();
            boolean firstWrote = first.get(10, TimeUnit.SECONDS);
            boolean secondWrote = second.get(10, TimeUnit.SECONDS);

            assertThat(firstWrote ^ secondWrote).as("round %d: exactly one terminal write", round).isTrue();
            DocumentJob job = jobStateStore.find(jobId).orElseThrow();
            assertThat(job.getStatus()).isEqualTo(JobStatus.DONE);
            assertThat(job.getOwnerConsumer()).isEqualTo(firstWrote ? "consumer-a" : "consumer-b");
            assertThat(job.getSummaryMd()).isEqualTo("summary from " + job.getOwnerConsumer());
        }
    }

    private Callable<Boolean> deliver(CountDownLatch start, UUID jobId, String consumerId, int attempt) {
        return () -> {
            start.await();
            if (jobStateStore.beginProcessing(jobId, consumerId, attempt) != ClaimDecision.PROCEED) {
                return false;
            }
            return jobStateStore.finalizeDone(jobId, consumerId, attempt,
                    List.of(new PageMarkdown(1, "page by " + consumerId)), "summary from " + consumerId);
        };
    }

    private void drainConcurrently(Map<Long, String> owners, List<Long> doubleClaims, int expectedAttempt)
            throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> results = new ArrayList<>();
        for (int i = 0; i < CONSUMERS; i++) {
            String consumerId = "consumer-" + i;
            results.add(executor.submit(() -> {
                start.await();
                int claimed = 0;
                Optional<ClaimedEntry> next;
                while ((next = claimService.claimNext(stream, GROUP, consumerId)).isPresent()) {
                    ClaimedEntry entry = next.get();
                    assertThat(entry.getDeliveryAttempt()).isEqualTo(expectedAttempt);
                    if (owners.putIfAbsent(entry.getPosition(), consumerId) != null) {
                        doubleClaims.add(entry.getPosition());
                    }
                    claimed++;
                }
                return claimed;
            }));
        }
        start.countDown();

        int total = 0;
        for (Future<Integer> result : results) {
            total += result.get(30, TimeUnit.SECONDS);
        }
        assertThat(total).isEqualTo(ENTRIES);
    }

    private static List<Long> positions(long from, long to) {
        List<Long> positions = new ArrayList<>();
        for (long p = from; p <= to; p++) {
            positions.add(p);
        }
        return positions;
    }
}
