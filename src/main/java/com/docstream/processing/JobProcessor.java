package com.docstream.processing;

import com.docstream.api.storage.StorageService;
import com.docstream.jobs.ClaimDecision;
import com.docstream.jobs.JobStateStore;
import com.docstream.observability.JobMetrics;
import com.docstream.processing.model.ParsedDocument;
import com.docstream.processing.parser.DocumentParser;
import com.docstream.processing.parser.ParserNotImplementedException;
import com.docstream.processing.parser.ParserRegistry;
import com.docstream.queue.ClaimedEntry;
import com.docstream.queue.JobStreamQueue;
import com.docstream.shared.error.InfrastructureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;

/**
 * Drives one claimed entry to a terminal job state.
 *
 * <p>Order of operations per entry: fencing check and transition to processing, parse, summarize,
 * one terminal write, then acknowledgment. The entry is acknowledged only after the terminal write
 * succeeded, so a crash in between ends in a reclaim that sees the finalized job and skips it.
 * Strategy failures become terminal errors; store or queue failures leave the entry unacknowledged
 * for redelivery. Nothing thrown here reaches the worker loop.
 */
@Service
public class JobProcessor {

    private static final Logger logger = LoggerFactory.getLogger(JobProcessor.class);

    private final JobStateStore jobStateStore;
    private final JobStreamQueue jobStreamQueue;
    private final ParserRegistry parserRegistry;
    private final DocumentSummarizer documentSummarizer;
    private final StorageService storageService;
    private final JobMetrics metrics;
    private final boolean keepTmpFiles;

    public JobProcessor(JobStateStore jobStateStore,
                        JobStreamQueue jobStreamQueue,
                        ParserRegistry parserRegistry,
                        DocumentSummarizer documentSummarizer,
                        StorageService storageService,
                        JobMetrics metrics,
                        @Value("${app.storage.keep-tmp-files:false}") boolean keepTmpFiles) {
        this.jobStateStore = jobStateStore;
        this.jobStreamQueue = jobStreamQueue;
        this.parserRegistry = parserRegistry;
        this.documentSummarizer = documentSummarizer;
        this.storageService = storageService;
        this.metrics = metrics;
        this.keepTmpFiles = keepTmpFiles;
    }

    public void process(ClaimedEntry entry) {
        MDC.put("job_id", entry.getJobUuid().toString());
        MDC.put("consumer_id", entry.getConsumerId());
        long startTime = System.currentTimeMillis();
        try {
            enterStage(PipelineStage.CLAIMED);
            if (entry.isRedelivery()) {
                metrics.recordRedelivery();
                logger.info("Processing redelivered entry {} (delivery attempt {})",
                        entry.getPosition(), entry.getDeliveryAttempt());
            }

            ClaimDecision decision = jobStateStore.beginProcessing(
                    entry.getJobUuid(), entry.getConsumerId(), entry.getDeliveryAttempt());
            switch (decision) {
                case MISSING:
                    logger.warn("No live job record for entry {}; acknowledging without processing", entry.getPosition());
                    acknowledgeAndCleanUp(entry);
                    return;
                case ALREADY_FINALIZED:
                    logger.info("Job already finalized; skipping stale redelivery of entry {}", entry.getPosition());
                    metrics.recordStaleRedelivery();
                    acknowledgeAndCleanUp(entry);
                    return;
                case SUPERSEDED:
                    metrics.recordSupersededClaim();
                    return;
                default:
                    break;
            }

            logger.info("Processing job with parser '{}'", entry.getParser());
            PipelineOutcome outcome = runPipeline(entry);

            enterStage(PipelineStage.FINALIZED);
            boolean written = outcome.isDone()
                    ? jobStateStore.finalizeDone(entry.getJobUuid(), entry.getConsumerId(), entry.getDeliveryAttempt(),
                            outcome.parsed.getPages(), outcome.summary)
                    : jobStateStore.finalizeError(entry.getJobUuid(), entry.getConsumerId(), entry.getDeliveryAttempt(),
                            outcome.errorMessage);
            if (!written) {
                // Another claim owns the job now; its owner acknowledges the entry.
                metrics.recordSupersededClaim();
                return;
            }

            acknowledgeAndCleanUp(entry);
            long durationMs = System.currentTimeMillis() - startTime;
            metrics.recordJobFinalized(entry.getParser(), outcome.isDone() ? "done" : "error", durationMs);
            logger.info("Job finished as {} in {}ms", outcome.isDone() ? "done" : "error", durationMs);
        } catch (InfrastructureException | DataAccessException e) {
            logger.error("Job store or queue failure on entry {}; leaving it for redelivery", entry.getPosition(), e);
        } catch (RuntimeException | Error e) {
            logger.error("Unexpected failure handling entry {}; leaving it for redelivery", entry.getPosition(), e);
        } finally {
            MDC.remove("job_id");
            MDC.remove("consumer_id");
            MDC.remove("stage");
        }
    }

    PipelineOutcome runPipeline(ClaimedEntry entry) {
        Optional<DocumentParser> parser = parserRegistry.resolve(entry.getParser());
        if (parser.isEmpty()) {
            String message = new ParserNotImplementedException(entry.getParser()).getMessage();
            logger.warn("Unrecognized parser tag '{}'", entry.getParser());
            return PipelineOutcome.error(message);
        }

        PipelineStage stage = PipelineStage.PARSING;
        try {
            enterStage(stage);
            ParsedDocument parsed = parser.get().parse(new StoredDocumentSource(storageService, entry.getSourceLocation()));
            logger.info("Parsed {} pages", parsed.getPageCount());

            stage = PipelineStage.SUMMARIZING;
            enterStage(stage);
            String summary = documentSummarizer.summarize(parsed);
            return PipelineOutcome.done(parsed, summary);
        } catch (StrategyException e) {
            logger.warn("Job failed during {}: {}", stage.label(), e.getMessage());
            return PipelineOutcome.error(e.getMessage());
        } catch (RuntimeException | Error e) {
            // Errors from a strategy (StackOverflowError on deeply nested PDFs) still end the job.
            logger.error("Unexpected error during {}", stage.label(), e);
            return PipelineOutcome.error("Unexpected error during " + stage.label() + ": " + e.getMessage());
        }
    }

    private void acknowledgeAndCleanUp(ClaimedEntry entry) {
        if (!jobStreamQueue.acknowledge(entry)) {
            return;
        }
        if (keepTmpFiles) {
            logger.debug("Keeping source document {}", entry.getSourceLocation());
            return;
        }
        try {
            storageService.deleteFile(entry.getSourceLocation());
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to delete source document {}: {}", entry.getSourceLocation(), e.getMessage());
        }
    }

    private void enterStage(PipelineStage stage) {
        MDC.put("stage", stage.label());
        logger.debug("Entering stage {}", stage.label());
    }

    static final class PipelineOutcome {
        private final ParsedDocument parsed;
        private final String summary;
        private final String errorMessage;

        private PipelineOutcome(ParsedDocument parsed, String summary, String errorMessage) {
            this.parsed = parsed;
            this.summary = summary;
            this.errorMessage = errorMessage;
        }

        static PipelineOutcome done(ParsedDocument parsed, String summary) {
            return new PipelineOutcome(parsed, summary, null);
        }

        static PipelineOutcome error(String message) {
            return new PipelineOutcome(null, null, message != null ? message : "Processing failed");
        }

        boolean isDone() {
            return errorMessage == null;
        }

        String getErrorMessage() {
            return errorMessage;
        }
    }
}
