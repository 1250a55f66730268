package com.docstream.ingestion;

import com.docstream.api.storage.StorageService;
import com.docstream.api.validation.DocumentValidationException;
import com.docstream.api.validation.PdfValidator;
import com.docstream.jobs.JobStateStore;
import com.docstream.observability.JobMetrics;
import com.docstream.processing.parser.ParserType;
import com.docstream.queue.JobStreamQueue;
import com.docstream.shared.error.InfrastructureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.UUID;

/**
 * Accepts a document for asynchronous processing and returns its job id without waiting.
 *
 * <p>The job record and its queue entry are written in one transaction: either both exist or
 * neither does. The source file is stored first and removed again if that transaction fails.
 */
@Service
public class IngestionGateway {

    private static final Logger logger = LoggerFactory.getLogger(IngestionGateway.class);
    private static final String PDF_CONTENT_TYPE = "application/pdf";

    private final PdfValidator pdfValidator;
    private final StorageService storageService;
    private final JobStateStore jobStateStore;
    private final JobStreamQueue jobStreamQueue;
    private final TransactionTemplate transactionTemplate;
    private final JobMetrics metrics;

    public IngestionGateway(PdfValidator pdfValidator,
                            StorageService storageService,
                            JobStateStore jobStateStore,
                            JobStreamQueue jobStreamQueue,
                            PlatformTransactionManager transactionManager,
                            JobMetrics metrics) {
        this.pdfValidator = pdfValidator;
        this.storageService = storageService;
        this.jobStateStore = jobStateStore;
        this.jobStreamQueue = jobStreamQueue;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.metrics = metrics;
    }

    /**
     * Resolves a parser tag to its canonical form.
     *
     * @throws DocumentValidationException for unknown tags
     */
    public ParserType resolveParser(String parserTag) {
        return ParserType.fromTag(parserTag)
                .orElseThrow(() -> new DocumentValidationException("Unknown parser: '" + parserTag
                        + "'. Supported parsers: " + ParserType.supportedTags()));
    }

    /**
     * @throws DocumentValidationException when the file or parser is invalid; no job is created
     * @throws InfrastructureException when storage, the job store or the queue is unavailable
     */
    public UUID submit(SourceFile file, String parserTag) {
        ParserType parser = resolveParser(parserTag);
        pdfValidator.validate(file.getFilename(), file.getContent());

        UUID jobId = UUID.randomUUID();
        MDC.put("job_id", jobId.toString());
        try {
            String location;
            try {
                location = storageService.uploadFile(jobId, file.getFilename(),
                        new ByteArrayInputStream(file.getContent()), PDF_CONTENT_TYPE);
            } catch (IOException e) {
                logger.error("Failed to store uploaded document {}", file.getFilename(), e);
                throw new InfrastructureException("Failed to store uploaded document", e);
            }

            try {
                long position = transactionTemplate.execute(status -> {
                    jobStateStore.createPending(jobId, parser.tag(), file.getFilename(), location, file.getSize());
                    return jobStreamQueue.append(jobId, parser.tag(), location);
                });
                logger.info("Job queued: filename={}, parser={}, position={}", file.getFilename(), parser.tag(), position);
            } catch (RuntimeException e) {
                deleteStoredSource(location);
                logger.error("Failed to record and queue job for {}", file.getFilename(), e);
                if (e instanceof InfrastructureException) {
                    throw e;
                }
                throw new InfrastructureException("Failed to queue job for processing", e);
            }

            metrics.recordJobSubmitted(parser.tag());
            return jobId;
        } finally {
            MDC.remove("job_id");
        }
    }

    private void deleteStoredSource(String location) {
        try {
            storageService.deleteFile(location);
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to remove stored source {} after ingestion failure: {}", location, e.getMessage());
        }
    }
}
