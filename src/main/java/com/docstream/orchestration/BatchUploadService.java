package com.docstream.orchestration;

import com.docstream.api.validation.DocumentValidationException;
import com.docstream.ingestion.IngestionGateway;
import com.docstream.ingestion.SourceFile;
import com.docstream.processing.parser.ParserType;
import com.docstream.shared.dto.BatchUploadResponse;
import com.docstream.shared.dto.BatchUploadResponse.FileResult;
import com.docstream.shared.error.InfrastructureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Fans a list of files out to independent ingestion calls. A failing file is reported inline
 * and never rolls back the files accepted before it.
 */
@Service
public class BatchUploadService {

    private static final Logger logger = LoggerFactory.getLogger(BatchUploadService.class);

    private final IngestionGateway ingestionGateway;

    public BatchUploadService(IngestionGateway ingestionGateway) {
        this.ingestionGateway = ingestionGateway;
    }

    public BatchUploadResponse uploadBatch(List<SourceFile> files, String parserTag) {
        if (files == null || files.isEmpty()) {
            throw new DocumentValidationException("No files provided");
        }
        ParserType parser = ingestionGateway.resolveParser(parserTag);

        List<FileResult> results = new ArrayList<>(files.size());
        for (SourceFile file : files) {
            String filename = file.getFilename() != null ? file.getFilename() : "unknown";
            try {
                UUID jobId = ingestionGateway.submit(file, parser.tag());
                results.add(FileResult.accepted(filename, jobId));
            } catch (DocumentValidationException | InfrastructureException e) {
                logger.warn("Batch file {} rejected: {}", filename, e.getMessage());
                results.add(FileResult.rejected(filename, e.getMessage()));
            }
        }

        BatchUploadResponse response = new BatchUploadResponse(results);
        logger.info("Batch upload finished: parser={}, total={}, successful={}, failed={}",
                parser.tag(), response.getTotalFiles(), response.getSuccessful(), response.getFailed());
        return response;
    }
}
