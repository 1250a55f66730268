package com.docstream.api;

import com.docstream.ingestion.IngestionGateway;
import com.docstream.ingestion.SourceFile;
import com.docstream.jobs.JobQueryService;
import com.docstream.shared.dto.JobResultResponse;
import com.docstream.shared.dto.JobStatusResponse;
import com.docstream.shared.dto.UploadResponse;
import com.docstream.shared.error.InfrastructureException;
import com.docstream.shared.model.JobStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Documents", description = "Document upload, status and result endpoints")
public class DocumentController {

    private static final Logger logger = LoggerFactory.getLogger(DocumentController.class);

    private final IngestionGateway ingestionGateway;
    private final JobQueryService jobQueryService;

    public DocumentController(IngestionGateway ingestionGateway, JobQueryService jobQueryService) {
        this.ingestionGateway = ingestionGateway;
        this.jobQueryService = jobQueryService;
    }

    @PostMapping("/upload")
    @Operation(summary = "Upload a PDF for parsing and summarization",
               description = "Queues the document and returns a job id immediately; processing is asynchronous")
    public ResponseEntity<UploadResponse> upload(
            @Parameter(description = "PDF file to upload")
            @RequestParam("file") MultipartFile file,
            @Parameter(description = "Parser to use: simple, gemini or placeholder")
            @RequestParam(value = "parser", defaultValue = "simple") String parser) {

        logger.info("Received upload request: filename={}, size={}, parser={}",
                file.getOriginalFilename(), file.getSize(), parser);

        UUID jobId = ingestionGateway.submit(readSource(file), parser);
        UploadResponse response = new UploadResponse(jobId, JobStatus.PENDING,
                "Document uploaded successfully. Processing will begin shortly.");
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @GetMapping("/status/{jobId}")
    @Operation(summary = "Get job status", description = "Reads the current job snapshot from the job store")
    public JobStatusResponse status(
            @Parameter(description = "Job id returned from the upload endpoint")
            @PathVariable("jobId") String jobId) {
        return jobQueryService.status(jobId);
    }

    @GetMapping("/result/{jobId}")
    @Operation(summary = "Get job result",
               description = "Returns parsed pages and summary once the job is done. "
                       + "Answers 202 while the job is still running and 422 with the stored error when it failed.")
    public JobResultResponse result(
            @Parameter(description = "Job id returned from the upload endpoint")
            @PathVariable("jobId") String jobId) {
        return jobQueryService.result(jobId);
    }

    static SourceFile readSource(MultipartFile file) {
        try {
            return SourceFile.from(file);
        } catch (IOException e) {
            throw new InfrastructureException("Failed to read uploaded file " + file.getOriginalFilename(), e);
        }
    }
}
