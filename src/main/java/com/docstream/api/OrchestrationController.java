package com.docstream.api;

import com.docstream.ingestion.SourceFile;
import com.docstream.orchestration.BatchUploadService;
import com.docstream.orchestration.ParserComparisonService;
import com.docstream.shared.dto.BatchUploadResponse;
import com.docstream.shared.dto.ComparisonResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Orchestration", description = "Batch upload and parser comparison")
public class OrchestrationController {

    private final BatchUploadService batchUploadService;
    private final ParserComparisonService parserComparisonService;

    public OrchestrationController(BatchUploadService batchUploadService,
                                   ParserComparisonService parserComparisonService) {
        this.batchUploadService = batchUploadService;
        this.parserComparisonService = parserComparisonService;
    }

    @PostMapping("/upload/batch")
    @Operation(summary = "Upload several PDFs with one parser",
               description = "Each file is queued independently; invalid files are reported inline")
    public ResponseEntity<BatchUploadResponse> uploadBatch(
            @Parameter(description = "PDF files to upload")
            @RequestParam(value = "files", required = false) List<MultipartFile> files,
            @Parameter(description = "Parser to use for every file")
            @RequestParam(value = "parser", defaultValue = "simple") String parser) {

        List<SourceFile> sources = new ArrayList<>();
        if (files != null) {
            for (MultipartFile file : files) {
                sources.add(DocumentController.readSource(file));
            }
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(batchUploadService.uploadBatch(sources, parser));
    }

    @PostMapping("/compare")
    @Operation(summary = "Compare parsers on one PDF",
               description = "Runs the document through every listed parser and waits for all jobs to finish")
    public ComparisonResponse compare(
            @Parameter(description = "PDF file to compare")
            @RequestParam("file") MultipartFile file,
            @Parameter(description = "At least two parsers, repeated or comma-separated")
            @RequestParam(value = "parsers", required = false) List<String> parsers) {

        return parserComparisonService.compare(DocumentController.readSource(file), splitTags(parsers));
    }

    static List<String> splitTags(List<String> values) {
        List<String> tags = new ArrayList<>();
        if (values == null) {
            return tags;
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            for (String part : value.split(",")) {
                if (!part.isBlank()) {
                    tags.add(part.trim());
                }
            }
        }
        return tags;
    }
}
