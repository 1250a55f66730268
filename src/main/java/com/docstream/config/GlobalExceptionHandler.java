package com.docstream.config;

import com.docstream.api.validation.DocumentValidationException;
import com.docstream.shared.error.InfrastructureException;
import com.docstream.shared.error.JobFailedException;
import com.docstream.shared.error.JobNotFoundException;
import com.docstream.shared.error.JobNotReadyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        logger.error("Unhandled error", ex);
        Map<String, Object> response = body(ex.getClass().getSimpleName(),
                ex.getMessage() != null ? ex.getMessage() : "An unexpected error occurred");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    @ExceptionHandler(DocumentValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(DocumentValidationException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body("ValidationError", ex.getMessage()));
    }

    @ExceptionHandler({MissingServletRequestPartException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, Object>> handleMissingPart(Exception ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body("ValidationError", ex.getMessage()));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleMaxUploadSizeException(MaxUploadSizeExceededException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body("FileSizeExceeded", "File size exceeds maximum allowed upload size"));
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleJobNotFound(JobNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body("NotFound", ex.getMessage()));
    }

    @ExceptionHandler(JobNotReadyException.class)
    public ResponseEntity<Map<String, Object>> handleJobNotReady(JobNotReadyException ex) {
        Map<String, Object> response = body("NotReady", ex.getMessage());
        response.put("job_id", ex.getJobId().toString());
        response.put("status", ex.getStatus().value());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @ExceptionHandler(JobFailedException.class)
    public ResponseEntity<Map<String, Object>> handleJobFailed(JobFailedException ex) {
        Map<String, Object> response = body("JobFailed", ex.getMessage());
        response.put("job_id", ex.getJobId().toString());
        response.put("status", "error");
        response.put("error_message", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(response);
    }

    @ExceptionHandler({InfrastructureException.class, DataAccessException.class})
    public ResponseEntity<Map<String, Object>> handleInfrastructure(RuntimeException ex) {
        logger.error("Infrastructure failure while handling request", ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(body("InfrastructureError", ex.getMessage()));
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("error", error);
        response.put("message", message);
        response.put("timestamp", Instant.now().toString());
        response.put("traceId", MDC.get("correlationId"));
        return response;
    }
}
