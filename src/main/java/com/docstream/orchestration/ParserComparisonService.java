package com.docstream.orchestration;

import com.docstream.api.validation.DocumentValidationException;
import com.docstream.ingestion.IngestionGateway;
import com.docstream.ingestion.SourceFile;
import com.docstream.jobs.JobStatusPoller;
import com.docstream.jobs.JobStatusPoller.Outcome;
import com.docstream.jobs.JobStatusPoller.PollResult;
import com.docstream.processing.parser.ParserType;
import com.docstream.shared.dto.ComparisonResponse;
import com.docstream.shared.dto.ComparisonResponse.ParserResult;
import com.docstream.shared.error.InfrastructureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Runs one file through several parsers and waits for every job to finish.
 *
 * <p>Each parser gets its own job, so one parser failing never affects another. Polling is bounded;
 * a job still running when the ceiling is hit is returned with {@code timed_out} set.
 */
@Service
public class ParserComparisonService {

    private static final Logger logger = LoggerFactory.getLogger(ParserComparisonService.class);
    private static final int MIN_PARSERS = 2;

    private final IngestionGateway ingestionGateway;
    private final JobStatusPoller jobStatusPoller;
    private final long pollIntervalMs;
    private final int maxPollAttempts;

    public ParserComparisonService(IngestionGateway ingestionGateway,
                                   JobStatusPoller jobStatusPoller,
                                   @Value("${app.compare.poll-interval-ms:2000}") long pollIntervalMs,
                                   @Value("${app.compare.max-poll-attempts:60}") int maxPollAttempts) {
        this.ingestionGateway = ingestionGateway;
        this.jobStatusPoller = jobStatusPoller;
        this.pollIntervalMs = pollIntervalMs;
        this.maxPollAttempts = maxPollAttempts;
    }

    public ComparisonResponse compare(SourceFile file, List<String> parserTags) {
        List<ParserType> parsers = resolveDistinct(parserTags);

        Map<String, UUID> submitted = new LinkedHashMap<>();
        Map<String, ParserResult> results = new LinkedHashMap<>();
        for (ParserType parser : parsers) {
            results.put(parser.tag(), null);
            try {
                submitted.put(parser.tag(), ingestionGateway.submit(file, parser.tag()));
            } catch (InfrastructureException e) {
                logger.error("Comparison job for parser {} could not be queued", parser.tag(), e);
                results.put(parser.tag(), ParserResult.submissionFailed(e.getMessage()));
            }
        }

        if (!submitted.isEmpty()) {
            Map<UUID, PollResult> polled = jobStatusPoller.pollAllUntilTerminal(
                    submitted.values(), pollIntervalMs, maxPollAttempts);
            for (Map.Entry<String, UUID> entry : submitted.entrySet()) {
                results.put(entry.getKey(), toParserResult(entry.getValue(), polled.get(entry.getValue())));
            }
        }

        logger.info("Comparison finished for {} across parsers {}", file.getFilename(), results.keySet());
        return new ComparisonResponse(file.getFilename(), results);
    }

    /**
     * Canonicalizes tags, keeping request order. Aliases of the same parser count once.
     */
    List<ParserType> resolveDistinct(List<String> parserTags) {
        if (parserTags == null) {
            throw new DocumentValidationException("At least " + MIN_PARSERS + " parsers are required for comparison");
        }
        Set<ParserType> distinct = new LinkedHashSet<>();
        for (String tag : parserTags) {
            if (tag == null || tag.isBlank()) {
                continue;
            }
            distinct.add(ingestionGateway.resolveParser(tag.trim()));
        }
        if (distinct.size() < MIN_PARSERS) {
            throw new DocumentValidationException("At least " + MIN_PARSERS
                    + " distinct parsers are required for comparison");
        }
        return new ArrayList<>(distinct);
    }

    private ParserResult toParserResult(UUID jobId, PollResult poll) {
        if (poll == null || poll.getOutcome() == Outcome.NOT_FOUND) {
            return ParserResult.submissionFailed("Job " + jobId + " disappeared before reaching a terminal state");
        }
        return new ParserResult(poll.getSnapshot(), poll.getOutcome() == Outcome.TIMED_OUT);
    }
}
