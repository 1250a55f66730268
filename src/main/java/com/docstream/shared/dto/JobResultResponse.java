package com.docstream.shared.dto;

import com.docstream.shared.model.DocumentJob;
import com.docstream.shared.model.JobStatus;
import com.docstream.shared.model.PageMarkdown;

import java.util.List;
import java.util.UUID;

/**
 * DTO for the result of a finished job.
 */
public class JobResultResponse {

    private UUID jobId;
    private JobStatus status;
    private String parser;
    private Integer pageCount;
    private String summaryMd;
    private List<PageMarkdown> perPageMarkdown;

    public JobResultResponse() {
    }

    public static JobResultResponse from(DocumentJob job) {
        JobResultResponse response = new JobResultResponse();
        response.setJobId(job.getJobUuid());
        response.setStatus(job.getStatus());
        response.setParser(job.getParser());
        response.setPageCount(job.getPageCount());
        response.setSummaryMd(job.getSummaryMd());
        response.setPerPageMarkdown(job.getPerPageMarkdown() != null ? job.getPerPageMarkdown() : List.of());
        return response;
    }

    public UUID getJobId() {
        return jobId;
    }

    public void setJobId(UUID jobId) {
        this.jobId = jobId;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public String getParser() {
        return parser;
    }

    public void setParser(String parser) {
        this.parser = parser;
    }

    public Integer getPageCount() {
        return pageCount;
    }

    public void setPageCount(Integer pageCount) {
        this.pageCount = pageCount;
    }

    public String getSummaryMd() {
        return summaryMd;
    }

    public void setSummaryMd(String summaryMd) {
        this.summaryMd = summaryMd;
    }

    public List<PageMarkdown> getPerPageMarkdown() {
        return perPageMarkdown;
    }

    public void setPerPageMarkdown(List<PageMarkdown> perPageMarkdown) {
        this.perPageMarkdown = perPageMarkdown;
    }
}
