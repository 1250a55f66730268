package com.docstream.shared.model;

import java.util.Objects;

/**
 * Markdown for one page of a parsed document. Stored inside the job row as JSON.
 */
public class PageMarkdown {

    private int pageNumber;
    private String contentMd;

    public PageMarkdown() {
    }

    public PageMarkdown(int pageNumber, String contentMd) {
        this.pageNumber = pageNumber;
        this.contentMd = contentMd;
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public void setPageNumber(int pageNumber) {
        this.pageNumber = pageNumber;
    }

    public String getContentMd() {
        return contentMd;
    }

    public void setContentMd(String contentMd) {
        this.contentMd = contentMd;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PageMarkdown)) {
            return false;
        }
        PageMarkdown that = (PageMarkdown) o;
        return pageNumber == that.pageNumber && Objects.equals(contentMd, that.contentMd);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pageNumber, contentMd);
    }
}
