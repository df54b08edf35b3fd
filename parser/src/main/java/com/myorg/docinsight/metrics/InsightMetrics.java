package com.myorg.docinsight.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Counters of one structuring run, logged at the end of the run and kept by the pipeline.
 */
@Getter
@Builder
@ToString
public class InsightMetrics {

    @JsonProperty("documents")
    private final int documents;

    @JsonProperty("failed_documents")
    private final int failedDocuments;

    @JsonProperty("pages")
    private final int pages;

    @JsonProperty("fragments")
    private final int fragments;

    @JsonProperty("headings")
    private final int headings;

    @JsonProperty("sections")
    private final int sections;

    @JsonProperty("elapsed_ms")
    private final long elapsedMs;

    public static InsightMetrics none() {
        return InsightMetrics.builder().build();
    }
}
