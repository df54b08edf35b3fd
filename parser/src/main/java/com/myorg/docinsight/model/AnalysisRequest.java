package com.myorg.docinsight.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Query half of a persona-ranking run. The documents are supplied separately through the index.
 */
@Getter
@Builder
@ToString
public class AnalysisRequest {

    private final String persona;

    private final String jobToBeDone;

    // optional
    private final String question;

    // optional cap on extracted_sections; null means all
    private final Integer limit;
}
