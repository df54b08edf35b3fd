package com.myorg.docinsight.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Persona-ranking result. {@code truncated} is set when the soft deadline cut work short.
 */
@Getter
@Builder
@ToString
public class AnalysisResult {

    @JsonProperty("metadata")
    private final AnalysisMetadata metadata;

    @JsonProperty("extracted_sections")
    private final List<ExtractedSection> extractedSections;

    @JsonProperty("subsection_analysis")
    private final List<SubsectionAnswer> subsectionAnalysis;

    // the first answers joined into one reply, framed for the persona category
    @JsonProperty("answer")
    private final String answer;

    // best section score of the ranking, 0 when nothing matched
    @JsonProperty("confidence")
    private final double confidence;

    @JsonProperty("truncated")
    private final boolean truncated;

    public List<ExtractedSection> getExtractedSections() {
        return extractedSections == null ? List.of() : List.copyOf(extractedSections);
    }

    public List<SubsectionAnswer> getSubsectionAnalysis() {
        return subsectionAnalysis == null ? List.of() : List.copyOf(subsectionAnalysis);
    }
}
