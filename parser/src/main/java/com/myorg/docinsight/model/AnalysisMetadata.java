package com.myorg.docinsight.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@Builder
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisMetadata {

    @JsonProperty("input_documents")
    private final List<String> inputDocuments;

    @JsonProperty("persona")
    private final String persona;

    @JsonProperty("job_to_be_done")
    private final String jobToBeDone;

    @JsonProperty("question")
    private final String question;

    @JsonProperty("persona_category")
    private final PersonaCategory personaCategory;

    // ISO-8601, UTC
    @JsonProperty("processing_timestamp")
    private final String processingTimestamp;

    public List<String> getInputDocuments() {
        return inputDocuments == null ? List.of() : List.copyOf(inputDocuments);
    }
}
