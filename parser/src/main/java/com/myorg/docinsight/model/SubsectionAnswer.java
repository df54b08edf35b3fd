package com.myorg.docinsight.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
@EqualsAndHashCode
public class SubsectionAnswer {

    @JsonProperty("document")
    private final String documentId;

    @JsonProperty("section_title")
    private final String sectionTitle;

    @JsonProperty("refined_text")
    private final String refinedText;

    @JsonProperty("page_number")
    private final int page;
}
