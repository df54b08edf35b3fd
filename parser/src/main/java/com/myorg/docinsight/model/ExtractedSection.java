package com.myorg.docinsight.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Output view of a {@link RankedSection}.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class ExtractedSection {

    @JsonProperty("document")
    private final String document;

    @JsonProperty("page_number")
    private final int page;

    @JsonProperty("section_title")
    private final String sectionTitle;

    @JsonProperty("importance_rank")
    private final int importanceRank;

    public static ExtractedSection of(RankedSection ranked) {
        Section s = ranked.getSection();
        return ExtractedSection.builder()
                .document(s.getDocumentId())
                .page(s.getStartPage())
                .sectionTitle(s.getSectionTitle())
                .importanceRank(ranked.getImportanceRank())
                .build();
    }
}
