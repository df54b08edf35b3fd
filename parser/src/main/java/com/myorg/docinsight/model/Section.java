package com.myorg.docinsight.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Body text owned by one heading of a document (or the whole document when no heading exists).
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Section {

    @JsonProperty("document")
    private final String documentId;

    @JsonProperty("section_title")
    private final String sectionTitle;

    @JsonProperty("start_page")
    private final int startPage;

    @JsonProperty("end_page")
    private final int endPage;

    @JsonProperty("content")
    private final String bodyText;

    @JsonProperty("level")
    private final HeadingLevel headingLevel;

    /**
     * Position of the owning document in the input collection.
     */
    @JsonProperty("document_ordinal")
    private final int documentOrdinal;

    /**
     * Position of this section inside its document, starting at 0.
     */
    @JsonProperty("section_ordinal")
    private final int sectionOrdinal;

    public boolean hasBody() {
        return bodyText != null && !bodyText.isBlank();
    }
}
