package com.myorg.docinsight.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Structure-only result for a single document.
 */
@Getter
@Builder
@ToString
public class DocumentOutline {

    @JsonProperty("title")
    private final String title;

    @JsonProperty("outline")
    private final List<OutlineEntry> outline;

    public List<OutlineEntry> getOutline() {
        return outline == null ? List.of() : List.copyOf(outline);
    }
}
