package com.myorg.docinsight.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One detected heading of a document outline, in document order.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutlineEntry {

    @JsonProperty("level")
    private final HeadingLevel level;

    @JsonProperty("text")
    private final String text;

    @JsonProperty("page")
    private final int page;
}
