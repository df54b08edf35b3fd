package com.myorg.docinsight.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * One input document: its identifier and its fragments in reading order, page after page.
 */
@Getter
@Builder
@ToString(exclude = "fragments")
public class SourceDocument {

    private final String documentId;

    private final List<TextFragment> fragments;

    public List<TextFragment> getFragments() {
        return fragments == null ? List.of() : fragments;
    }
}
