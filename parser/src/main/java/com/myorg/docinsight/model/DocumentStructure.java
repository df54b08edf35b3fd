package com.myorg.docinsight.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Query-independent structure of one document: its title, outline and the level of every fragment.
 */
@Getter
@Builder
@ToString(exclude = "fragments")
public class DocumentStructure {

    private final String documentId;

    private final String title;

    private final List<OutlineEntry> outline;

    private final List<ClassifiedFragment> fragments;

    public static DocumentStructure empty(String documentId) {
        return DocumentStructure.builder()
                .documentId(documentId)
                .title(documentId)
                .outline(List.of())
                .fragments(List.of())
                .build();
    }

    public DocumentOutline toOutline() {
        return DocumentOutline.builder()
                .title(title)
                .outline(outline)
                .build();
    }

    public List<OutlineEntry> getOutline() {
        return outline == null ? List.of() : List.copyOf(outline);
    }

    public List<ClassifiedFragment> getFragments() {
        return fragments == null ? List.of() : List.copyOf(fragments);
    }
}
