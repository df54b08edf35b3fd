package com.myorg.docinsight.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A positioned run of text with font metadata, as produced by the extraction collaborator.
 * <p>
 * {@code top} is measured from the top edge of the page; {@code page} is 1-based.
 * {@code pageHeight} is optional (0 when unknown).
 */
@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
public class TextFragment {

    private final String text;

    private final float fontSize;

    private final boolean bold;

    private final float top;

    private final int page;

    private final String documentId;

    private final float pageHeight;

    public int length() {
        return text == null ? 0 : text.length();
    }
}
