package com.myorg.docinsight;

import com.myorg.docinsight.model.TextFragment;

/**
 * Test fixtures for positioned fragments on a US Letter page.
 */
public final class Fragments {

    public static final float PAGE_HEIGHT = 792f;

    private Fragments() {}

    public static TextFragment line(String documentId, String text, float size, boolean bold, float top, int page) {
        return TextFragment.builder()
                .documentId(documentId)
                .text(text)
                .fontSize(size)
                .bold(bold)
                .top(top)
                .page(page)
                .pageHeight(PAGE_HEIGHT)
                .build();
    }

    public static TextFragment body(String documentId, String text, float top, int page) {
        return line(documentId, text, 10f, false, top, page);
    }
}
