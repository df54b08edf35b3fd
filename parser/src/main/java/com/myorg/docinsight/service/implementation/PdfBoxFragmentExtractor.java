package com.myorg.docinsight.service.implementation;

import com.myorg.docinsight.model.TextFragment;
import com.myorg.docinsight.service.FragmentExtractor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDFontDescriptor;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * PDFBox based {@link FragmentExtractor}: one fragment per text line the stripper emits, carrying
 * the line's largest font size, a bold flag from the font name or descriptor, the distance of its
 * baseline from the top of the page and the page height.
 */
@Slf4j
public class PdfBoxFragmentExtractor implements FragmentExtractor {

    @Override
    public List<TextFragment> extract(File pdfFile, String documentId) throws IOException {
        Objects.requireNonNull(pdfFile, "pdfFile must not be null");
        if (!pdfFile.exists()) throw new IOException("PDF file does not exist: " + pdfFile.getAbsolutePath());

        try (PDDocument document = PDDocument.load(pdfFile)) {
            FragmentStripper stripper = new FragmentStripper(documentId);
            stripper.setStartPage(1);
            stripper.setEndPage(document.getNumberOfPages());
            // output goes to the fragment list; the text itself is discarded
            stripper.writeText(document, new StringWriter());
            log.info("Extracted {} fragments from {} ({} pages)",
                    stripper.fragments.size(), pdfFile.getName(), document.getNumberOfPages());
            return stripper.fragments;
        }
    }

    static boolean isBold(PDFont font) {
        if (font == null) return false;
        String name = font.getName() == null ? "" : font.getName().toLowerCase(Locale.ROOT);
        if (name.contains("bold") || name.contains("black") || name.contains("heavy") || name.contains("semibold")) {
            return true;
        }
        PDFontDescriptor descriptor = font.getFontDescriptor();
        return descriptor != null && (descriptor.isForceBold() || descriptor.getFontWeight() >= 700f);
    }

    /**
     * The base stripper hands over one word at a time; words are collected until the line separator
     * (or the end of the page) and then emitted as a single fragment.
     */
    private static final class FragmentStripper extends PDFTextStripper {

        private final String documentId;
        private final List<TextFragment> fragments = new ArrayList<>();

        private final StringBuilder lineText = new StringBuilder();
        private final List<TextPosition> linePositions = new ArrayList<>();

        FragmentStripper(String documentId) throws IOException {
            super();
            this.documentId = documentId;
            setSortByPosition(true);
        }

        @Override
        protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
            if (text == null || text.isEmpty()) return;
            lineText.append(text);
            linePositions.addAll(textPositions);
        }

        @Override
        protected void writeWordSeparator() throws IOException {
            if (lineText.length() > 0) lineText.append(' ');
        }

        @Override
        protected void writeLineSeparator() throws IOException {
            flushLine();
        }

        @Override
        protected void endPage(PDPage page) throws IOException {
            flushLine();
            super.endPage(page);
        }

        private void flushLine() {
            String text = lineText.toString().replaceAll("\\s+", " ").trim();
            List<TextPosition> positions = new ArrayList<>(linePositions);
            lineText.setLength(0);
            linePositions.clear();
            if (text.isEmpty() || positions.isEmpty()) return;

            float size = 0f;
            boolean bold = false;
            float top = Float.MAX_VALUE;
            for (TextPosition pos : positions) {
                size = Math.max(size, pos.getFontSizeInPt());
                bold |= isBold(pos.getFont());
                top = Math.min(top, pos.getYDirAdj());
            }

            PDPage page = getCurrentPage();
            PDRectangle box = page == null ? null : page.getMediaBox();
            fragments.add(TextFragment.builder()
                    .text(text)
                    .fontSize(size)
                    .bold(bold)
                    .top(top)
                    .page(getCurrentPageNo())
                    .documentId(documentId)
                    .pageHeight(box == null ? 0f : box.getHeight())
                    .build());
        }
    }
}
