package com.myorg.docinsight.service.processing;

import com.myorg.docinsight.model.ClassifiedFragment;
import com.myorg.docinsight.model.DocumentStructure;
import com.myorg.docinsight.model.HeadingLevel;
import com.myorg.docinsight.model.Section;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups classified fragments into sections: every heading opens a section, body text is appended
 * to the open one. Text before the first heading goes into an implicit section named after the
 * document title, so sections never overlap and always cover the whole document.
 */
@Slf4j
public class SectionAssembler {

    public List<Section> assemble(DocumentStructure structure, int documentOrdinal) {
        List<ClassifiedFragment> fragments = structure.getFragments();
        if (fragments.isEmpty()) return List.of();

        List<Section> sections = new ArrayList<>();
        OpenSection open = null;

        for (ClassifiedFragment cf : fragments) {
            if (cf.getLevel().isHeading()) {
                if (open != null) sections.add(open.close(sections.size()));
                open = new OpenSection(structure.getDocumentId(), documentOrdinal,
                        cf.getText(), cf.getLevel(), cf.getPage());
                continue;
            }
            if (open == null) {
                open = new OpenSection(structure.getDocumentId(), documentOrdinal,
                        structure.getTitle(), HeadingLevel.BODY, cf.getPage());
            }
            open.append(cf);
        }
        if (open != null) sections.add(open.close(sections.size()));

        log.debug("{}: assembled {} section(s)", structure.getDocumentId(), sections.size());
        return sections;
    }

    private static final class OpenSection {
        private final String documentId;
        private final int documentOrdinal;
        private final String title;
        private final HeadingLevel level;
        private final int startPage;
        private int endPage;
        private final StringBuilder body = new StringBuilder();

        OpenSection(String documentId, int documentOrdinal, String title, HeadingLevel level, int page) {
            this.documentId = documentId;
            this.documentOrdinal = documentOrdinal;
            this.title = title;
            this.level = level;
            this.startPage = page;
            this.endPage = page;
        }

        void append(ClassifiedFragment cf) {
            if (body.length() > 0) body.append(' ');
            body.append(cf.getText());
            endPage = Math.max(endPage, cf.getPage());
        }

        Section close(int sectionOrdinal) {
            return Section.builder()
                    .documentId(documentId)
                    .sectionTitle(title)
                    .startPage(startPage)
                    .endPage(endPage)
                    .bodyText(body.toString())
                    .headingLevel(level)
                    .documentOrdinal(documentOrdinal)
                    .sectionOrdinal(sectionOrdinal)
                    .build();
        }
    }
}
