package com.myorg.docinsight.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder(toBuilder = true)
@ToString
public class ClassifiedFragment {

    private final TextFragment fragment;

    private final HeadingLevel level;

    // composite heading score, see HeadingScorer
    private final int score;

    public String getText() {
        return fragment.getText();
    }

    public int getPage() {
        return fragment.getPage();
    }
}
