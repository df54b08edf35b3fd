package com.myorg.docinsight.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Structural role of a fragment. Declaration order is nesting order: TITLE outranks H1, and so on.
 */
public enum HeadingLevel {
    TITLE("Title"),
    H1("H1"),
    H2("H2"),
    H3("H3"),
    BODY("Body");

    private final String label;

    HeadingLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public int depth() {
        return ordinal();
    }

    public boolean isHeading() {
        return this != BODY;
    }

    public boolean outranks(HeadingLevel other) {
        return ordinal() < other.ordinal();
    }

    /** Heading level for a nesting depth of 1..3; anything deeper is BODY. */
    public static HeadingLevel ofDepth(int depth) {
        switch (depth) {
            case 0:
                return TITLE;
            case 1:
                return H1;
            case 2:
                return H2;
            case 3:
                return H3;
            default:
                return BODY;
        }
    }
}
