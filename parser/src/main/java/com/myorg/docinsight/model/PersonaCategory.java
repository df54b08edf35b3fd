package com.myorg.docinsight.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PersonaCategory {
    RESEARCHER,
    STUDENT,
    ANALYST,
    JOURNALIST,
    BUSINESS,
    GENERIC;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
