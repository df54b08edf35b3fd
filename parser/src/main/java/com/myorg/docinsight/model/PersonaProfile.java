package com.myorg.docinsight.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical persona category plus its weighted vocabulary (term to weight in (0,1]).
 */
@Getter
@ToString
public class PersonaProfile {

    private final PersonaCategory category;

    private final Map<String, Double> weightedVocabulary;

    @Builder
    public PersonaProfile(PersonaCategory category, Map<String, Double> weightedVocabulary) {
        this.category = category;
        // sorted so that iteration (and therefore query construction) is deterministic
        this.weightedVocabulary = weightedVocabulary == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(weightedVocabulary));
    }

    public double weightOf(String term) {
        return weightedVocabulary.getOrDefault(term, 0.0);
    }
}
