package com.myorg.docinsight.service.ranking;

import com.myorg.docinsight.model.PersonaCategory;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Lookup table behind persona resolution: per category, the keywords that identify it in a role
 * string and the weighted terms it adds to a query. Loaded from configuration, never hard-coded.
 */
@Getter
@ToString
public class PersonaVocabulary {

    @Getter
    @ToString
    public static class CategoryEntry {
        private final List<String> signatureKeywords;
        private final Map<String, Double> terms;

        @Builder
        public CategoryEntry(@Singular List<String> signatureKeywords, @Singular Map<String, Double> terms) {
            this.signatureKeywords = List.copyOf(signatureKeywords);
            this.terms = Collections.unmodifiableMap(new TreeMap<>(terms));
        }
    }

    private final Map<PersonaCategory, CategoryEntry> categories;

    /** Weight given to every term of the generic profile. */
    private final double genericWeight;

    public PersonaVocabulary(Map<PersonaCategory, CategoryEntry> categories, double genericWeight) {
        if (genericWeight <= 0 || genericWeight > 1) {
            throw new IllegalArgumentException("genericWeight must be in (0,1]: " + genericWeight);
        }
        Map<PersonaCategory, CategoryEntry> copy = new EnumMap<>(PersonaCategory.class);
        copy.putAll(categories);
        copy.forEach((category, entry) -> entry.getTerms().forEach((term, weight) -> {
            if (weight == null || weight <= 0 || weight > 1) {
                throw new IllegalArgumentException(
                        "Weight of '" + term + "' in " + category.key() + " must be in (0,1]: " + weight);
            }
        }));
        this.categories = Collections.unmodifiableMap(copy);
        this.genericWeight = genericWeight;
    }

    public CategoryEntry entryFor(PersonaCategory category) {
        CategoryEntry entry = categories.get(category);
        return entry != null ? entry : CategoryEntry.builder().build();
    }
}
