package com.myorg.docinsight.service.ranking;

import com.myorg.docinsight.config.InsightProperties;
import com.myorg.docinsight.model.PersonaCategory;
import com.myorg.docinsight.model.PersonaProfile;
import com.myorg.docinsight.service.text.TextTokenizer;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Nearest-category lookup from a free-text role ("Investment Analyst") to a {@link PersonaProfile}.
 * <p>
 * Each signature keyword found in the role as a whole word adds {@code wholeWordMatchScore}; found
 * only as a substring it adds {@code substringMatchScore}. The best category wins, declaration order
 * breaking ties. Below {@code minCategoryScore} the generic profile is returned: the generic terms,
 * all at the vocabulary's uniform generic weight. Never fails.
 */
@Slf4j
public class PersonaProfileResolver {

    private final InsightProperties.Persona props;
    private final PersonaVocabulary vocabulary;
    private final TextTokenizer tokenizer;

    public PersonaProfileResolver(InsightProperties.Persona props, PersonaVocabulary vocabulary, TextTokenizer tokenizer) {
        this.props = props;
        this.vocabulary = vocabulary;
        this.tokenizer = tokenizer;
    }

    public PersonaProfile resolve(String role) {
        String lowered = role == null ? "" : role.toLowerCase(Locale.ROOT);
        Set<String> words = new HashSet<>(tokenizer.terms(lowered));

        PersonaCategory best = PersonaCategory.GENERIC;
        double bestScore = 0;
        for (PersonaCategory category : PersonaCategory.values()) {
            if (category == PersonaCategory.GENERIC) continue;
            double s = signatureScore(vocabulary.entryFor(category).getSignatureKeywords(), lowered, words);
            if (s > bestScore) {
                best = category;
                bestScore = s;
            }
        }

        if (bestScore < props.getMinCategoryScore()) {
            log.debug("Persona '{}' not recognized (best score {}), using generic", role, bestScore);
            return profileOf(PersonaCategory.GENERIC);
        }
        log.debug("Persona '{}' resolved to {} (score {})", role, best.key(), bestScore);
        return profileOf(best);
    }

    double signatureScore(List<String> keywords, String loweredRole, Set<String> roleTerms) {
        double score = 0;
        for (String keyword : keywords) {
            String kw = keyword.toLowerCase(Locale.ROOT).trim();
            if (kw.isEmpty()) continue;
            String term = tokenizer.normalizeTerm(kw);
            if (term != null && roleTerms.contains(term)) {
                score += props.getWholeWordMatchScore();
            } else if (loweredRole.contains(kw)) {
                score += props.getSubstringMatchScore();
            }
        }
        return score;
    }

    private PersonaProfile profileOf(PersonaCategory category) {
        boolean generic = category == PersonaCategory.GENERIC;
        Map<String, Double> weights = new TreeMap<>();
        vocabulary.entryFor(category).getTerms().forEach((raw, weight) -> {
            String term = tokenizer.normalizeTerm(raw);
            if (term == null) return;
            weights.merge(term, generic ? vocabulary.getGenericWeight() : weight, Math::max);
        });
        return PersonaProfile.builder()
                .category(category)
                .weightedVocabulary(weights)
                .build();
    }
}
