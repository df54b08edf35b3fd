package com.myorg.docinsight.service.ranking;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.docinsight.model.PersonaCategory;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a {@link PersonaVocabulary} from JSON:
 * <pre>
 * {
 *   "generic_weight": 0.2,
 *   "categories": {
 *     "analyst": { "signature": ["analyst", "investment"], "terms": { "revenue": 1.0 } }
 *   }
 * }
 * </pre>
 * Locations use Spring resource syntax ({@code classpath:}, {@code file:}).
 */
@Slf4j
public class PersonaVocabularyLoader {

    private final ObjectMapper mapper;
    private final ResourceLoader resourceLoader;

    public PersonaVocabularyLoader(ObjectMapper mapper) {
        this(mapper, new DefaultResourceLoader());
    }

    public PersonaVocabularyLoader(ObjectMapper mapper, ResourceLoader resourceLoader) {
        this.mapper = mapper;
        this.resourceLoader = resourceLoader;
    }

    public PersonaVocabulary load(String location) throws IOException {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new FileNotFoundException("Persona vocabulary not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            PersonaVocabulary vocabulary = load(in);
            log.info("Loaded persona vocabulary from {} ({} categories)", location, vocabulary.getCategories().size());
            return vocabulary;
        }
    }

    public PersonaVocabulary load(InputStream in) throws IOException {
        VocabularyFile file = mapper.readValue(in, VocabularyFile.class);
        Map<PersonaCategory, PersonaVocabulary.CategoryEntry> entries = new EnumMap<>(PersonaCategory.class);
        for (Map.Entry<String, CategoryFile> e : file.getCategories().entrySet()) {
            PersonaCategory category = parseCategory(e.getKey());
            CategoryFile c = e.getValue() == null ? new CategoryFile() : e.getValue();
            entries.put(category, PersonaVocabulary.CategoryEntry.builder()
                    .signatureKeywords(c.getSignature())
                    .terms(c.getTerms())
                    .build());
        }
        try {
            return new PersonaVocabulary(entries, file.getGenericWeight());
        } catch (IllegalArgumentException ex) {
            throw new IOException("Invalid persona vocabulary: " + ex.getMessage(), ex);
        }
    }

    private static PersonaCategory parseCategory(String key) throws IOException {
        try {
            return PersonaCategory.valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IOException("Unknown persona category in vocabulary: " + key, ex);
        }
    }

    @Getter
    @Setter
    static class VocabularyFile {
        @JsonProperty("generic_weight")
        private double genericWeight = 0.2;

        @JsonProperty("categories")
        private Map<String, CategoryFile> categories = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    static class CategoryFile {
        @JsonProperty("signature")
        private List<String> signature = new ArrayList<>();

        @JsonProperty("terms")
        private Map<String, Double> terms = new LinkedHashMap<>();
    }
}
