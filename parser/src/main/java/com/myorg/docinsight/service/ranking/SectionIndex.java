package com.myorg.docinsight.service.ranking;

import com.myorg.docinsight.model.Section;
import com.myorg.docinsight.service.text.TextTokenizer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable TF-IDF vector space over every section of one document collection. The IDF unit is a
 * section, not a file. Built once with {@link #build}, then shared read-only by concurrent queries.
 * <p>
 * IDF is smoothed, {@code ln((1 + N) / (1 + df)) + 1}, so terms present in every section still count
 * and query terms unseen in the corpus get a finite weight.
 */
@Slf4j
public final class SectionIndex {

    private static final SectionIndex EMPTY =
            new SectionIndex(List.of(), List.of(), Map.of(), List.of(), new double[0], List.of(), new double[0]);

    private final List<String> documentIds;
    private final List<Section> sections;
    private final Map<String, Double> idf;
    private final List<Map<String, Double>> vectors;
    private final double[] norms;
    private final List<Set<String>> distinctTerms;
    private final double[] positionFractions;

    private SectionIndex(List<String> documentIds,
                         List<Section> sections,
                         Map<String, Double> idf,
                         List<Map<String, Double>> vectors,
                         double[] norms,
                         List<Set<String>> distinctTerms,
                         double[] positionFractions) {
        this.documentIds = documentIds;
        this.sections = sections;
        this.idf = idf;
        this.vectors = vectors;
        this.norms = norms;
        this.distinctTerms = distinctTerms;
        this.positionFractions = positionFractions;
    }

    public static SectionIndex empty() {
        return EMPTY;
    }

    public static SectionIndex build(List<Section> sections, TextTokenizer tokenizer) {
        List<String> ids = new ArrayList<>();
        if (sections != null) {
            sections.stream().map(Section::getDocumentId).distinct().forEach(ids::add);
        }
        return build(ids, sections, tokenizer);
    }

    /**
     * @param documentIds every input document in collection order, including those without sections
     */
    public static SectionIndex build(List<String> documentIds, List<Section> sections, TextTokenizer tokenizer) {
        if (sections == null || sections.isEmpty()) {
            if (documentIds == null || documentIds.isEmpty()) return EMPTY;
            return new SectionIndex(List.copyOf(documentIds), List.of(), Map.of(), List.of(), new double[0], List.of(), new double[0]);
        }

        int n = sections.size();
        List<Map<String, Integer>> termCounts = new ArrayList<>(n);
        Map<String, Integer> documentFrequency = new HashMap<>();
        for (Section s : sections) {
            Map<String, Integer> tf = new LinkedHashMap<>();
            for (String term : tokenizer.terms(s.getSectionTitle())) tf.merge(term, 1, Integer::sum);
            for (String term : tokenizer.terms(s.getBodyText())) tf.merge(term, 1, Integer::sum);
            termCounts.add(tf);
            for (String term : tf.keySet()) documentFrequency.merge(term, 1, Integer::sum);
        }

        Map<String, Double> idf = new HashMap<>(documentFrequency.size());
        documentFrequency.forEach((term, df) -> idf.put(term, smoothedIdf(n, df)));

        List<Map<String, Double>> vectors = new ArrayList<>(n);
        List<Set<String>> distinct = new ArrayList<>(n);
        double[] norms = new double[n];
        for (int i = 0; i < n; i++) {
            Map<String, Double> vector = new LinkedHashMap<>();
            double sumSq = 0;
            for (Map.Entry<String, Integer> e : termCounts.get(i).entrySet()) {
                double w = e.getValue() * idf.get(e.getKey());
                vector.put(e.getKey(), w);
                sumSq += w * w;
            }
            vectors.add(Collections.unmodifiableMap(vector));
            distinct.add(Collections.unmodifiableSet(new LinkedHashSet<>(vector.keySet())));
            norms[i] = Math.sqrt(sumSq);
        }

        SectionIndex index = new SectionIndex(documentIds == null ? List.of() : List.copyOf(documentIds), List.copyOf(sections), Collections.unmodifiableMap(idf),
                List.copyOf(vectors), norms, List.copyOf(distinct), positionFractions(sections));
        log.debug("Built section index: {} sections, {} terms", n, idf.size());
        return index;
    }

    private static double smoothedIdf(int sectionCount, int df) {
        return Math.log((1.0 + sectionCount) / (1.0 + df)) + 1.0;
    }

    /**
     * 0 for the first section of a document, 1 for the last; 0 when the document has one section.
     */
    private static double[] positionFractions(List<Section> sections) {
        Map<String, Integer> perDocument = new HashMap<>();
        for (Section s : sections) perDocument.merge(documentKey(s), 1, Integer::sum);
        Map<String, Integer> seen = new HashMap<>();
        double[] fractions = new double[sections.size()];
        for (int i = 0; i < sections.size(); i++) {
            String key = documentKey(sections.get(i));
            int count = perDocument.get(key);
            int position = seen.merge(key, 1, Integer::sum) - 1;
            fractions[i] = count <= 1 ? 0.0 : (double) position / (count - 1);
        }
        return fractions;
    }

    private static String documentKey(Section s) {
        return s.getDocumentOrdinal() + "|" + s.getDocumentId();
    }

    public int size() {
        return sections.size();
    }

    public boolean isEmpty() {
        return sections.isEmpty();
    }

    public List<String> getDocumentIds() {
        return documentIds;
    }

    public List<Section> getSections() {
        return sections;
    }

    public Section section(int i) {
        return sections.get(i);
    }

    public double idf(String term) {
        Double v = idf.get(term);
        return v != null ? v : smoothedIdf(sections.size(), 0);
    }

    public Map<String, Double> vector(int i) {
        return vectors.get(i);
    }

    public double norm(int i) {
        return norms[i];
    }

    public Set<String> distinctTerms(int i) {
        return distinctTerms.get(i);
    }

    public double positionFraction(int i) {
        return positionFractions[i];
    }
}
