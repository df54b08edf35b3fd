package com.myorg.docinsight.model;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Raw (possibly fractional) term frequencies of a persona + job query. IDF weighting is applied
 * against a specific section index at scoring time.
 */
@Getter
@ToString
public class QueryVector {

    private final Map<String, Double> termFrequencies;

    public QueryVector(Map<String, Double> termFrequencies) {
        this.termFrequencies = Collections.unmodifiableMap(new TreeMap<>(termFrequencies));
    }

    public boolean isEmpty() {
        return termFrequencies.isEmpty();
    }

    public boolean contains(String term) {
        return termFrequencies.containsKey(term);
    }
}
