package com.myorg.docinsight.service.text;

import java.util.List;

/**
 * Pure tokenization functions used by ranking and synthesis. Implementations must be stateless
 * and thread-safe; the returned lists may be iterated any number of times.
 */
public interface TextTokenizer {

    /**
     * Index terms of {@code text} in order of appearance: normalized, stop words removed.
     */
    List<String> terms(String text);

    /**
     * Sentences of {@code text} in order, trimmed, never blank.
     */
    List<String> sentences(String text);

    /**
     * Normalizes a single vocabulary word to its index form, or returns null if it is not indexable.
     */
    String normalizeTerm(String word);
}
