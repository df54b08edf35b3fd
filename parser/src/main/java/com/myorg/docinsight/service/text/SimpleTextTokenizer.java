package com.myorg.docinsight.service.text;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex based English tokenizer with a stop-word list and light plural folding
 * ("trends" and "trend" index as the same term).
 */
public class SimpleTextTokenizer implements TextTokenizer {

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{Nd}][\\p{L}\\p{Nd}'-]*");

    // split after . ! ? when followed by whitespace and something that can start a sentence
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])[\"')\\]]*\\s+(?=[\\p{Lu}\\p{Nd}\"'(\\[])");

    private static final Set<String> ABBREVIATIONS = Set.of(
            "e.g.", "i.e.", "et al.", "fig.", "eq.", "vs.", "cf.", "no.", "dr.", "mr.", "mrs.", "ms.", "etc.");

    private static final int MIN_TERM_LENGTH = 2;

    @Override
    public List<String> terms(String text) {
        if (text == null || text.isBlank()) return List.of();
        String n = Normalizer.normalize(text, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        List<String> out = new ArrayList<>();
        Matcher m = WORD.matcher(n);
        while (m.find()) {
            String term = normalizeTerm(m.group());
            if (term != null) out.add(term);
        }
        return out;
    }

    @Override
    public List<String> sentences(String text) {
        if (text == null || text.isBlank()) return List.of();
        String normalized = text.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();

        List<String> out = new ArrayList<>();
        StringBuilder pending = new StringBuilder();
        for (String piece : SENTENCE_BREAK.split(normalized)) {
            if (pending.length() > 0) pending.append(' ');
            pending.append(piece.trim());
            if (endsWithAbbreviation(pending)) continue;
            out.add(pending.toString());
            pending.setLength(0);
        }
        if (pending.length() > 0) out.add(pending.toString());
        out.removeIf(String::isBlank);
        return out;
    }

    @Override
    public String normalizeTerm(String word) {
        if (word == null) return null;
        String w = word.toLowerCase(Locale.ROOT).trim();
        // strip possessives and edge punctuation the word pattern lets through
        w = w.replaceAll("'s$", "").replaceAll("^[-']+|[-']+$", "");
        if (w.length() < MIN_TERM_LENGTH || EnglishStopWords.contains(w)) return null;
        if (w.chars().allMatch(Character::isDigit) && w.length() < 3) return null;
        return fold(w);
    }

    private static String fold(String w) {
        if (w.length() > 4 && w.endsWith("ies")) return w.substring(0, w.length() - 3) + "y";
        if (w.length() > 3 && w.endsWith("s") && !w.endsWith("ss") && !w.endsWith("us") && !w.endsWith("is")) {
            return w.substring(0, w.length() - 1);
        }
        return w;
    }

    private static boolean endsWithAbbreviation(CharSequence sentence) {
        String lower = sentence.toString().toLowerCase(Locale.ROOT);
        for (String abbr : ABBREVIATIONS) {
            if (lower.endsWith(" " + abbr) || lower.equals(abbr)) return true;
        }
        return false;
    }
}
