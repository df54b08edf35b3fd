package com.myorg.docinsight.service.processing;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Text shapes that usually start or make up a heading.
 */
public final class HeadingPatterns {

    // "1.", "1.2", "1.2.3 Title", "3.2: Title"
    private static final Pattern NUMBERED = Pattern.compile("^\\d{1,3}(?:(?:\\.\\d{1,3})+[.:]?|[.:)])(?:\\s+\\S.*)?$");

    // "1 Introduction"; the capital keeps "2023 revenue grew" out
    private static final Pattern NUMBER_TITLE = Pattern.compile("^\\d{1,3}(?:\\.\\d{1,3})*\\s+\\p{Lu}.*$");

    private static final Pattern CHAPTER = Pattern.compile(
            "^(chapter|section|part|appendix)\\s+([0-9]+|[ivxlc]+|[a-z])\\b.*", Pattern.CASE_INSENSITIVE);

    private static final Pattern ROMAN = Pattern.compile("^[IVXLC]+[.)](?:\\s+\\S.*)?$");

    // numbered headings in other scripts: "第3章", "問 2", "제1장", "الفصل 4", "פרק 2", "अध्याय 5"
    private static final Pattern SCRIPT_NUMBERED = Pattern.compile("^(?:"
            + "第\\s*[\\p{Nd}一二三四五六七八九十百]+\\s*[章節节部編篇]"
            + "|(?:問題|问题|質問|問)\\s*\\p{Nd}+"
            + "|(?:문제|질문)\\s*\\p{Nd}+"
            + "|제\\s*\\p{Nd}+\\s*[장절]"
            + "|(?:ال)?(?:سؤال|فصل|قسم)\\s*\\p{Nd}+"
            + "|(?:שאלה|פרק|חלק)\\s*\\p{Nd}+"
            + "|(?:प्रश्न|अध्याय|भाग)\\s*\\p{Nd}+"
            + ").*$");

    private static final Pattern HAS_LETTER = Pattern.compile(".*\\p{L}.*");

    private static final Set<String> STANDARD_HEADINGS = Set.of(
            "ABSTRACT", "INTRODUCTION", "BACKGROUND", "RELATED WORK", "METHODOLOGY", "METHODS",
            "EXPERIMENTAL SETUP", "RESULTS", "ANALYSIS", "DISCUSSION", "CONCLUSION", "CONCLUSIONS",
            "REFERENCES", "BIBLIOGRAPHY", "ACKNOWLEDGMENTS", "ACKNOWLEDGEMENTS", "APPENDIX", "SUMMARY",
            "OVERVIEW", "TABLE OF CONTENTS", "CONTENTS", "GENERAL INSTRUCTIONS", "INSTRUCTIONS");

    private HeadingPatterns() {}

    /**
     * True for numbered or chapter/section style prefixes, Roman numeral items and the numbered
     * chapter, section and question markers of CJK, Korean, Arabic, Hebrew and Devanagari text.
     */
    public static boolean isNumbered(String text) {
        if (text == null) return false;
        String t = text.trim();
        return NUMBERED.matcher(t).matches()
                || NUMBER_TITLE.matcher(t).matches()
                || CHAPTER.matcher(t).matches()
                || ROMAN.matcher(t).matches()
                || SCRIPT_NUMBERED.matcher(t).matches();
    }

    /**
     * True for short all-caps text such as "INTRODUCTION" or "RISK FACTORS".
     */
    public static boolean isShortAllCaps(String text, int maxWords) {
        if (text == null) return false;
        String t = text.trim();
        if (t.length() < 3 || !HAS_LETTER.matcher(t).matches()) return false;
        if (t.split("\\s+").length > maxWords) return false;
        return t.equals(t.toUpperCase(Locale.ROOT)) && !t.equals(t.toLowerCase(Locale.ROOT));
    }

    /**
     * Well-known section names ("Abstract", "References", "2. Results"...), any case.
     */
    public static boolean isStandardHeading(String text) {
        if (text == null) return false;
        String t = text.trim()
                .replaceFirst("^\\d+(?:\\.\\d+)*[.:)]?\\s+", "")
                .replaceAll("[:.]$", "")
                .toUpperCase(Locale.ROOT);
        return STANDARD_HEADINGS.contains(t);
    }

    public static boolean matches(String text, int maxCapsWords) {
        return isNumbered(text) || isShortAllCaps(text, maxCapsWords) || isStandardHeading(text);
    }
}
