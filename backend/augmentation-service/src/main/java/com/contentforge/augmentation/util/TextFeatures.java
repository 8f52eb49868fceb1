package com.contentforge.augmentation.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Token derivation shared by claims and evidence items, so both sides of a match
 * speak the same vocabulary.
 */
public final class TextFeatures {

    private static final String SCALE = "(?:\\s*(?:trillion|billion|million|thousand|k)\\b)?";
    private static final String AMOUNT = "\\d+(?:,\\d{3})*(?:\\.\\d+)?";

    private static final List<Pattern> NUMBER_PATTERNS = List.of(
            Pattern.compile("\\d+(?:\\.\\d+)?%"),                                   // percentages
            Pattern.compile("\\$" + AMOUNT + SCALE, Pattern.CASE_INSENSITIVE),      // money
            Pattern.compile(AMOUNT + SCALE, Pattern.CASE_INSENSITIVE),              // plain / scaled
            Pattern.compile("\\d+(?:\\.\\d+)?x\\b", Pattern.CASE_INSENSITIVE),      // multipliers
            Pattern.compile("\\b(?:19|20)\\d{2}\\b")                                // years
    );

    private static final List<Pattern> DATE_PATTERNS = List.of(
            Pattern.compile("\\b(?:19|20)\\d{2}\\b"),
            Pattern.compile("\\b(?:in|during|by)\\s+(?:19|20)\\d{2}\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:January|February|March|April|May|June|July|August|September"
                    + "|October|November|December)\\s+(?:19|20)\\d{2}\\b", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern WORD = Pattern.compile("\\b[a-z]{3,}\\b");
    private static final Pattern NON_NUMERIC = Pattern.compile("[^\\d.]");

    private static final Set<String> STOPWORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for",
            "of", "with", "by", "from", "up", "about", "into", "through", "during",
            "is", "are", "was", "were", "be", "been", "being", "have", "has", "had",
            "do", "does", "did", "will", "would", "could", "should", "may", "might",
            "this", "that", "these", "those", "there", "their", "they", "them", "its"
    );

    private TextFeatures() {}

    /** Percentages, money, scaled amounts, multipliers and years, first occurrence order. */
    public static List<String> numbers(String text) {
        return collect(text, NUMBER_PATTERNS);
    }

    /** Years, "in/during/by YYYY" phrases and "Month YYYY" phrases. */
    public static List<String> dates(String text) {
        return collect(text, DATE_PATTERNS);
    }

    /**
     * Lower-cased alphabetic tokens of 3+ characters without stopwords.
     *
     * @param limit maximum number of distinct keywords kept
     */
    public static List<String> keywords(String text, int limit) {
        if (text == null || text.isBlank()) return List.of();
        LinkedHashSet<String> out = new LinkedHashSet<>();
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find() && out.size() < limit) {
            String w = m.group();
            if (!STOPWORDS.contains(w)) out.add(w);
        }
        return new ArrayList<>(out);
    }

    /** "$1,200 million" -> "1200", "25%" -> "25". Empty when nothing numeric remains. */
    public static String normalizeNumber(String raw) {
        if (raw == null) return "";
        String n = NON_NUMERIC.matcher(raw).replaceAll("");
        while (n.endsWith(".")) {
            n = n.substring(0, n.length() - 1);
        }
        return n;
    }

    private static List<String> collect(String text, List<Pattern> patterns) {
        if (text == null || text.isBlank()) return List.of();
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (Pattern p : patterns) {
            Matcher m = p.matcher(text);
            while (m.find()) {
                out.add(m.group().strip());
            }
        }
        return new ArrayList<>(out);
    }
}
