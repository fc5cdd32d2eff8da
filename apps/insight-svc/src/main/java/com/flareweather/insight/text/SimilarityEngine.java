package com.flareweather.insight.text;

import com.flareweather.insight.config.InsightProperties;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Decides whether two fragments say the same thing closely enough that showing both would read as
 * repetition. Symmetric in its arguments.
 */
@Component
public class SimilarityEngine {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}']+");
    private static final Pattern PUNCTUATION = Pattern.compile("\\p{Punct}+");
    private static final int MIN_WORD_LENGTH = 3;

    private final double containmentRatio;
    private final double wordOverlap;

    public SimilarityEngine(InsightProperties properties) {
        this.containmentRatio = properties.similarity().containmentRatio();
        this.wordOverlap = properties.similarity().wordOverlap();
    }

    public boolean areSimilar(String a, String b) {
        String first = normalize(a);
        String second = normalize(b);

        if (first.equals(second)) {
            return true;
        }

        if (!first.isEmpty() && !second.isEmpty()) {
            String longer = first.length() >= second.length() ? first : second;
            String shorter = first.length() >= second.length() ? second : first;
            if (longer.contains(shorter) && (double) shorter.length() / longer.length() > containmentRatio) {
                return true;
            }
        }

        Set<String> words1 = words(first);
        Set<String> words2 = words(second);
        if (words1.isEmpty() || words2.isEmpty()) {
            return false;
        }
        Set<String> intersection = new HashSet<>(words1);
        intersection.retainAll(words2);
        Set<String> union = new HashSet<>(words1);
        union.addAll(words2);
        return (double) intersection.size() / union.size() > wordOverlap;
    }

    /**
     * {@link #areSimilar(String, String)} after dropping punctuation from both sides.
     */
    public boolean areSimilarIgnoringPunctuation(String a, String b) {
        return areSimilar(stripPunctuation(a), stripPunctuation(b));
    }

    public static String stripPunctuation(String text) {
        if (text == null) {
            return "";
        }
        return PUNCTUATION.matcher(text).replaceAll("").trim();
    }

    private static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
    }

    private static Set<String> words(String normalized) {
        return Arrays.stream(NON_WORD.split(normalized))
                .filter(word -> word.length() >= MIN_WORD_LENGTH)
                .collect(Collectors.toSet());
    }
}
